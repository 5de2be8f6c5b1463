package org.caureq.caureqalertdesk;

import org.caureq.caureqalertdesk.config.AdminProps;
import org.caureq.caureqalertdesk.config.AppProps;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({AppProps.class, AdminProps.class})
public class CaureqAlertDeskApplication {

    public static void main(String[] args) {
        SpringApplication.run(CaureqAlertDeskApplication.class, args);
    }

}
