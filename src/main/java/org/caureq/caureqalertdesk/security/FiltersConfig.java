package org.caureq.caureqalertdesk.security;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FiltersConfig {

    @Bean
    public FilterRegistrationBean<ApiKeyFilter> apiKeyFilterRegistration(ApiKeyFilter f) {
        var reg = new FilterRegistrationBean<>(f);
        reg.setOrder(5);
        reg.addUrlPatterns("/api/alerts", "/api/alerts/*");
        return reg;
    }

    @Bean
    public FilterRegistrationBean<ApiKeyAdminFilter> adminFilterRegistration(ApiKeyAdminFilter f) {
        var reg = new FilterRegistrationBean<>(f);
        reg.setOrder(10);
        reg.addUrlPatterns("/api/admin/*");
        return reg;
    }
}
