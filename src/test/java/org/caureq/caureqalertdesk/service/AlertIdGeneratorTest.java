package org.caureq.caureqalertdesk.service;

import org.caureq.caureqalertdesk.domain.AlertSequence;
import org.caureq.caureqalertdesk.domain.SourceType;
import org.caureq.caureqalertdesk.repo.AlertSequenceRepo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

// Runs against the PostgreSQL-mode database so the native upsert is exercised; counters commit in their own transaction.
@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@TestPropertySource(properties = "spring.datasource.url=jdbc:h2:mem:alertids;DB_CLOSE_DELAY=-1;MODE=PostgreSQL")
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({AlertIdGenerator.class, AlertIdGeneratorTest.FixedClock.class})
class AlertIdGeneratorTest {
    static final Instant NOW = Instant.parse("2031-06-15T08:00:00Z");

    @TestConfiguration
    static class FixedClock {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private AlertIdGenerator ids;

    @Autowired
    private AlertSequenceRepo repo;

    @Autowired
    private PlatformTransactionManager txManager;

    @BeforeEach
    void clean() {
        repo.deleteAll();
    }

    @Test
    @DisplayName("counters start at 1 and run per prefix")
    void countsPerPrefix() {
        assertThat(ids.next(SourceType.OVERSPEEDING)).isEqualTo("OSP-2031-00001");
        assertThat(ids.next(SourceType.OVERSPEEDING)).isEqualTo("OSP-2031-00002");
        assertThat(ids.next(SourceType.SAFETY)).isEqualTo("SAF-2031-00001");

        assertThat(repo.findById("alert_OSP_2031")).get()
                .extracting(AlertSequence::getSequence).isEqualTo(2L);
    }

    @Test
    @DisplayName("a counter row created by another caller is continued, not reset")
    void existingRowIsContinued() {
        repo.saveAndFlush(new AlertSequence("alert_CMP_2031", 41));

        var tx = new TransactionTemplate(txManager);
        Integer inserted = tx.execute(status -> repo.insertIfAbsent("alert_CMP_2031"));
        assertThat(inserted).isZero();

        assertThat(ids.next(SourceType.COMPLIANCE)).isEqualTo("CMP-2031-00042");
    }

    @Test
    @DisplayName("the idempotent insert creates a missing counter at zero")
    void insertCreatesMissingRow() {
        var tx = new TransactionTemplate(txManager);
        Integer inserted = tx.execute(status -> repo.insertIfAbsent("alert_DOC_2031"));

        assertThat(inserted).isEqualTo(1);
        assertThat(repo.findById("alert_DOC_2031")).get()
                .extracting(AlertSequence::getSequence).isEqualTo(0L);
        assertThat(ids.next(SourceType.DOCUMENT_EXPIRY)).isEqualTo("DOC-2031-00001");
    }
}
