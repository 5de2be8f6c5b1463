package org.caureq.caureqalertdesk.engine;

import org.caureq.caureqalertdesk.domain.AlertRecord;
import org.caureq.caureqalertdesk.domain.AlertSeverity;
import org.caureq.caureqalertdesk.domain.AlertStatus;
import org.caureq.caureqalertdesk.domain.MetadataValue;
import org.caureq.caureqalertdesk.domain.RuleConditions;
import org.caureq.caureqalertdesk.domain.SourceType;
import org.caureq.caureqalertdesk.support.InMemoryAlertStore;
import org.caureq.caureqalertdesk.support.InMemoryRuleStore;
import org.caureq.caureqalertdesk.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RuleEngine")
class RuleEngineTest {
    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private MutableClock clock;
    private InMemoryAlertStore alerts;
    private InMemoryRuleStore rules;
    private RuleEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        alerts = new InMemoryAlertStore();
        rules = new InMemoryRuleStore();
        engine = new RuleEngine(alerts, rules, clock);
    }

    private AlertRecord createNow(String id, SourceType type, String entityKey) {
        return alerts.put(InMemoryAlertStore.open(id, type, entityKey, clock.instant()));
    }

    private static RuleConditions escalation(int count, Integer window) {
        return RuleConditions.builder().escalateIfCount(count).windowMins(window).build();
    }

    @Nested
    @DisplayName("escalation")
    class Escalation {

        @Test
        @DisplayName("third overspeeding alert within an hour escalates only the third")
        void thirdAlertWithinWindowEscalates() {
            // given
            rules.add("overspeed_escalation", SourceType.OVERSPEEDING, 1, escalation(3, 60));

            // when
            var a1 = createNow("OSP-2026-00001", SourceType.OVERSPEEDING, "DRV001");
            assertThat(engine.evaluateEscalation(a1)).isEmpty();
            clock.advance(Duration.ofMinutes(10));
            var a2 = createNow("OSP-2026-00002", SourceType.OVERSPEEDING, "DRV001");
            assertThat(engine.evaluateEscalation(a2)).isEmpty();
            clock.advance(Duration.ofMinutes(10));
            var a3 = createNow("OSP-2026-00003", SourceType.OVERSPEEDING, "DRV001");
            var result = engine.evaluateEscalation(a3);

            // then
            assertThat(result).isPresent();
            assertThat(a3.getStatus()).isEqualTo(AlertStatus.ESCALATED);
            assertThat(a3.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
            assertThat(a3.getEscalatedAt()).isEqualTo(T0.plus(Duration.ofMinutes(20)));
            var last = a3.getStateHistory().get(a3.getStateHistory().size() - 1);
            assertThat(last.getFromStatus()).isEqualTo(AlertStatus.OPEN);
            assertThat(last.getToStatus()).isEqualTo(AlertStatus.ESCALATED);
            assertThat(last.getReason()).isEqualTo("3 OVERSPEEDING incidents within 60 minutes");
            assertThat(last.getTriggeredBy()).isEqualTo(RuleEngine.SYSTEM_ACTOR);
            assertThat(last.getRuleTriggered()).isEqualTo("overspeed_escalation");

            assertThat(a1.getStatus()).isEqualTo(AlertStatus.OPEN);
            assertThat(a1.getSeverity()).isEqualTo(AlertSeverity.WARNING);
            assertThat(a1.getStateHistory()).isEmpty();
            assertThat(a2.getStatus()).isEqualTo(AlertStatus.OPEN);
            assertThat(a2.getStateHistory()).isEmpty();
        }

        @Test
        @DisplayName("alerts older than the window do not count")
        void alertsOutsideWindowAreIgnored() {
            rules.add("esc", SourceType.OVERSPEEDING, 1, escalation(3, 60));
            createNow("OSP-2026-00001", SourceType.OVERSPEEDING, "DRV001");
            clock.advance(Duration.ofMinutes(61));
            createNow("OSP-2026-00002", SourceType.OVERSPEEDING, "DRV001");
            clock.advance(Duration.ofMinutes(1));
            var a3 = createNow("OSP-2026-00003", SourceType.OVERSPEEDING, "DRV001");

            assertThat(engine.evaluateEscalation(a3)).isEmpty();
            assertThat(a3.getStatus()).isEqualTo(AlertStatus.OPEN);
        }

        @Test
        @DisplayName("an alert exactly at the window start is counted")
        void windowStartIsInclusive() {
            rules.add("esc", SourceType.OVERSPEEDING, 1, escalation(3, 60));
            createNow("OSP-2026-00001", SourceType.OVERSPEEDING, "DRV001");
            clock.advance(Duration.ofMinutes(30));
            createNow("OSP-2026-00002", SourceType.OVERSPEEDING, "DRV001");
            clock.advance(Duration.ofMinutes(30));
            var a3 = createNow("OSP-2026-00003", SourceType.OVERSPEEDING, "DRV001");

            assertThat(engine.evaluateEscalation(a3)).isPresent();
        }

        @Test
        @DisplayName("alerts for other entities or source types do not count")
        void otherEntitiesAndSourcesAreIgnored() {
            rules.add("esc", SourceType.OVERSPEEDING, 1, escalation(2, 60));
            createNow("OSP-2026-00001", SourceType.OVERSPEEDING, "DRV002");
            createNow("SAF-2026-00001", SourceType.SAFETY, "DRV001");
            var mine = createNow("OSP-2026-00002", SourceType.OVERSPEEDING, "DRV001");

            assertThat(engine.evaluateEscalation(mine)).isEmpty();
        }

        @Test
        @DisplayName("closed alerts in the window still count")
        void terminalAlertsCount() {
            rules.add("esc", SourceType.OVERSPEEDING, 1, escalation(2, 60));
            var old = createNow("OSP-2026-00001", SourceType.OVERSPEEDING, "DRV001");
            engine.resolve(old.getId(), "handled", "ops");
            clock.advance(Duration.ofMinutes(5));
            var next = createNow("OSP-2026-00002", SourceType.OVERSPEEDING, "DRV001");

            assertThat(engine.evaluateEscalation(next)).isPresent();
        }

        @Test
        @DisplayName("evaluating an already escalated alert again is a no-op")
        void escalationIsIdempotent() {
            rules.add("esc", SourceType.OVERSPEEDING, 1, escalation(1, 60));
            var a = createNow("OSP-2026-00001", SourceType.OVERSPEEDING, "DRV001");
            assertThat(engine.evaluateEscalation(a)).isPresent();
            int historySize = a.getStateHistory().size();

            assertThat(engine.evaluateEscalation(a)).isEmpty();
            assertThat(a.getStateHistory()).hasSize(historySize);
            assertThat(alerts.appliedTransitions()).isEqualTo(1);
        }

        @Test
        @DisplayName("an alert without entity key is never escalated")
        void missingEntityKey() {
            rules.add("esc", SourceType.OVERSPEEDING, 1, escalation(1, 60));
            var a = createNow("OSP-2026-00001", SourceType.OVERSPEEDING, null);

            assertThat(engine.evaluateEscalation(a)).isEmpty();
            assertThat(a.getStatus()).isEqualTo(AlertStatus.OPEN);
        }

        @Test
        @DisplayName("malformed rules are skipped, the next well-formed one applies")
        void malformedRuleSkipped() {
            rules.add("broken", SourceType.OVERSPEEDING, 1, escalation(2, null));
            rules.add("good", SourceType.OVERSPEEDING, 2, escalation(2, 60));
            createNow("OSP-2026-00001", SourceType.OVERSPEEDING, "DRV001");
            var a2 = createNow("OSP-2026-00002", SourceType.OVERSPEEDING, "DRV001");

            var result = engine.evaluateEscalation(a2);

            assertThat(result).isPresent();
            assertThat(result.get().ruleTriggered()).isEqualTo("good");
        }

        @Test
        @DisplayName("only the first escalation rule by priority is evaluated")
        void firstMatchByPriority() {
            rules.add("strict", SourceType.OVERSPEEDING, 1, escalation(5, 60));
            rules.add("lenient", SourceType.OVERSPEEDING, 2, escalation(2, 60));
            createNow("OSP-2026-00001", SourceType.OVERSPEEDING, "DRV001");
            var a2 = createNow("OSP-2026-00002", SourceType.OVERSPEEDING, "DRV001");

            assertThat(engine.evaluateEscalation(a2)).isEmpty();
        }
    }

    @Nested
    @DisplayName("auto-close sweep")
    class Sweep {

        @Test
        @DisplayName("metadata flag closes the alert once it becomes true")
        void conditionBecomesTrue() {
            rules.add("doc_valid", SourceType.COMPLIANCE, 1,
                    RuleConditions.builder().autoCloseIf("document_valid").build());
            var a = createNow("CMP-2026-00001", SourceType.COMPLIANCE, "DRV001");
            a.getMetadata().put("document_valid", MetadataValue.ofBoolean(false));

            clock.advance(Duration.ofMinutes(1));
            var first = engine.sweepAutoClose();
            assertThat(first.closed()).isZero();
            assertThat(a.getStatus()).isEqualTo(AlertStatus.OPEN);

            a.getMetadata().put("document_valid", MetadataValue.ofBoolean(true));
            clock.advance(Duration.ofMinutes(1));
            var second = engine.sweepAutoClose();

            assertThat(second.closed()).isEqualTo(1);
            assertThat(a.getStatus()).isEqualTo(AlertStatus.AUTO_CLOSED);
            assertThat(a.getAutoCloseReason()).isEqualTo("condition 'document_valid' satisfied");
            assertThat(a.getClosedAt()).isEqualTo(T0.plus(Duration.ofMinutes(2)));
        }

        @Test
        @DisplayName("expiry rule closes after the configured minutes")
        void expiryRule() {
            rules.add("expire", SourceType.OVERSPEEDING, 1, RuleConditions.builder().expireAfterMins(60).build());
            var a = createNow("OSP-2026-00001", SourceType.OVERSPEEDING, "DRV001");

            clock.advance(Duration.ofMinutes(30));
            assertThat(engine.sweepAutoClose().closed()).isZero();
            assertThat(a.getStatus()).isEqualTo(AlertStatus.OPEN);

            clock.advance(Duration.ofMinutes(31));
            assertThat(engine.sweepAutoClose().closed()).isEqualTo(1);
            assertThat(a.getStatus()).isEqualTo(AlertStatus.AUTO_CLOSED);
            assertThat(a.getAutoCloseReason()).isEqualTo("expired after 60 minutes");
        }

        @Test
        @DisplayName("condition rule declared first wins over a satisfied expiry")
        void conditionBeatsExpiry() {
            rules.add("cond", SourceType.COMPLIANCE, 1, RuleConditions.builder().autoCloseIf("renewed").build());
            rules.add("expire", SourceType.COMPLIANCE, 2, RuleConditions.builder().expireAfterMins(10).build());
            var a = createNow("CMP-2026-00001", SourceType.COMPLIANCE, "DRV001");
            a.getMetadata().put("renewed", MetadataValue.ofString("yes"));

            clock.advance(Duration.ofMinutes(20));
            engine.sweepAutoClose();

            assertThat(a.getAutoCloseReason()).isEqualTo("condition 'renewed' satisfied");
            var last = a.getStateHistory().get(a.getStateHistory().size() - 1);
            assertThat(last.getRuleTriggered()).isEqualTo("cond");
        }

        @Test
        @DisplayName("the alert's own expiry date applies when no rule fires")
        void builtInExpiry() {
            var a = createNow("FBP-2026-00001", SourceType.FEEDBACK_POSITIVE, "DRV001");
            a.setExpiresAt(T0.plus(Duration.ofHours(1)));

            clock.advance(Duration.ofMinutes(59));
            assertThat(engine.sweepAutoClose().closed()).isZero();
            clock.advance(Duration.ofMinutes(1));
            assertThat(engine.sweepAutoClose().closed()).isEqualTo(1);
            assertThat(a.getAutoCloseReason()).startsWith("expired at ");
        }

        @Test
        @DisplayName("escalated alerts are closed too")
        void escalatedAlertIsClosed() {
            rules.add("esc", SourceType.SAFETY, 1, escalation(1, 60));
            rules.add("expire", SourceType.SAFETY, 2, RuleConditions.builder().expireAfterMins(5).build());
            var a = createNow("SAF-2026-00001", SourceType.SAFETY, "DRV001");
            engine.evaluateEscalation(a);

            clock.advance(Duration.ofMinutes(5));
            engine.sweepAutoClose();

            assertThat(a.getStatus()).isEqualTo(AlertStatus.AUTO_CLOSED);
            var last = a.getStateHistory().get(a.getStateHistory().size() - 1);
            assertThat(last.getFromStatus()).isEqualTo(AlertStatus.ESCALATED);
        }

        @Test
        @DisplayName("a second sweep right after the first changes nothing")
        void sweepIsIdempotent() {
            rules.add("expire", SourceType.OVERSPEEDING, 1, RuleConditions.builder().expireAfterMins(1).build());
            createNow("OSP-2026-00001", SourceType.OVERSPEEDING, "DRV001");
            createNow("OSP-2026-00002", SourceType.OVERSPEEDING, "DRV002");
            clock.advance(Duration.ofMinutes(2));

            var first = engine.sweepAutoClose();
            int applied = alerts.appliedTransitions();
            var second = engine.sweepAutoClose();

            assertThat(first.closed()).isEqualTo(2);
            assertThat(second.checked()).isZero();
            assertThat(second.closed()).isZero();
            assertThat(alerts.appliedTransitions()).isEqualTo(applied);
        }

        @Test
        @DisplayName("one failing alert is counted and the rest are still processed")
        void failureIsIsolated() {
            rules.add("expire", SourceType.OVERSPEEDING, 1, RuleConditions.builder().expireAfterMins(1).build());
            var broken = createNow("OSP-2026-00001", SourceType.OVERSPEEDING, "DRV001");
            var fine = createNow("OSP-2026-00002", SourceType.OVERSPEEDING, "DRV002");
            alerts.failTransitionsFor(broken.getId());
            clock.advance(Duration.ofMinutes(2));

            var stats = engine.sweepAutoClose();

            assertThat(stats.checked()).isEqualTo(2);
            assertThat(stats.closed()).isEqualTo(1);
            assertThat(stats.errors()).isEqualTo(1);
            assertThat(stats.escalated()).isZero();
            assertThat(stats.failures()).hasSize(1);
            assertThat(stats.failures().get(0)).startsWith(broken.getId());
            assertThat(broken.getStatus()).isEqualTo(AlertStatus.OPEN);
            assertThat(fine.getStatus()).isEqualTo(AlertStatus.AUTO_CLOSED);
        }

        @Test
        @DisplayName("pending alerts are read in batches and each is visited once")
        void sweepWalksEveryBatch() {
            engine.setSweepBatchSize(2);
            rules.add("expire", SourceType.OVERSPEEDING, 1, RuleConditions.builder().expireAfterMins(1).build());
            for (int i = 1; i <= 5; i++) {
                createNow("OSP-2026-0000" + i, SourceType.OVERSPEEDING, "DRV00" + i);
            }
            alerts.failTransitionsFor("OSP-2026-00002");
            clock.advance(Duration.ofMinutes(2));

            var stats = engine.sweepAutoClose();

            assertThat(stats.checked()).isEqualTo(5);
            assertThat(stats.closed()).isEqualTo(4);
            assertThat(stats.errors()).isEqualTo(1);
            assertThat(alerts.get("OSP-2026-00002").getStatus()).isEqualTo(AlertStatus.OPEN);
            assertThat(alerts.get("OSP-2026-00005").getStatus()).isEqualTo(AlertStatus.AUTO_CLOSED);
        }

        @Test
        @DisplayName("long failure messages are cut before they reach the job record")
        void failureLineIsCapped() {
            rules.add("expire", SourceType.OVERSPEEDING, 1, RuleConditions.builder().expireAfterMins(1).build());
            var broken = createNow("OSP-2026-00001", SourceType.OVERSPEEDING, "DRV001");
            alerts.failTransitionsFor(broken.getId(), "connection reset ".repeat(200));
            clock.advance(Duration.ofMinutes(2));

            var stats = engine.sweepAutoClose();

            assertThat(stats.failures()).hasSize(1);
            assertThat(stats.failures().get(0))
                    .hasSize(RuleEngine.MAX_FAILURE_LENGTH)
                    .startsWith(broken.getId() + ": connection reset");
        }
    }

    @Nested
    @DisplayName("operator actions")
    class Operator {

        @Test
        @DisplayName("resolving an auto-closed alert fails and leaves it unchanged")
        void resolveAutoClosedFails() {
            rules.add("expire", SourceType.OVERSPEEDING, 1, RuleConditions.builder().expireAfterMins(1).build());
            var a = createNow("OSP-2026-00001", SourceType.OVERSPEEDING, "DRV001");
            clock.advance(Duration.ofMinutes(1));
            engine.sweepAutoClose();
            int historySize = a.getStateHistory().size();

            assertThatThrownBy(() -> engine.resolve(a.getId(), "late", "ops"))
                    .isInstanceOf(InvalidStateException.class);
            assertThat(a.getStatus()).isEqualTo(AlertStatus.AUTO_CLOSED);
            assertThat(a.getStateHistory()).hasSize(historySize);
            assertThat(a.getResolvedAt()).isNull();
        }

        @Test
        @DisplayName("resolve records actor, notes and a history entry")
        void resolveOpenAlert() {
            var a = createNow("OSP-2026-00001", SourceType.OVERSPEEDING, "DRV001");
            clock.advance(Duration.ofMinutes(3));

            engine.resolve(a.getId(), "driver coached", "ops");

            assertThat(a.getStatus()).isEqualTo(AlertStatus.RESOLVED);
            assertThat(a.getResolvedBy()).isEqualTo("ops");
            assertThat(a.getResolutionNotes()).isEqualTo("driver coached");
            assertThat(a.getResolvedAt()).isEqualTo(T0.plus(Duration.ofMinutes(3)));
            var last = a.getStateHistory().get(0);
            assertThat(last.getReason()).isEqualTo("Alert resolved by ops");
            assertThat(last.getTriggeredBy()).isEqualTo("ops");
        }

        @Test
        @DisplayName("unknown alert ids are reported as not found")
        void resolveUnknown() {
            assertThatThrownBy(() -> engine.resolve("OSP-2026-99999", "x", "ops"))
                    .isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("no status change leads back to OPEN")
        void cannotReopen() {
            var a = createNow("OSP-2026-00001", SourceType.OVERSPEEDING, "DRV001");
            engine.changeStatus(a.getId(), AlertStatus.ESCALATED, "manual", "ops");

            assertThatThrownBy(() -> engine.changeStatus(a.getId(), AlertStatus.OPEN, "reopen", "ops"))
                    .isInstanceOf(InvalidStateException.class);
            assertThat(a.getStatus()).isEqualTo(AlertStatus.ESCALATED);
            assertThat(a.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        }
    }
}
