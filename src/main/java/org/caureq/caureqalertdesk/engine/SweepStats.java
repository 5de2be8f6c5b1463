package org.caureq.caureqalertdesk.engine;

import java.util.List;

/**
 * Outcome of one auto-close pass. {@code failures} keeps the first few
 * per-alert error messages for the job record.
 */
public record SweepStats(int checked, int closed, int escalated, int errors, List<String> failures) {
    public SweepStats {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }
}
