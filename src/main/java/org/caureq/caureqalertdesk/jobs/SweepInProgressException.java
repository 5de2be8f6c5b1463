package org.caureq.caureqalertdesk.jobs;

/** A manual run was requested while another sweep is still going. */
public class SweepInProgressException extends RuntimeException {
    public SweepInProgressException() {
        super("an auto-close sweep is already running");
    }
}
