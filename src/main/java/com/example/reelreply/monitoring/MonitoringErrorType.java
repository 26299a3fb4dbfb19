package com.example.reelreply.monitoring;

/**
 * Error classes the engine distinguishes when a cycle or a single call fails.
 */
public enum MonitoringErrorType {
    /** Missing, invalid or expired credential. Retrying is futile until the operator acts. */
    AUTHENTICATION,
    /** Platform throttling. Expected to clear by the next tick. */
    RATE_LIMIT,
    /** Network and everything else; treated as transient. */
    UNCLASSIFIED
}
