package com.example.reelreply.repository;

/**
 * Sums over the cycle history of one scope.
 */
public interface CycleMetricTotals {

    long getCycles();

    long getCommentsScanned();

    long getRepliesSent();

    long getPrivateMessagesSent();

    long getApiCalls();
}
