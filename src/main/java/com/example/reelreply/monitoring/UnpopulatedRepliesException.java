package com.example.reelreply.monitoring;

/**
 * A comment arrived without its nested replies populated, so whether the account already
 * replied cannot be decided.
 */
public class UnpopulatedRepliesException extends RuntimeException {

    public UnpopulatedRepliesException(String commentId) {
        super("Nested replies were not populated for comment " + commentId);
    }
}
