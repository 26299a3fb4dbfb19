package com.example.reelreply.credential;

/**
 * Tells the engine whether a usable credential is currently available.
 */
@FunctionalInterface
public interface CredentialProvider {

    boolean isCredentialAvailable();
}
