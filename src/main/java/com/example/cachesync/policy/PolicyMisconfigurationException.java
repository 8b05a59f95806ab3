package com.example.cachesync.policy;

/**
 * Raised while the policy table is built; a cache with an invalid policy never starts.
 */
public class PolicyMisconfigurationException extends IllegalStateException {

    public PolicyMisconfigurationException(String message) {
        super(message);
    }
}
