package com.example.cachesync.backend;

/**
 * The remote service answered, but not with a usable result.
 */
public class RemoteServiceException extends Exception {

    private final int status;

    public RemoteServiceException(String message, int status) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
