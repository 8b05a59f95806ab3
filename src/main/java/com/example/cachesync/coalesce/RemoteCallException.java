package com.example.cachesync.coalesce;

/**
 * A loader, remote call or remote mutation failed or timed out. The only failure
 * that crosses the cache's public API.
 */
public class RemoteCallException extends RuntimeException {

    private final String signature;
    private final boolean timeout;

    public RemoteCallException(String signature, String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.signature = signature;
        this.timeout = timeout;
    }

    public RemoteCallException(String signature, Throwable cause) {
        this(signature, "Remote call failed: " + signature, cause, false);
    }

    public String getSignature() {
        return signature;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
