package com.example.cachesync.core;

public enum RemovalCause {
    /** invalidate, delete, clear or a rolled-back mutation */
    EXPLICIT,
    /** TTL elapsed, found on access or by the sweep */
    EXPIRED,
    /** dropped from the LRU end of a full namespace */
    EVICTED
}
