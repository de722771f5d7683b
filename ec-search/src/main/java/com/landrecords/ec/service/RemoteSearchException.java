package com.landrecords.ec.service;

/**
 * A search-side remote call failed for one target. Recorded, never fatal to the run.
 */
public class RemoteSearchException extends RuntimeException {
    public RemoteSearchException(String m) { super(m); }
    public RemoteSearchException(String m, Throwable c) { super(m, c); }
}
