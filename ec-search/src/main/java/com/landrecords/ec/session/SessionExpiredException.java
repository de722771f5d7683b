package com.landrecords.ec.session;

/**
 * The session artifact is missing, past its TTL or rejected by the remote API.
 * Only a fresh external login recovers from this.
 */
public class SessionExpiredException extends RuntimeException {
    public SessionExpiredException(String m) { super(m); }
    public SessionExpiredException(String m, Throwable c) { super(m, c); }
}
