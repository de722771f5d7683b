package com.landrecords.ec.service;

/**
 * A hierarchy fetch that errored or returned no rows. Distinct from a confirmed-empty result.
 */
public class FetchFailureException extends RuntimeException {
    public FetchFailureException(String m) { super(m); }
    public FetchFailureException(String m, Throwable c) { super(m, c); }
}
