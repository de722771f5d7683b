package com.landrecords.ec.repository;

/**
 * Raised when a child row is written before its parent exists.
 */
public class ReferentialIntegrityException extends RuntimeException {

    public ReferentialIntegrityException(String level, int code, String parentLevel, int parentCode) {
        super(String.format("Cannot write %s %d: %s %d does not exist", level, code, parentLevel, parentCode));
    }

    public ReferentialIntegrityException(String m, Throwable c) { super(m, c); }
}
