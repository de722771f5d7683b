package com.landrecords.ec.model;

public enum SessionState {
    EMPTY, ACTIVE, EXPIRED
}
