package com.landrecords.ec.model;

public record SessionCookie(String name, String value, String domain, String path) {

    public SessionCookie(String name, String value) {
        this(name, value, null, "/");
    }
}
