package com.landrecords.ec.model;

/**
 * Root of the location hierarchy.
 */
public record District(int code, String name, String localizedName) {}
