package com.landrecords.ec.model;

/**
 * Leaf of the hierarchy and the unit of search.
 * A village code is only unique together with its hobli code.
 */
public record Village(int code, String name, String localizedName, int hobliCode, boolean urban) {}
