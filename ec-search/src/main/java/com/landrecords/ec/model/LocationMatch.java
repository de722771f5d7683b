package com.landrecords.ec.model;

/**
 * A district, taluka or hobli found by name or code, with its ancestors' names.
 * Parent fields are null where the level has no such ancestor.
 */
public record LocationMatch(Level level, int code, String name, String localizedName,
                            Integer talukaCode, String talukaName,
                            Integer districtCode, String districtName) {

    public enum Level { DISTRICT, TALUKA, HOBLI }
}
