package com.landrecords.ec.model;

public record Taluka(int code, String name, String localizedName, int districtCode) {}
