package com.landrecords.ec.model;

public record Hobli(int code, String name, String localizedName, int talukaCode) {}
