package com.landrecords.ec.model;

public record ValidationResult(boolean valid, String message) {}
