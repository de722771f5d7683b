package com.landrecords.ec.model;

/**
 * Solved text for a challenge; cost is what the solving service charged (0 for manual).
 */
public record CaptchaSolution(String challengeId, String text, double cost) {}
