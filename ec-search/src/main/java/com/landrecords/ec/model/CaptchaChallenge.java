package com.landrecords.ec.model;

/**
 * Image challenge issued by the search API. The id is only valid for one submission window.
 */
public record CaptchaChallenge(String challengeId, byte[] imageBytes) {}
