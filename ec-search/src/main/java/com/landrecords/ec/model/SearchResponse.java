package com.landrecords.ec.model;

import java.util.List;
import java.util.Map;

/**
 * Classified response of a search call.
 */
public record SearchResponse(Status status, List<Map<String, Object>> rows, String message) {

    public enum Status {
        OK, UNAUTHORIZED, INVALID_CAPTCHA, ERROR
    }

    public static SearchResponse ok(List<Map<String, Object>> rows) {
        return new SearchResponse(Status.OK, rows, "ok");
    }

    public static SearchResponse unauthorized(String message) {
        return new SearchResponse(Status.UNAUTHORIZED, List.of(), message);
    }

    public static SearchResponse invalidCaptcha(String message) {
        return new SearchResponse(Status.INVALID_CAPTCHA, List.of(), message);
    }

    public static SearchResponse error(String message) {
        return new SearchResponse(Status.ERROR, List.of(), message);
    }
}
