package com.landrecords.ec.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

/**
 * Envelope of the EC search endpoint. {@code data} arrives either as a JSON
 * string holding an array or as the array itself.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiSearchResponse {

    public static final int RESPONSE_OK = 1000;

    private Integer responseCode;
    private String responseMessage;
    private JsonNode data;
}
