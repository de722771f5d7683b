package com.landrecords.ec.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Raw DTOs matching the hierarchy API JSON. Kept separate from the domain
 * records to isolate API coupling.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiDistrict {

    @JsonProperty("districtCode")
    private Integer code;

    @JsonProperty("districtNamee")
    private String name;

    @JsonProperty("districtNamek")
    private String localizedName;

    public District toDistrict() {
        return new District(code, nullToEmpty(name), nullToEmpty(localizedName));
    }

    static String nullToEmpty(String val) {
        return val == null ? "" : val.trim();
    }
}
