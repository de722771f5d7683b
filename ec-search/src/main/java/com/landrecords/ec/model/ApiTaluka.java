package com.landrecords.ec.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiTaluka {

    @JsonProperty("talukCode")
    private Integer code;

    @JsonProperty("talukNamee")
    private String name;

    @JsonProperty("talukNamek")
    private String localizedName;

    public Taluka toTaluka(int districtCode) {
        return new Taluka(code, ApiDistrict.nullToEmpty(name), ApiDistrict.nullToEmpty(localizedName), districtCode);
    }
}
