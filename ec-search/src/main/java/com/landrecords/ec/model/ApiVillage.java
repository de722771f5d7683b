package com.landrecords.ec.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiVillage {

    @JsonProperty("villagecode")
    private Integer code;

    @JsonProperty("villagenamee")
    private String name;

    @JsonProperty("villagenamek")
    private String localizedName;

    @JsonProperty("isurban")
    private Boolean urban;

    public Village toVillage(int hobliCode) {
        return new Village(code, ApiDistrict.nullToEmpty(name), ApiDistrict.nullToEmpty(localizedName),
                hobliCode, Boolean.TRUE.equals(urban));
    }
}
