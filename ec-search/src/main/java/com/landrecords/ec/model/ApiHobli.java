package com.landrecords.ec.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiHobli {

    @JsonProperty("hoblicode")
    private Integer code;

    @JsonProperty("hoblinamee")
    private String name;

    @JsonProperty("hoblinamek")
    private String localizedName;

    public Hobli toHobli(int talukaCode) {
        return new Hobli(code, ApiDistrict.nullToEmpty(name), ApiDistrict.nullToEmpty(localizedName), talukaCode);
    }
}
