package com.landrecords.ec.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.landrecords.ec.config.EcSearchProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Body of a batch search trigger. Unset options fall back to configuration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchBatchRequest {

    private LocationFilter locations;

    private String firstName;
    private String middleName;
    private String lastName;

    private LocalDate fromDate;
    private LocalDate toDate;

    private EcSearchProperties.Captcha.Backend captchaBackend;
    private Boolean captchaReuse;
}
