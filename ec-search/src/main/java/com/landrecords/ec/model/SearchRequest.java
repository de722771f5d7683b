package com.landrecords.ec.model;

import java.time.LocalDate;

/**
 * One submission of the EC search form.
 */
public record SearchRequest(
        int villageCode,
        String firstName,
        String middleName,
        String lastName,
        LocalDate fromDate,
        LocalDate toDate,
        String captchaId,
        String captchaText) {}
