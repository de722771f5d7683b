package com.landrecords.ec.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Which part of the hierarchy a batch run should cover.
 *
 * Per level below district: allX=true expands every child, a code narrows to that child,
 * and neither means every child as well. District is always required.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LocationFilter {

    private Integer districtCode;

    private Integer talukaCode;
    private boolean allTaluks;

    private Integer hobliCode;
    private boolean allHoblis;

    private Integer villageCode;
    private boolean allVillages;
}
