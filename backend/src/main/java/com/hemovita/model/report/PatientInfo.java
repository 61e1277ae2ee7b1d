package com.hemovita.model.report;

import com.hemovita.model.enums.Sex;

/**
 * Patient details used for the report header and the demographic risk step.
 */
public record PatientInfo(
    Integer age,
    Sex sex,
    Boolean pregnant,
    String country,
    String notes,
    String population
) {}
