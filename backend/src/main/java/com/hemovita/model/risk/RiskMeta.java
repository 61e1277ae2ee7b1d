package com.hemovita.model.risk;

/**
 * Echo of the query plus which prediction path was taken.
 */
public record RiskMeta(
    String country,
    String population,
    String gender,
    double age,
    boolean countryKnown,
    boolean fallbackUsed,
    String fallbackLevel
) {}
