package com.hemovita.dto.response;

public record RiskMetaDto(
    String country,
    String population,
    String gender,
    double age,
    boolean countryKnown,
    boolean fallbackUsed,
    String fallbackLevel
) {}
