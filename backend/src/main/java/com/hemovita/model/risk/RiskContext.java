package com.hemovita.model.risk;

/**
 * Demographic context used as bandit input.
 */
public record RiskContext(
    String country,
    String population,
    String gender,
    double age
) {

    public static RiskContext of(String country, String population, String gender, double age) {
        return new RiskContext(clean(country), clean(population), clean(gender), age);
    }

    private static String clean(String value) {
        return value == null ? "" : value.trim();
    }
}
