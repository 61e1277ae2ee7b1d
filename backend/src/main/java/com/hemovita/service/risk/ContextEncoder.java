package com.hemovita.service.risk;

import com.hemovita.model.risk.RiskContext;

import java.util.*;

/**
 * Encodes a demographic context as a 4-dimensional feature vector:
 * country code, population code, gender code and age / 100.
 *
 * Codes are indices into the sorted distinct training values; a value never
 * seen in training encodes as -1.
 */
public final class ContextEncoder {

    public static final int DIMENSION = 4;

    private final Map<String, Integer> countryCodes;
    private final Map<String, Integer> populationCodes;
    private final Map<String, Integer> genderCodes;

    private ContextEncoder(Map<String, Integer> countryCodes,
                           Map<String, Integer> populationCodes,
                           Map<String, Integer> genderCodes) {
        this.countryCodes = countryCodes;
        this.populationCodes = populationCodes;
        this.genderCodes = genderCodes;
    }

    public static ContextEncoder fit(Collection<RiskContext> contexts) {
        SortedSet<String> countries = new TreeSet<>();
        SortedSet<String> populations = new TreeSet<>();
        SortedSet<String> genders = new TreeSet<>();
        for (RiskContext ctx : contexts) {
            countries.add(ctx.country());
            populations.add(ctx.population());
            genders.add(ctx.gender());
        }
        return new ContextEncoder(index(countries), index(populations), index(genders));
    }

    private static Map<String, Integer> index(SortedSet<String> values) {
        Map<String, Integer> codes = new LinkedHashMap<>();
        int i = 0;
        for (String v : values) {
            codes.put(v, i++);
        }
        return Collections.unmodifiableMap(codes);
    }

    public double[] encode(RiskContext context) {
        return new double[] {
            countryCodes.getOrDefault(context.country(), -1),
            populationCodes.getOrDefault(context.population(), -1),
            genderCodes.getOrDefault(context.gender(), -1),
            context.age() / 100.0
        };
    }

    public boolean knowsCountry(String country) {
        return country != null && countryCodes.containsKey(country.trim());
    }

    public Set<String> countries() {
        return countryCodes.keySet();
    }
}
