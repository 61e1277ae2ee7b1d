package com.hemovita.model.network;

import java.util.List;

/**
 * Supplement keys known to help a target key, in first-seen order.
 */
public record BoosterBundle(
    String target,
    List<String> boosters
) {}
