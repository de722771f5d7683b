package com.landrecords.ec.model;

import java.util.List;

/**
 * Deduplicated targets for a filter, plus how many duplicate paths were dropped.
 */
public record Expansion(List<SearchTarget> targets, int duplicatesRemoved) {

    public Expansion {
        targets = List.copyOf(targets);
    }
}
