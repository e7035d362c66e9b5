package com.lawcheck.conflict;

import com.lawcheck.model.Statute;
import com.lawcheck.model.TemporalValidity;

import java.util.Optional;

/**
 * Different versions of the same or a similarly titled statute whose validity
 * windows overlap. A missing window counts as always in force.
 */
public class TemporalConflictRule implements ConflictRule {

    private static final TemporalValidity ALWAYS = new TemporalValidity(null, null, null, null);

    @Override
    public ConflictType type() {
        return ConflictType.TEMPORAL_CONFLICT;
    }

    @Override
    public Optional<StatuteConflict> detect(Statute first, Statute second, ConflictContext context) {
        if (first.version() == second.version()) {
            return Optional.empty();
        }
        if (!first.id().equals(second.id()) && !context.similarTitles(first, second)) {
            return Optional.empty();
        }
        TemporalValidity a = first.temporalValidity() == null ? ALWAYS : first.temporalValidity();
        TemporalValidity b = second.temporalValidity() == null ? ALWAYS : second.temporalValidity();
        if (!a.overlaps(b)) {
            return Optional.empty();
        }
        return Optional.of(conflict(first, second, String.format(
            "version %d of '%s' and version %d of '%s' are in force at the same time",
            first.version(), first.id(), second.version(), second.id())));
    }
}
