package com.lawcheck.conflict;

import com.lawcheck.model.Statute;

import java.util.Optional;

/**
 * Two distinct, similarly titled statutes in overlapping jurisdictions whose
 * preconditions can hold at the same time: the same situation is regulated twice.
 */
public class JurisdictionalOverlapRule implements ConflictRule {

    @Override
    public ConflictType type() {
        return ConflictType.JURISDICTIONAL_OVERLAP;
    }

    @Override
    public Optional<StatuteConflict> detect(Statute first, Statute second, ConflictContext context) {
        if (first.id().equals(second.id())
                || !Jurisdictions.overlap(first.jurisdiction(), second.jurisdiction())
                || !context.similarTitles(first, second)
                || !context.preconditionsOverlap(first, second).isTrue()) {
            return Optional.empty();
        }
        return Optional.of(conflict(first, second, String.format(
            "'%s' (%s) and '%s' (%s) regulate overlapping situations in overlapping jurisdictions",
            first.id(), first.jurisdiction(), second.id(), second.jurisdiction())));
    }
}
