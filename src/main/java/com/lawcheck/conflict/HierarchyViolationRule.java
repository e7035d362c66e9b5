package com.lawcheck.conflict;

import com.lawcheck.model.Statute;

import java.util.Optional;

/**
 * A statute from a lower jurisdiction whose effect contradicts that of a
 * statute from a higher jurisdiction under preconditions that can hold together.
 */
public class HierarchyViolationRule implements ConflictRule {

    @Override
    public ConflictType type() {
        return ConflictType.HIERARCHY_VIOLATION;
    }

    @Override
    public Optional<StatuteConflict> detect(Statute first, Statute second, ConflictContext context) {
        if (!Jurisdictions.ranked(first.jurisdiction(), second.jurisdiction())) {
            return Optional.empty();
        }
        boolean firstIsHigher = Jurisdictions.isAncestor(first.jurisdiction(), second.jurisdiction());
        Statute higher = firstIsHigher ? first : second;
        Statute lower = firstIsHigher ? second : first;
        if (!lower.effect().contradicts(higher.effect())
                || !context.preconditionsOverlap(first, second).isTrue()) {
            return Optional.empty();
        }
        return Optional.of(conflict(first, second, String.format(
            "'%s' (%s) contradicts higher-authority statute '%s' (%s) on '%s'",
            lower.id(), lower.jurisdiction(), higher.id(), higher.jurisdiction(), higher.effect().resource())));
    }
}
