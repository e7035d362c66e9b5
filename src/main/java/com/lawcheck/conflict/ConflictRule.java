package com.lawcheck.conflict;

import com.lawcheck.model.Statute;

import java.util.Optional;

/**
 * A pairwise conflict check. Implementations must be symmetric in the two
 * statutes; the detector nevertheless always passes them in a canonical order.
 */
public interface ConflictRule {

    ConflictType type();

    Optional<StatuteConflict> detect(Statute first, Statute second, ConflictContext context);

    default StatuteConflict conflict(Statute first, Statute second, String description) {
        return new StatuteConflict(type(), first.id(), second.id(), description);
    }
}
