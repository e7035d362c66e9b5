package com.lawcheck.conflict;

import com.lawcheck.model.Statute;

import java.util.Optional;

public class IdCollisionRule implements ConflictRule {

    @Override
    public ConflictType type() {
        return ConflictType.ID_COLLISION;
    }

    @Override
    public Optional<StatuteConflict> detect(Statute first, Statute second, ConflictContext context) {
        if (!first.id().equals(second.id())) {
            return Optional.empty();
        }
        return Optional.of(conflict(first, second, "statute id '" + first.id() + "' is used more than once"
            + " (versions " + first.version() + " and " + second.version() + ")"));
    }
}
