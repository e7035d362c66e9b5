package com.lawcheck.principle;

import com.lawcheck.model.Statute;
import com.lawcheck.model.TemporalValidity;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

/** A statute may not take effect before the day it was enacted (UTC). */
public class NoRetroactivityPrinciple implements Principle {

    public static final String ID = "non-retroactivity";

    @Override
    public String principleId() {
        return ID;
    }

    @Override
    public String name() {
        return "Non-Retroactivity";
    }

    @Override
    public String description() {
        return "Laws apply only to conduct after their enactment";
    }

    @Override
    public Optional<PrincipleViolation> check(Statute statute) {
        TemporalValidity validity = statute.temporalValidity();
        if (validity == null || validity.effectiveDate() == null || validity.enactedAt() == null) {
            return Optional.empty();
        }
        LocalDate enacted = validity.enactedAt().atZone(ZoneOffset.UTC).toLocalDate();
        if (!validity.effectiveDate().isBefore(enacted)) {
            return Optional.empty();
        }
        return Optional.of(violation(statute,
            "effective " + validity.effectiveDate() + " but enacted " + enacted));
    }
}
