package com.lawcheck.verify.check;

import com.lawcheck.model.Statute;
import com.lawcheck.verify.VerificationResult;

/**
 * A check over a single statute. Checks are registered in an ordered list;
 * the verifier runs them in that order and merges their results.
 */
public interface StatuteCheck {

    /** Stable identifier, part of cache keys. */
    String checkId();

    /** Whether the check issues constraint queries; such checks honor the size guard. */
    default boolean usesSolver() {
        return true;
    }

    /** Whether the outcome depends only on the statute and the settings. */
    default boolean cacheable() {
        return true;
    }

    VerificationResult check(Statute statute, CheckContext context);
}
