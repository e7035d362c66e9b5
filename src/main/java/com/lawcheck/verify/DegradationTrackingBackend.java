package com.lawcheck.verify;

import com.lawcheck.constraint.ConstraintBackend;
import com.lawcheck.constraint.Verdict;
import com.lawcheck.model.Condition;

/**
 * Wraps a backend for the duration of one check and remembers whether any
 * answer was degraded. Not shared between threads.
 */
class DegradationTrackingBackend implements ConstraintBackend {

    private final ConstraintBackend delegate;
    private boolean degraded;

    DegradationTrackingBackend(ConstraintBackend delegate) {
        this.delegate = delegate;
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public Verdict isSatisfiable(Condition condition) {
        Verdict verdict = delegate.isSatisfiable(condition);
        if (verdict.degraded()) {
            degraded = true;
        }
        return verdict;
    }

    boolean degraded() {
        return degraded;
    }
}
