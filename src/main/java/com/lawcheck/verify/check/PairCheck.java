package com.lawcheck.verify.check;

import com.lawcheck.model.Statute;
import com.lawcheck.verify.VerificationResult;

/**
 * A check over an unordered statute pair. The verifier passes each pair once,
 * in canonical order.
 */
public interface PairCheck {

    String checkId();

    VerificationResult check(Statute first, Statute second, CheckContext context);
}
