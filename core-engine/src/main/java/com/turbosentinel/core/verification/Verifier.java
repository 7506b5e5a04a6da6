package com.turbosentinel.core.verification;

import com.turbosentinel.core.model.DetectorKind;

/**
 * Contract for independent verifiers of detection candidates.
 *
 * <p>
 * Implementations hold no state between calls; any model is fitted inside
 * {@link #verify} and discarded afterwards.
 * </p>
 */
public interface Verifier {

    /**
     * @return the detector this verifier implements
     */
    DetectorKind kind();

    /**
     * Decide, per candidate, whether this verifier confirms it.
     *
     * @param input    series, candidates and tag limits
     * @param deadline cooperative time budget
     * @return confirmations and scores
     * @throws com.turbosentinel.core.error.DetectorUnavailableException if the
     *         verifier cannot execute, including when the budget runs out
     */
    VerifierResult verify(VerificationInput input, Deadline deadline);
}
