/**
 * Primary detectors that turn series into detection candidates: the rolling
 * z-score {@link com.turbosentinel.core.detection.CandidateDetector} and the
 * multi-tag {@link com.turbosentinel.core.detection.ReconstructionDetector}.
 *
 * @since 1.0.0
 */
package com.turbosentinel.core.detection;
