package uk.gegc.skillgrader.features.integrity.application;

import uk.gegc.skillgrader.features.integrity.domain.model.IntegrityVerdict;
import uk.gegc.skillgrader.features.integrity.domain.model.SubmissionTiming;

public interface IntegrityDetector {

    /**
     * @param exemplar            exemplar text, may be {@code null}; copy checks only run when present
     * @param embeddingSimilarity submission-to-exemplar similarity in {@code [0, 1]}
     * @param timing              may be {@code null}
     */
    IntegrityVerdict detectIntegrity(String submission,
                                     String exemplar,
                                     double embeddingSimilarity,
                                     SubmissionTiming timing);
}
