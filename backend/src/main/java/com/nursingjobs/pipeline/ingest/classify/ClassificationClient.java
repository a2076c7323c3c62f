package com.nursingjobs.pipeline.ingest.classify;

import com.nursingjobs.pipeline.ingest.model.ClassifierVerdict;
import com.nursingjobs.pipeline.ingest.model.JobRecord;

public interface ClassificationClient {
    /**
     * Classifies one job with a single remote call.
     *
     * @throws ClassificationFailureException when this job's call fails or the answer is unusable
     * @throws ClassificationServiceException when no call can succeed in this run
     */
    ClassifierVerdict classify(JobRecord job, String employerName);
}
