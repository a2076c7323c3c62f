package com.nursingjobs.pipeline.ingest.persistence;

import com.nursingjobs.pipeline.ingest.model.Classification;
import com.nursingjobs.pipeline.ingest.model.DeletedJobTombstone;
import com.nursingjobs.pipeline.ingest.model.JobRecord;
import com.nursingjobs.pipeline.ingest.model.NormalizedJob;
import com.nursingjobs.pipeline.ingest.model.UpsertResult;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Lifecycle-aware access to job records. Only {@link #markActive} can make a job visible and it
 * refuses to do so without a specialty.
 */
public interface ActivationStore {
    Optional<JobRecord> findByIdentityKey(long employerId, String identityKey);

    /**
     * Inserts a new record in pending-classification, updates a changed one in place keeping
     * its lifecycle state, or leaves an unchanged one alone. Atomic per identity key.
     */
    UpsertResult upsert(NormalizedJob job);

    /**
     * Promotes pending records to active with the given classification.
     *
     * @return the records that were promoted
     * @throws IllegalArgumentException when the classification carries no specialty
     */
    List<JobRecord> markActive(Collection<Long> ids, Classification classification);

    int markInactive(Collection<Long> ids);

    List<JobRecord> listPending(long employerId);

    DeletedJobTombstone createTombstone(String slug, String reason);

    Optional<DeletedJobTombstone> findTombstone(String slug);

    Optional<JobRecord> findBySlug(String slug);

    /**
     * Marks the job deleted and writes its tombstone in one transaction.
     */
    DeletedJobTombstone retire(String slug, String reason);
}
