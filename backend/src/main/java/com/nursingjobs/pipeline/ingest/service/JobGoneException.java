package com.nursingjobs.pipeline.ingest.service;

import com.nursingjobs.pipeline.ingest.model.DeletedJobTombstone;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.GONE)
public class JobGoneException extends RuntimeException {
    private final DeletedJobTombstone tombstone;

    public JobGoneException(DeletedJobTombstone tombstone) {
        super("Job " + tombstone.slug() + " was permanently removed");
        this.tombstone = tombstone;
    }

    public DeletedJobTombstone getTombstone() {
        return tombstone;
    }
}
