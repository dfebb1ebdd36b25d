package com.diskwatcher.app.service;

import com.diskwatcher.app.database.JobType;

/** A job of the same type is already active for the volume. Callers treat it as already satisfied. */
public class JobConflictException extends Exception {

    private final String volumeId;
    private final JobType jobType;

    public JobConflictException(String volumeId, JobType jobType) {
        super("active " + jobType.wire() + " job already exists for volume " + volumeId);
        this.volumeId = volumeId;
        this.jobType = jobType;
    }

    public String volumeId() {
        return volumeId;
    }

    public JobType jobType() {
        return jobType;
    }
}
