package com.diskwatcher.app.service;

import com.diskwatcher.app.database.JobType;

/** Identifies a job created by {@link JobTracker#start}. */
public record JobHandle(String jobId, JobType type, String volumeId, String path) {}
