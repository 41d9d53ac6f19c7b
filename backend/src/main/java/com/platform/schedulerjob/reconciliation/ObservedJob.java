package com.platform.schedulerjob.reconciliation;

import com.platform.schedulerjob.model.JobSpec;
import com.platform.schedulerjob.resource.JobResourceId;

/**
 * A job as last read back from the scheduler service.
 * Secrets in {@link #spec()} are masked.
 */
public record ObservedJob(JobResourceId id, JobSpec spec) {
}
