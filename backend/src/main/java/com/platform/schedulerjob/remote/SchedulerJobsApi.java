package com.platform.schedulerjob.remote;

import com.platform.schedulerjob.remote.SchedulerJobModels.JobDefinition;
import com.platform.schedulerjob.resource.JobResourceId;

import java.util.Optional;

/**
 * Transport to the remote scheduler service. Every call is one blocking round trip;
 * retries and backoff, if any, belong to the implementation.
 *
 * <p>Failures other than "not found" surface as
 * {@link com.platform.schedulerjob.error.RemoteServiceException}.
 */
public interface SchedulerJobsApi {
    
    /**
     * Create or replace a job.
     *
     * @return the job as stored by the service, including its identifier
     */
    JobDefinition createOrUpdate(JobResourceId id, JobDefinition definition);
    
    /**
     * @return the job, or empty when the service reports it does not exist
     */
    Optional<JobDefinition> get(JobResourceId id);
    
    /**
     * @return {@code false} when the job did not exist
     */
    boolean delete(JobResourceId id);
}
