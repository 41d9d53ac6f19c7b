package com.platform.schedulerjob.reconciliation;

import com.platform.schedulerjob.error.ErrorCode;
import com.platform.schedulerjob.error.SchedulerJobException;
import com.platform.schedulerjob.error.RemoteServiceException;
import com.platform.schedulerjob.error.ValidationException;
import com.platform.schedulerjob.mapping.JobDefinitionMapper;
import com.platform.schedulerjob.model.JobSpec;
import com.platform.schedulerjob.observability.LoggingConfig;
import com.platform.schedulerjob.observability.MetricsRegistry;
import com.platform.schedulerjob.observability.StructuredLogger;
import com.platform.schedulerjob.remote.SchedulerClientConfig;
import com.platform.schedulerjob.remote.SchedulerJobModels.JobDefinition;
import com.platform.schedulerjob.remote.SchedulerJobsApi;
import com.platform.schedulerjob.resource.JobResourceId;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Makes the scheduler service match a declared job: create/update with read-back, read,
 * and delete. Each call is one synchronous pass; nothing is retried here.
 */
@Slf4j
@Service
public class JobReconciler {
    
    private static final int MAX_HISTORY = 500;
    
    private final SchedulerJobsApi schedulerJobsApi;
    private final JobDefinitionMapper mapper;
    private final JobSpecValidator validator;
    private final SchedulerClientConfig clientConfig;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final Clock clock;
    
    private final List<ReconciliationRecord> history = new ArrayList<>();
    
    public JobReconciler(
            SchedulerJobsApi schedulerJobsApi,
            JobDefinitionMapper mapper,
            JobSpecValidator validator,
            SchedulerClientConfig clientConfig,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger,
            Clock clock) {
        this.schedulerJobsApi = schedulerJobsApi;
        this.mapper = mapper;
        this.validator = validator;
        this.clientConfig = clientConfig;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }
    
    /**
     * Create or update the job and return it as read back from the service.
     *
     * @throws ValidationException when the job is rejected; nothing has been sent in that case
     * @throws RemoteServiceException when the service fails the write or the read-back
     */
    public ObservedJob apply(JobSpec spec) {
        long start = clock.millis();
        MDC.put(LoggingConfig.MDC_JOB_ID, spec.name());
        JobResourceId target = null;
        try {
            target = JobResourceId.of(requireSubscription(), spec.resourceGroupName(),
                spec.jobCollectionName(), spec.name());
            structuredLogger.job().applyStarted(target);
            
            validator.validate(spec);
            
            OffsetDateTime startTime = spec.startTime() != null ? spec.startTime() : OffsetDateTime.now(clock);
            JobDefinition definition = mapper.toDefinition(spec, startTime);
            JobDefinition written = schedulerJobsApi.createOrUpdate(target, definition);
            
            JobResourceId id = adoptId(target, written);
            ObservedJob observed = fetch(id)
                .orElseThrow(() -> RemoteServiceException.missingAfterWrite(id.format()));
            
            long duration = clock.millis() - start;
            complete(ReconciliationAction.APPLY, spec.name(), id, ReconciliationOutcome.SUCCEEDED, duration, null);
            structuredLogger.job().applyCompleted(id, duration);
            log.info("Applied Scheduler Job {} in {}ms", id.jobName(), duration);
            return observed;
            
        } catch (ValidationException e) {
            complete(ReconciliationAction.APPLY, spec.name(), target, ReconciliationOutcome.REJECTED,
                clock.millis() - start, e.getErrorCode());
            metricsRegistry.recordValidationFailure("reconciliation", e.getViolations().size());
            structuredLogger.job().validationFailed(target, e.getErrorCode().getCode(), e.getViolations().size());
            throw e;
        } catch (SchedulerJobException e) {
            complete(ReconciliationAction.APPLY, spec.name(), target, ReconciliationOutcome.FAILED,
                clock.millis() - start, e.getErrorCode());
            structuredLogger.job().applyFailed(target, e.getErrorCode().getCode(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(LoggingConfig.MDC_JOB_ID);
        }
    }
    
    /**
     * @return the job, or empty when it no longer exists and its identity should be dropped
     */
    public Optional<ObservedJob> read(String resourceId) {
        JobResourceId id = JobResourceId.parse(resourceId);
        long start = clock.millis();
        MDC.put(LoggingConfig.MDC_JOB_ID, id.jobName());
        try {
            Optional<ObservedJob> observed = fetch(id);
            long duration = clock.millis() - start;
            if (observed.isEmpty()) {
                complete(ReconciliationAction.READ, id.jobName(), id, ReconciliationOutcome.GONE, duration, null);
                structuredLogger.job().gone(id);
            } else {
                complete(ReconciliationAction.READ, id.jobName(), id, ReconciliationOutcome.SUCCEEDED, duration, null);
                structuredLogger.job().readCompleted(id, duration);
            }
            return observed;
        } catch (SchedulerJobException e) {
            complete(ReconciliationAction.READ, id.jobName(), id, ReconciliationOutcome.FAILED,
                clock.millis() - start, e.getErrorCode());
            throw e;
        } finally {
            MDC.remove(LoggingConfig.MDC_JOB_ID);
        }
    }
    
    /**
     * Delete the job. A job that is already gone counts as deleted.
     */
    public void delete(String resourceId) {
        JobResourceId id = JobResourceId.parse(resourceId);
        long start = clock.millis();
        MDC.put(LoggingConfig.MDC_JOB_ID, id.jobName());
        try {
            boolean existed = schedulerJobsApi.delete(id);
            complete(ReconciliationAction.DELETE, id.jobName(), id,
                existed ? ReconciliationOutcome.SUCCEEDED : ReconciliationOutcome.ALREADY_ABSENT,
                clock.millis() - start, null);
            structuredLogger.job().deleted(id, existed);
        } catch (SchedulerJobException e) {
            complete(ReconciliationAction.DELETE, id.jobName(), id, ReconciliationOutcome.FAILED,
                clock.millis() - start, e.getErrorCode());
            structuredLogger.job().deleteFailed(id, e.getErrorCode().getCode(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(LoggingConfig.MDC_JOB_ID);
        }
    }
    
    public List<ReconciliationRecord> getHistory() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }
    
    public List<ReconciliationRecord> getHistoryForJob(String jobName) {
        return getHistory().stream()
            .filter(r -> jobName.equalsIgnoreCase(r.jobName()))
            .toList();
    }
    
    private Optional<ObservedJob> fetch(JobResourceId id) {
        return schedulerJobsApi.get(id)
            .map(definition -> new ObservedJob(id, mapper.toSpec(id, definition)));
    }
    
    /**
     * The service assigns the identifier; fall back to the requested one when the
     * response omits it.
     */
    private JobResourceId adoptId(JobResourceId target, JobDefinition written) {
        if (written.getId() == null || written.getId().isBlank()) {
            log.warn("Create/update response for Scheduler Job {} carried no id, using {}", target.jobName(), target);
            return target;
        }
        return JobResourceId.parse(written.getId());
    }
    
    private String requireSubscription() {
        String subscriptionId = clientConfig.getSubscriptionId();
        if (subscriptionId == null || subscriptionId.isBlank()) {
            throw new ValidationException(ErrorCode.CONFIGURATION_ERROR,
                "scheduler.azure.subscription-id is not configured");
        }
        return subscriptionId;
    }
    
    private void complete(ReconciliationAction action, String jobName, JobResourceId id,
            ReconciliationOutcome outcome, long durationMs, ErrorCode errorCode) {
        ReconciliationRecord record = new ReconciliationRecord(
            action,
            jobName,
            id == null ? null : id.format(),
            outcome,
            clock.instant(),
            durationMs,
            errorCode == null ? null : errorCode.getCode());
        
        synchronized (history) {
            history.add(record);
            if (history.size() > MAX_HISTORY) {
                history.remove(0);
            }
        }
        
        metricsRegistry.recordReconciliation(
            action.name().toLowerCase(Locale.ROOT), outcome.name().toLowerCase(Locale.ROOT), durationMs);
    }
}
