package com.platform.schedulerjob.mapping;

import com.platform.schedulerjob.mapping.ActionRequestMapper.EncodedAction;
import com.platform.schedulerjob.model.JobSpec;
import com.platform.schedulerjob.remote.JobActionType;
import com.platform.schedulerjob.remote.SchedulerClientConfig;
import com.platform.schedulerjob.remote.SchedulerJobModels.JobAction;
import com.platform.schedulerjob.remote.SchedulerJobModels.JobDefinition;
import com.platform.schedulerjob.remote.SchedulerJobModels.JobErrorAction;
import com.platform.schedulerjob.remote.SchedulerJobModels.JobProperties;
import com.platform.schedulerjob.resource.JobResourceId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;

/**
 * Assembles the complete job payload from a {@link JobSpec} and reconstructs the
 * spec from a payload returned by the service.
 *
 * <p>The only environment input is the default OAuth audience, fixed at construction.
 */
@Slf4j
@Component
public class JobDefinitionMapper {
    
    private final String defaultAudience;
    
    @Autowired
    public JobDefinitionMapper(SchedulerClientConfig config) {
        this(config.getServiceManagementEndpoint());
    }
    
    public JobDefinitionMapper(String defaultAudience) {
        this.defaultAudience = defaultAudience;
    }
    
    public String getDefaultAudience() {
        return defaultAudience;
    }
    
    /**
     * Build the create/update payload.
     *
     * @param startTime resolved start time; the caller substitutes "now" for an unset one
     */
    public JobDefinition toDefinition(JobSpec spec, OffsetDateTime startTime) {
        JobAction action = new JobAction();
        if (spec.action() != null) {
            EncodedAction encoded = ActionRequestMapper.encode(spec.action(), defaultAudience);
            action.setType(encoded.type().wireValue());
            action.setRequest(encoded.request());
        }
        
        if (spec.errorAction() != null) {
            EncodedAction encoded = ActionRequestMapper.encode(spec.errorAction(), defaultAudience);
            JobErrorAction errorAction = new JobErrorAction();
            errorAction.setType(encoded.type().wireValue());
            errorAction.setRequest(encoded.request());
            action.setErrorAction(errorAction);
        }
        
        action.setRetryPolicy(RetryPolicyMapper.encode(spec.retry()));
        
        JobProperties properties = new JobProperties();
        properties.setAction(action);
        properties.setStartTime(startTime);
        if (spec.recurrence() != null) {
            properties.setRecurrence(RecurrenceMapper.encode(spec.recurrence()));
        }
        if (spec.state() != null && !spec.state().isEmpty()) {
            properties.setState(spec.state());
        }
        
        JobDefinition definition = new JobDefinition();
        definition.setProperties(properties);
        return definition;
    }
    
    /**
     * Reconstruct the observed spec. Identity fields come from the resource id, never
     * from the payload. Actions of a non-web type are left out, and so is their error action.
     */
    public JobSpec toSpec(JobResourceId id, JobDefinition definition) {
        JobSpec.JobSpecBuilder builder = JobSpec.builder()
            .name(id.jobName())
            .resourceGroupName(id.resourceGroup())
            .jobCollectionName(id.jobCollection());
        
        JobProperties properties = definition.getProperties();
        if (properties == null) {
            return builder.build();
        }
        
        JobAction action = properties.getAction();
        if (action != null) {
            boolean web = JobActionType.fromValue(action.getType())
                .map(JobActionType::isWeb)
                .orElse(false);
            if (web) {
                if (action.getRequest() != null) {
                    builder.action(ActionRequestMapper.decode(action.getRequest()));
                }
                JobErrorAction errorAction = action.getErrorAction();
                if (errorAction != null && errorAction.getRequest() != null) {
                    builder.errorAction(ActionRequestMapper.decode(errorAction.getRequest()));
                }
            } else {
                log.debug("Scheduler Job {} has action type {}, not reflected in configuration",
                    id.jobName(), action.getType());
            }
            builder.retry(RetryPolicyMapper.decode(action.getRetryPolicy()));
        }
        
        if (properties.getRecurrence() != null) {
            builder.recurrence(RecurrenceMapper.decode(properties.getRecurrence()));
        }
        
        return builder
            .startTime(properties.getStartTime())
            .state(properties.getState())
            .build();
    }
}
