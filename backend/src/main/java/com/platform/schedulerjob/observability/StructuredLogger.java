package com.platform.schedulerjob.observability;

import com.platform.schedulerjob.resource.JobResourceId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Structured logger for reconciliation events.
 * 
 * REPLACES: log.info("job applied")
 * WITH: structuredLogger.job().applyCompleted(...)
 * 
 * All events are JSON-formatted and machine-parsable.
 */
@Component
public class StructuredLogger {
    
    private final String serviceName;
    private final String environment;
    
    public StructuredLogger(
            @Value("${spring.application.name:scheduler-job-control-plane}") String serviceName,
            @Value("${scheduler.environment:development}") String environment) {
        this.serviceName = serviceName;
        this.environment = environment;
    }
    
    /**
     * Get job reconciliation event logger.
     */
    public JobLogger job() {
        return new JobLogger(serviceName, environment);
    }
    
    // ==================== JOB LOGGER ====================
    
    public static class JobLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.job");
        private final String service;
        private final String environment;
        
        JobLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }
        
        public void applyStarted(JobResourceId id) {
            StructuredLogEvent event = base(LogEventType.JOB_APPLY_STARTED, "INFO", id)
                .action("apply")
                .build();
            log.info(event.toJson());
        }
        
        public void applyCompleted(JobResourceId id, long durationMs) {
            StructuredLogEvent event = base(LogEventType.JOB_APPLY_COMPLETED, "INFO", id)
                .action("apply")
                .success(true)
                .durationMs(durationMs)
                .build();
            log.info(event.toJson());
        }
        
        public void applyFailed(JobResourceId id, String errorCode, String errorMessage) {
            StructuredLogEvent event = base(LogEventType.JOB_APPLY_FAILED, "ERROR", id)
                .action("apply")
                .success(false)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
            log.error(event.toJson());
        }
        
        public void validationFailed(JobResourceId id, String errorCode, int violations) {
            StructuredLogEvent event = base(LogEventType.JOB_VALIDATION_FAILED, "WARN", id)
                .action("apply")
                .success(false)
                .errorCode(errorCode)
                .context(Map.of("violations", violations))
                .build();
            log.warn(event.toJson());
        }
        
        public void readCompleted(JobResourceId id, long durationMs) {
            StructuredLogEvent event = base(LogEventType.JOB_READ_COMPLETED, "DEBUG", id)
                .action("read")
                .success(true)
                .durationMs(durationMs)
                .build();
            log.debug(event.toJson());
        }
        
        public void gone(JobResourceId id) {
            StructuredLogEvent event = base(LogEventType.JOB_GONE, "WARN", id)
                .action("read")
                .message("Scheduler Job no longer exists, clearing local identity")
                .build();
            log.warn(event.toJson());
        }
        
        public void deleted(JobResourceId id, boolean existed) {
            StructuredLogEvent event = base(LogEventType.JOB_DELETED, "INFO", id)
                .action("delete")
                .success(true)
                .context(Map.of("existed", existed))
                .build();
            log.info(event.toJson());
        }
        
        public void deleteFailed(JobResourceId id, String errorCode, String errorMessage) {
            StructuredLogEvent event = base(LogEventType.JOB_DELETE_FAILED, "ERROR", id)
                .action("delete")
                .success(false)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
            log.error(event.toJson());
        }
        
        private StructuredLogEvent.StructuredLogEventBuilder base(LogEventType type, String level, JobResourceId id) {
            StructuredLogEvent.StructuredLogEventBuilder builder =
                StructuredLogEvent.fromContext(service, environment, type, level);
            if (id != null) {
                builder.jobId(id.jobName())
                    .resourceGroup(id.resourceGroup())
                    .jobCollection(id.jobCollection());
            }
            return builder;
        }
    }
}
