package com.platform.schedulerjob.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * DTOs for the scheduler management API (api-version 2016-03-01).
 * Unset fields are omitted from requests: the service rejects an empty schedule object,
 * and a retry policy of type None must not carry an interval or count.
 */
public class SchedulerJobModels {
    
    /**
     * Top-level job resource.
     */
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JobDefinition {
        private String id;
        private String type;
        private String name;
        private JobProperties properties;
    }
    
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JobProperties {
        private OffsetDateTime startTime;
        private JobAction action;
        private JobRecurrence recurrence;
        private String state;
        private JobStatus status;
    }
    
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JobAction {
        
        /**
         * Http, Https, StorageQueue, ServiceBusQueue or ServiceBusTopic.
         */
        private String type;
        private HttpRequest request;
        private RetryPolicy retryPolicy;
        private JobErrorAction errorAction;
    }
    
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JobErrorAction {
        private String type;
        private HttpRequest request;
        private RetryPolicy retryPolicy;
    }
    
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HttpRequest {
        private HttpAuthentication authentication;
        private String uri;
        private String method;
        private String body;
        private Map<String, String> headers;
    }
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetryPolicy {
        
        /**
         * None or Fixed.
         */
        private String retryType;
        private String retryInterval;
        private Integer retryCount;
    }
    
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JobRecurrence {
        private String frequency;
        private Integer interval;
        private Integer count;
        private OffsetDateTime endTime;
        private JobRecurrenceSchedule schedule;
    }
    
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JobRecurrenceSchedule {
        private List<String> weekDays;
        private List<Integer> hours;
        private List<Integer> minutes;
        private List<Integer> monthDays;
        private List<MonthlyOccurrence> monthlyOccurrences;
    }
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MonthlyOccurrence {
        private String day;
        
        @JsonProperty("Occurrence")
        private Integer occurrence;
    }
    
    /**
     * Execution statistics, computed by the service and never sent.
     */
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JobStatus {
        private Integer executionCount;
        private Integer failureCount;
        private Integer faultedCount;
        private OffsetDateTime lastExecutionTime;
        private OffsetDateTime nextExecutionTime;
    }
}
