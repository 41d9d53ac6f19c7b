package com.platform.schedulerjob.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.platform.schedulerjob.model.ActiveDirectoryAuthenticationSpec;
import com.platform.schedulerjob.model.JobSpec;
import com.platform.schedulerjob.model.MonthlyOccurrenceSpec;
import com.platform.schedulerjob.model.RecurrenceSpec;
import com.platform.schedulerjob.model.RetrySpec;
import com.platform.schedulerjob.model.ScheduleSpec;
import com.platform.schedulerjob.model.WebActionSpec;
import com.platform.schedulerjob.remote.SchedulerJobModels.JobDefinition;
import com.platform.schedulerjob.resource.JobResourceId;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JobDefinitionMapperTest {
    
    private static final String AUDIENCE = "https://management.core.windows.net/";
    private static final OffsetDateTime START = OffsetDateTime.parse("2024-03-01T08:00:00Z");
    private static final JobResourceId ID = JobResourceId.of("sub-1", "rg-jobs", "collection-1", "nightly");
    
    private final JobDefinitionMapper mapper = new JobDefinitionMapper(AUDIENCE);
    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    
    private static JobSpec.JobSpecBuilder minimalSpec() {
        return JobSpec.builder()
            .name("nightly")
            .resourceGroupName("rg-jobs")
            .jobCollectionName("collection-1")
            .action(WebActionSpec.builder().url("https://example.com/run").method("Get").build());
    }
    
    @Test
    void minimalJobSendsNoRetryAndNoRecurrence() throws Exception {
        JsonNode json = objectMapper.valueToTree(mapper.toDefinition(minimalSpec().build(), START));
        
        JsonNode properties = json.get("properties");
        assertThat(properties.get("startTime").asText()).isEqualTo("2024-03-01T08:00:00Z");
        assertThat(properties.has("recurrence")).isFalse();
        assertThat(properties.has("state")).isFalse();
        assertThat(properties.path("action").get("type").asText()).isEqualTo("Https");
        assertThat(properties.path("action").path("retryPolicy").get("retryType").asText()).isEqualTo("None");
        assertThat(properties.path("action").path("retryPolicy").has("retryInterval")).isFalse();
        assertThat(properties.path("action").has("errorAction")).isFalse();
    }
    
    @Test
    void emptyScheduleIsLeftOutOfTheRequest() {
        JobSpec spec = minimalSpec()
            .recurrence(RecurrenceSpec.builder()
                .frequency("Minute")
                .interval(5)
                .count(3)
                .schedule(ScheduleSpec.builder().minutes(SetKeys.intSet()).build())
                .build())
            .build();
        
        JsonNode recurrence = objectMapper.valueToTree(mapper.toDefinition(spec, START))
            .path("properties").path("recurrence");
        
        assertThat(recurrence.get("frequency").asText()).isEqualTo("Minute");
        assertThat(recurrence.has("schedule")).isFalse();
    }
    
    @Test
    void fullJobUsesWireNames() {
        JobSpec spec = minimalSpec()
            .action(WebActionSpec.builder()
                .url("http://example.com/run")
                .method("Post")
                .authentication(new ActiveDirectoryAuthenticationSpec("tenant", "client", "secret", null))
                .build())
            .errorAction(WebActionSpec.builder().url("https://example.com/failed").method("Put").build())
            .retry(RetrySpec.defaults())
            .recurrence(RecurrenceSpec.builder()
                .frequency("Month")
                .interval(1)
                .endTime(OffsetDateTime.parse("2025-01-01T00:00:00Z"))
                .schedule(ScheduleSpec.builder()
                    .monthlyOccurrences(SetKeys.monthlyOccurrenceSet(List.of(new MonthlyOccurrenceSpec("Monday", 1))))
                    .build())
                .build())
            .state("disabled")
            .build();
        
        JsonNode properties = objectMapper.valueToTree(mapper.toDefinition(spec, START)).path("properties");
        JsonNode action = properties.path("action");
        
        assertThat(action.get("type").asText()).isEqualTo("Http");
        assertThat(action.path("request").path("authentication").get("type").asText()).isEqualTo("ActiveDirectoryOAuth");
        assertThat(action.path("request").path("authentication").get("audience").asText()).isEqualTo(AUDIENCE);
        assertThat(action.path("errorAction").get("type").asText()).isEqualTo("Https");
        assertThat(action.path("retryPolicy").get("retryType").asText()).isEqualTo("Fixed");
        assertThat(action.path("retryPolicy").get("retryInterval").asText()).isEqualTo("00:00:30");
        assertThat(action.path("retryPolicy").get("retryCount").asInt()).isEqualTo(4);
        assertThat(properties.path("recurrence").path("schedule").path("monthlyOccurrences").get(0).get("Occurrence").asInt())
            .isEqualTo(1);
        assertThat(properties.get("state").asText()).isEqualTo("disabled");
    }
    
    @Test
    void readsServiceResponse() throws Exception {
        String response = """
            {
              "id": "/subscriptions/sub-1/resourceGroups/rg-jobs/providers/Microsoft.Scheduler/jobCollections/collection-1/jobs/nightly",
              "name": "collection-1/nightly",
              "properties": {
                "startTime": "2024-03-01T08:00:00Z",
                "state": "Enabled",
                "action": {
                  "type": "Https",
                  "request": {
                    "uri": "https://example.com/run",
                    "method": "GET",
                    "headers": {"X-Job": "nightly"},
                    "authentication": {"type": "Basic", "username": "admin"}
                  },
                  "errorAction": {
                    "type": "Http",
                    "request": {"uri": "http://example.com/failed", "method": "POST", "authentication": {"type": "NotSpecified"}}
                  },
                  "retryPolicy": {"retryType": "Fixed", "retryInterval": "00:01:00", "retryCount": 2}
                },
                "recurrence": {
                  "frequency": "Week",
                  "interval": 1,
                  "count": 10,
                  "schedule": {"weekDays": ["monday"], "hours": [6]}
                },
                "status": {"executionCount": 3, "nextExecutionTime": "2024-03-04T06:00:00Z"}
              }
            }
            """;
        
        JobSpec spec = mapper.toSpec(ID, objectMapper.readValue(response, JobDefinition.class));
        
        assertThat(spec.name()).isEqualTo("nightly");
        assertThat(spec.resourceGroupName()).isEqualTo("rg-jobs");
        assertThat(spec.jobCollectionName()).isEqualTo("collection-1");
        assertThat(spec.state()).isEqualTo("Enabled");
        assertThat(spec.startTime().isEqual(START)).isTrue();
        assertThat(spec.action().url()).isEqualTo("https://example.com/run");
        assertThat(spec.action().headers()).containsEntry("X-Job", "nightly");
        assertThat(spec.action().authentication().toString()).contains("BasicAuthenticationSpec");
        assertThat(spec.errorAction().url()).isEqualTo("http://example.com/failed");
        assertThat(spec.errorAction().authentication()).isNull();
        assertThat(spec.retry()).isEqualTo(new RetrySpec("00:01:00", 2));
        assertThat(spec.recurrence().schedule().weekDays())
            .isEqualTo(SetKeys.stringSetIgnoreCase(List.of("Monday")));
        assertThat(spec.recurrence().schedule().hours()).containsExactly(6);
    }
    
    @Test
    void nonWebActionIsNotReflected() throws Exception {
        String response = """
            {
              "properties": {
                "action": {
                  "type": "StorageQueue",
                  "errorAction": {"type": "Https", "request": {"uri": "https://example.com", "method": "GET"}},
                  "retryPolicy": {"retryType": "None"}
                }
              }
            }
            """;
        
        JobSpec spec = mapper.toSpec(ID, objectMapper.readValue(response, JobDefinition.class));
        
        assertThat(spec.action()).isNull();
        assertThat(spec.errorAction()).isNull();
        assertThat(spec.retry()).isNull();
        assertThat(spec.recurrence()).isNull();
    }
    
    @Test
    void encodeThenDecodeIsStableForSecretFreeJobs() {
        JobSpec spec = minimalSpec()
            .retry(new RetrySpec("00:02:00", 3))
            .recurrence(RecurrenceSpec.builder()
                .frequency("Day")
                .interval(1)
                .count(7)
                .schedule(ScheduleSpec.builder().hours(SetKeys.intSet(List.of(23, 1))).build())
                .build())
            .startTime(START)
            .state("enabled")
            .build();
        
        JobSpec decoded = mapper.toSpec(ID, mapper.toDefinition(spec, START));
        
        assertThat(decoded).isEqualTo(spec);
    }
}
