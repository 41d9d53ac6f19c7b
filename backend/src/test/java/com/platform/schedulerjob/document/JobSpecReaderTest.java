package com.platform.schedulerjob.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.schedulerjob.error.ErrorCode;
import com.platform.schedulerjob.error.ValidationException;
import com.platform.schedulerjob.error.ValidationException.FieldViolation;
import com.platform.schedulerjob.mapping.SetKeys;
import com.platform.schedulerjob.model.ActiveDirectoryAuthenticationSpec;
import com.platform.schedulerjob.model.CertificateAuthenticationSpec;
import com.platform.schedulerjob.model.JobSpec;
import com.platform.schedulerjob.model.MonthlyOccurrenceSpec;
import com.platform.schedulerjob.model.RetrySpec;
import jakarta.validation.Validation;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class JobSpecReaderTest {
    
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JobSpecReader reader = new JobSpecReader(
        Validation.buildDefaultValidatorFactory().getValidator());
    
    private JobSpec read(String json) throws Exception {
        return reader.read(objectMapper.readTree(json));
    }
    
    private List<FieldViolation> violations(String json) throws Exception {
        JsonNode document = objectMapper.readTree(json);
        ValidationException ex = catchThrowableOfType(() -> reader.read(document), ValidationException.class);
        assertThat(ex).as("expected the document to be rejected").isNotNull();
        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.VALIDATION_ERROR);
        return ex.getViolations();
    }
    
    private static String job(String extra) {
        return """
            {
              "name": "nightly",
              "resource_group_name": "rg-jobs",
              "job_collection_name": "collection-1",
              "action_web": {"url": "https://example.com/run", "method": "Get"}%s
            }
            """.formatted(extra.isEmpty() ? "" : ", " + extra);
    }
    
    @Test
    void readsMinimalJob() throws Exception {
        JobSpec spec = read(job(""));
        
        assertThat(spec.name()).isEqualTo("nightly");
        assertThat(spec.resourceGroupName()).isEqualTo("rg-jobs");
        assertThat(spec.jobCollectionName()).isEqualTo("collection-1");
        assertThat(spec.action().url()).isEqualTo("https://example.com/run");
        assertThat(spec.action().method()).isEqualTo("Get");
        assertThat(spec.errorAction()).isNull();
        assertThat(spec.retry()).isNull();
        assertThat(spec.recurrence()).isNull();
        assertThat(spec.startTime()).isNull();
        assertThat(spec.state()).isNull();
    }
    
    @Test
    void emptyRetryBlockTakesDefaults() throws Exception {
        assertThat(read(job("\"retry\": {}")).retry()).isEqualTo(RetrySpec.defaults());
        assertThat(read(job("\"retry\": {\"count\": 7}")).retry()).isEqualTo(new RetrySpec("00:00:30", 7));
        assertThat(read(job("\"retry\": null")).retry()).isNull();
    }
    
    @Test
    void recurrenceDefaultsAndSchedule() throws Exception {
        JobSpec spec = read(job("""
            "recurrence": {
              "frequency": "Month",
              "count": 12,
              "minutes": [],
              "hours": [6, 18, 6],
              "monthly_occurrences": [{"day": "Friday", "occurrence": -1}]
            }
            """));
        
        assertThat(spec.recurrence().interval()).isEqualTo(1);
        assertThat(spec.recurrence().count()).isEqualTo(12);
        assertThat(spec.recurrence().schedule().minutes()).isEmpty();
        assertThat(spec.recurrence().schedule().hours().toList()).containsExactly(6, 18);
        assertThat(spec.recurrence().schedule().monthlyOccurrences())
            .isEqualTo(SetKeys.monthlyOccurrenceSet(List.of(new MonthlyOccurrenceSpec("friday", -1))));
    }
    
    @Test
    void emptyListsLeaveTheScheduleEmpty() throws Exception {
        JobSpec spec = read(job("\"recurrence\": {\"frequency\": \"Day\", \"count\": 1, \"week_days\": [], \"month_days\": []}"));
        
        assertThat(spec.recurrence().schedule().isEmpty()).isTrue();
    }
    
    @Test
    void readsAuthenticationAndTimestamps() throws Exception {
        JobSpec spec = read("""
            {
              "name": "nightly",
              "resource_group_name": "rg-jobs",
              "job_collection_name": "collection-1",
              "action_web": {
                "url": "https://example.com/run",
                "method": "Post",
                "authentication_active_directory": {"tenant_id": "t", "client_id": "c", "secret": "s"}
              },
              "error_action_web": {
                "url": "https://example.com/failed",
                "method": "Put",
                "authentication_certificate": {"pfx": "cGZ4", "password": "pw", "thumbprint": "ignored"}
              },
              "start_time": "2024-03-01T08:00:00+02:00",
              "state": "Disabled"
            }
            """);
        
        assertThat(spec.action().authentication()).isEqualTo(new ActiveDirectoryAuthenticationSpec("t", "c", "s", null));
        assertThat(spec.errorAction().authentication()).isEqualTo(CertificateAuthenticationSpec.of("cGZ4", "pw"));
        assertThat(spec.startTime()).isEqualTo(OffsetDateTime.parse("2024-03-01T08:00:00+02:00"));
        assertThat(spec.state()).isEqualTo("Disabled");
    }
    
    @Test
    void acceptsIdOfAnObservedDocument() throws Exception {
        JobSpec spec = read(job("\"id\": \"/subscriptions/s/resourceGroups/rg-jobs/providers/Microsoft.Scheduler/jobCollections/collection-1/jobs/nightly\""));
        
        assertThat(spec.name()).isEqualTo("nightly");
    }
    
    @Test
    void reportsAllViolationsTogether() throws Exception {
        List<FieldViolation> violations = violations("""
            {
              "resource_group_name": "rg-jobs",
              "job_collection_name": "collection-1",
              "action_web": {"method": "Get"},
              "retry": {"count": 21},
              "colour": "blue"
            }
            """);
        
        assertThat(violations).extracting(FieldViolation::field)
            .containsExactlyInAnyOrder("colour", "name", "action_web.url", "retry.count");
    }
    
    @Test
    void rejectsBadScalars() throws Exception {
        List<FieldViolation> violations = violations("""
            {
              "name": "1nightly",
              "resource_group_name": "rg-jobs",
              "job_collection_name": "collection-1",
              "action_web": {"url": "ftp://example.com", "method": "Patch"},
              "recurrence": {"frequency": "Year", "interval": 0, "count": 1, "end_time": "tomorrow"},
              "start_time": "2024-03-01",
              "state": "Faulted"
            }
            """);
        
        assertThat(violations).extracting(FieldViolation::field).containsExactlyInAnyOrder(
            "name", "action_web.url", "action_web.method", "recurrence.frequency", "recurrence.interval",
            "recurrence.end_time", "start_time", "state");
    }
    
    @Test
    void rejectsOutOfRangeScheduleElements() throws Exception {
        List<FieldViolation> violations = violations(job("""
            "recurrence": {
              "frequency": "Month",
              "count": 1,
              "minutes": [0, 60],
              "hours": [24],
              "month_days": [-31, 0, 32]
            }
            """));
        
        assertThat(violations).extracting(FieldViolation::field).containsExactlyInAnyOrder(
            "recurrence.minutes[1]", "recurrence.hours[0]", "recurrence.month_days[1]", "recurrence.month_days[2]");
    }
    
    @Test
    void rejectsBadDaysAndOccurrences() throws Exception {
        List<FieldViolation> violations = violations(job("""
            "recurrence": {
              "frequency": "Month",
              "count": 1,
              "monthly_occurrences": [{"day": "Funday", "occurrence": 1}, {"day": "Monday", "occurrence": 0}, {"day": "Monday"}]
            }
            """));
        
        assertThat(violations).extracting(FieldViolation::field).containsExactlyInAnyOrder(
            "recurrence.monthly_occurrences[0].day",
            "recurrence.monthly_occurrences[1].occurrence",
            "recurrence.monthly_occurrences[2].occurrence");
    }
    
    @Test
    void daySelectorsAreMutuallyExclusive() throws Exception {
        List<FieldViolation> violations = violations(job(
            "\"recurrence\": {\"frequency\": \"Week\", \"count\": 1, \"week_days\": [\"Monday\"], \"month_days\": [1]}"));
        
        assertThat(violations).singleElement()
            .satisfies(v -> assertThat(v.field()).isEqualTo("recurrence.week_days"));
    }
    
    @Test
    void onlyOneAuthenticationBlockPerAction() throws Exception {
        List<FieldViolation> violations = violations(job("").replace(
            "\"method\": \"Get\"}",
            "\"method\": \"Get\", \"authentication_basic\": {\"username\": \"u\", \"password\": \"p\"}, "
                + "\"authentication_active_directory\": {\"tenant_id\": \"t\", \"client_id\": \"c\", \"secret\": \"s\"}}"));
        
        assertThat(violations).extracting(FieldViolation::field).containsExactly("action_web.authentication_basic");
    }
    
    @Test
    void missingSecretIsReportedOnItsBlock() throws Exception {
        List<FieldViolation> violations = violations(job("").replace(
            "\"method\": \"Get\"}",
            "\"method\": \"Get\", \"authentication_basic\": {\"username\": \"u\"}}"));
        
        assertThat(violations).singleElement().satisfies(v -> {
            assertThat(v.field()).isEqualTo("action_web.authentication_basic.password");
            assertThat(v.rejectedValue()).isNull();
        });
    }
    
    @Test
    void rejectsNonObjectDocument() throws Exception {
        JsonNode document = objectMapper.readTree("[1, 2]");
        
        ValidationException ex = catchThrowableOfType(() -> reader.read(document), ValidationException.class);
        
        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.INVALID_REQUEST);
    }
}
