package com.platform.schedulerjob.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.schedulerjob.error.ErrorCode;
import com.platform.schedulerjob.error.ValidationException;
import com.platform.schedulerjob.error.ValidationException.FieldViolation;
import com.platform.schedulerjob.mapping.SetKeys;
import com.platform.schedulerjob.model.ActiveDirectoryAuthenticationSpec;
import com.platform.schedulerjob.model.AuthenticationSpec;
import com.platform.schedulerjob.model.BasicAuthenticationSpec;
import com.platform.schedulerjob.model.CertificateAuthenticationSpec;
import com.platform.schedulerjob.model.JobSpec;
import com.platform.schedulerjob.model.MonthlyOccurrenceSpec;
import com.platform.schedulerjob.model.RecurrenceSpec;
import com.platform.schedulerjob.model.RetrySpec;
import com.platform.schedulerjob.model.ScheduleSpec;
import com.platform.schedulerjob.model.WebActionSpec;
import com.platform.schedulerjob.model.Weekday;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Path;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.IntPredicate;
import java.util.stream.Collectors;

/**
 * Reads a configuration document into a {@link JobSpec}.
 *
 * <p>Checks everything a declarative schema would: required keys, types, enum membership,
 * element ranges, timestamps and mutually exclusive blocks. Scalar constraints declared on the
 * model records are then checked through Bean Validation. All problems of one document are
 * reported together in a single {@link ValidationException}.
 */
@Slf4j
@Component
public class JobSpecReader {
    
    static final Set<String> JOB_KEYS = Set.of(
        "id", "name", "resource_group_name", "job_collection_name", "action_web", "error_action_web",
        "retry", "recurrence", "start_time", "state");
    static final Set<String> ACTION_KEYS = Set.of(
        "url", "method", "body", "headers",
        "authentication_basic", "authentication_certificate", "authentication_active_directory");
    static final Set<String> BASIC_KEYS = Set.of("username", "password");
    static final Set<String> CERTIFICATE_KEYS = Set.of("pfx", "password", "thumbprint", "expiration", "subject_name");
    static final Set<String> ACTIVE_DIRECTORY_KEYS = Set.of("tenant_id", "client_id", "secret", "audience");
    static final Set<String> RETRY_KEYS = Set.of("interval", "count");
    static final Set<String> RECURRENCE_KEYS = Set.of(
        "frequency", "interval", "count", "end_time",
        "minutes", "hours", "week_days", "month_days", "monthly_occurrences");
    static final Set<String> OCCURRENCE_KEYS = Set.of("day", "occurrence");
    
    private static final Set<String> STATES = Set.of("enabled", "disabled");
    
    private final Validator validator;
    
    public JobSpecReader(Validator validator) {
        this.validator = validator;
    }
    
    /**
     * @throws ValidationException listing every violation found in the document
     */
    public JobSpec read(JsonNode document) {
        if (document == null || !document.isObject()) {
            throw new ValidationException(ErrorCode.INVALID_REQUEST, "Configuration document must be a JSON object");
        }
        
        JobDocument doc = JobDocument.root((ObjectNode) document);
        doc.rejectUnknownKeys(JOB_KEYS);
        
        JobSpec spec = JobSpec.builder()
            .name(required(doc, "name"))
            .resourceGroupName(required(doc, "resource_group_name"))
            .jobCollectionName(required(doc, "job_collection_name"))
            .action(doc.object("action_web").map(this::readWebAction).orElse(null))
            .errorAction(doc.object("error_action_web").map(this::readWebAction).orElse(null))
            .retry(doc.object("retry").map(this::readRetry).orElse(null))
            .recurrence(doc.object("recurrence").map(this::readRecurrence).orElse(null))
            .startTime(timestamp(doc, "start_time"))
            .state(readState(doc))
            .build();
        
        List<FieldViolation> violations = new ArrayList<>(doc.violations());
        Set<String> reported = violations.stream().map(FieldViolation::field).collect(Collectors.toSet());
        for (ConstraintViolation<JobSpec> violation : validator.validate(spec)) {
            String field = documentPath(violation.getPropertyPath(), violation.getLeafBean());
            if (reported.add(field)) {
                violations.add(new FieldViolation(field, rejectedValue(field, violation.getInvalidValue()),
                    violation.getMessage()));
            }
        }
        
        if (!violations.isEmpty()) {
            log.debug("Rejected configuration for Scheduler Job {}: {} violations", spec.name(), violations.size());
            throw new ValidationException(ErrorCode.VALIDATION_ERROR, violations);
        }
        return spec;
    }
    
    private WebActionSpec readWebAction(JobDocument action) {
        action.rejectUnknownKeys(ACTION_KEYS);
        
        List<AuthenticationSpec> authentications = new ArrayList<>();
        ConfigValue<JobDocument> basic = action.object("authentication_basic");
        if (basic.isSet()) {
            authentications.add(readBasic(basic.get()));
        }
        ConfigValue<JobDocument> certificate = action.object("authentication_certificate");
        if (certificate.isSet()) {
            authentications.add(readCertificate(certificate.get()));
        }
        ConfigValue<JobDocument> activeDirectory = action.object("authentication_active_directory");
        if (activeDirectory.isSet()) {
            authentications.add(readActiveDirectory(activeDirectory.get()));
        }
        if (authentications.size() > 1) {
            action.reject("authentication_basic",
                "only one of authentication_basic, authentication_certificate or authentication_active_directory can be set");
        }
        
        return WebActionSpec.builder()
            .url(required(action, "url"))
            .method(required(action, "method"))
            .body(action.string("body").orElse(null))
            .headers(action.stringMap("headers").orElse(null))
            .authentication(authentications.isEmpty() ? null : authentications.get(0))
            .build();
    }
    
    private AuthenticationSpec readBasic(JobDocument basic) {
        basic.rejectUnknownKeys(BASIC_KEYS);
        return new BasicAuthenticationSpec(required(basic, "username"), required(basic, "password"));
    }
    
    private AuthenticationSpec readCertificate(JobDocument certificate) {
        // thumbprint, expiration and subject_name are computed by the service and ignored on input
        certificate.rejectUnknownKeys(CERTIFICATE_KEYS);
        return CertificateAuthenticationSpec.of(required(certificate, "pfx"), required(certificate, "password"));
    }
    
    private AuthenticationSpec readActiveDirectory(JobDocument activeDirectory) {
        activeDirectory.rejectUnknownKeys(ACTIVE_DIRECTORY_KEYS);
        return new ActiveDirectoryAuthenticationSpec(
            required(activeDirectory, "tenant_id"),
            required(activeDirectory, "client_id"),
            required(activeDirectory, "secret"),
            activeDirectory.string("audience").orElse(null));
    }
    
    private RetrySpec readRetry(JobDocument retry) {
        retry.rejectUnknownKeys(RETRY_KEYS);
        return new RetrySpec(
            retry.string("interval").orElse(RetrySpec.DEFAULT_INTERVAL),
            retry.integer("count").orElse(RetrySpec.DEFAULT_COUNT));
    }
    
    private RecurrenceSpec readRecurrence(JobDocument recurrence) {
        recurrence.rejectUnknownKeys(RECURRENCE_KEYS);
        
        ConfigValue<List<String>> weekDays = recurrence.stringList("week_days");
        ConfigValue<List<Integer>> monthDays = recurrence.integerList("month_days");
        ConfigValue<List<JobDocument>> occurrences = recurrence.objectList("monthly_occurrences");
        rejectConflicts(recurrence, weekDays, monthDays, occurrences);
        
        ScheduleSpec schedule = ScheduleSpec.builder()
            .minutes(SetKeys.intSet(checkedRange(recurrence, "minutes",
                recurrence.integerList("minutes"), v -> v >= 0 && v <= 59, "must be between 0 and 59")))
            .hours(SetKeys.intSet(checkedRange(recurrence, "hours",
                recurrence.integerList("hours"), v -> v >= 0 && v <= 23, "must be between 0 and 23")))
            .weekDays(SetKeys.stringSetIgnoreCase(checkedDays(recurrence, "week_days", weekDays)))
            .monthDays(SetKeys.intSet(checkedRange(recurrence, "month_days",
                monthDays, v -> v >= -31 && v <= 31 && v != 0, "must be between -31 and 31 and not 0")))
            .monthlyOccurrences(SetKeys.monthlyOccurrenceSet(readOccurrences(occurrences)))
            .build();
        
        return RecurrenceSpec.builder()
            .frequency(required(recurrence, "frequency"))
            .interval(recurrence.integer("interval").orElse(RecurrenceSpec.DEFAULT_INTERVAL))
            .count(recurrence.integer("count").orElse(null))
            .endTime(timestamp(recurrence, "end_time"))
            .schedule(schedule)
            .build();
    }
    
    private void rejectConflicts(JobDocument recurrence, ConfigValue<?>... daySelectors) {
        int set = 0;
        for (ConfigValue<?> selector : daySelectors) {
            if (selector.isSet()) {
                set++;
            }
        }
        if (set > 1) {
            recurrence.reject("week_days", "only one of week_days, month_days or monthly_occurrences can be set");
        }
    }
    
    private List<Integer> checkedRange(JobDocument recurrence, String key, ConfigValue<List<Integer>> values,
            IntPredicate inRange, String message) {
        List<Integer> result = new ArrayList<>();
        List<Integer> list = values.orElse(List.of());
        for (int i = 0; i < list.size(); i++) {
            Integer value = list.get(i);
            if (inRange.test(value)) {
                result.add(value);
            } else {
                recurrence.reject(key + "[" + i + "]", value, message);
            }
        }
        return result;
    }
    
    private List<String> checkedDays(JobDocument recurrence, String key, ConfigValue<List<String>> values) {
        List<String> result = new ArrayList<>();
        List<String> list = values.orElse(List.of());
        for (int i = 0; i < list.size(); i++) {
            String day = list.get(i);
            if (Weekday.fromValue(day).isPresent()) {
                result.add(day);
            } else {
                recurrence.reject(key + "[" + i + "]", day, "must be a day of the week");
            }
        }
        return result;
    }
    
    private List<MonthlyOccurrenceSpec> readOccurrences(ConfigValue<List<JobDocument>> occurrences) {
        List<MonthlyOccurrenceSpec> result = new ArrayList<>();
        for (JobDocument occurrence : occurrences.orElse(List.of())) {
            occurrence.rejectUnknownKeys(OCCURRENCE_KEYS);
            String day = required(occurrence, "day");
            ConfigValue<Integer> number = occurrence.integer("occurrence");
            
            boolean valid = day != null;
            if (day != null && Weekday.fromValue(day).isEmpty()) {
                occurrence.reject("day", day, "must be a day of the week");
                valid = false;
            }
            if (!number.isSet()) {
                occurrence.reject("occurrence", "is required");
                valid = false;
            } else if (number.get() < -5 || number.get() > 5 || number.get() == 0) {
                occurrence.reject("occurrence", number.get(), "must be between -5 and 5 and not 0");
                valid = false;
            }
            if (valid) {
                result.add(new MonthlyOccurrenceSpec(day, number.get()));
            }
        }
        return result;
    }
    
    private String readState(JobDocument doc) {
        ConfigValue<String> state = doc.string("state");
        if (state.isSet() && !STATES.contains(state.get().toLowerCase(Locale.ROOT))) {
            doc.reject("state", state.get(), "must be enabled or disabled");
            return null;
        }
        return state.orElse(null);
    }
    
    private static String required(JobDocument doc, String key) {
        ConfigValue<String> value = doc.string(key);
        if (!value.isSet()) {
            doc.reject(key, "is required");
            return null;
        }
        return value.get();
    }
    
    private static OffsetDateTime timestamp(JobDocument doc, String key) {
        ConfigValue<String> value = doc.string(key);
        if (!value.isSet()) {
            return null;
        }
        try {
            return Rfc3339.parse(value.get());
        } catch (DateTimeParseException e) {
            doc.reject(key, value.get(), "must be an RFC3339 timestamp");
            return null;
        }
    }
    
    /**
     * Translate a Bean Validation property path into document key terms, e.g.
     * {@code action.url} to {@code action_web.url} and {@code recurrence.schedule.hours}
     * to {@code recurrence.hours}. The authentication segment is named after the variant of
     * the leaf bean.
     */
    static String documentPath(Path propertyPath, Object leafBean) {
        List<String> segments = new ArrayList<>();
        for (Path.Node node : propertyPath) {
            String name = node.getName();
            if (name == null || name.equals("schedule")) {
                continue;
            }
            switch (name) {
                case "action" -> segments.add("action_web");
                case "errorAction" -> segments.add("error_action_web");
                case "authentication" -> segments.add(authenticationKey(leafBean));
                default -> segments.add(snakeCase(name));
            }
        }
        return String.join(".", segments);
    }
    
    private static String authenticationKey(Object leafBean) {
        if (leafBean instanceof BasicAuthenticationSpec) {
            return "authentication_basic";
        }
        if (leafBean instanceof CertificateAuthenticationSpec) {
            return "authentication_certificate";
        }
        if (leafBean instanceof ActiveDirectoryAuthenticationSpec) {
            return "authentication_active_directory";
        }
        return "authentication";
    }
    
    private static String snakeCase(String name) {
        StringBuilder result = new StringBuilder(name.length() + 4);
        for (char c : name.toCharArray()) {
            if (Character.isUpperCase(c)) {
                result.append('_').append(Character.toLowerCase(c));
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }
    
    private static Object rejectedValue(String field, Object value) {
        String leaf = field.substring(field.lastIndexOf('.') + 1);
        return JobDocument.isSecret(leaf) ? null : value;
    }
}
