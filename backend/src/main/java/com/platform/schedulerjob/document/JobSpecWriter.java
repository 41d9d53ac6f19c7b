package com.platform.schedulerjob.document;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.schedulerjob.mapping.KeyedSet;
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
import com.platform.schedulerjob.resource.JobResourceId;
import org.springframework.stereotype.Component;

import java.util.TreeMap;

/**
 * Renders an observed {@link JobSpec} as a configuration document, plus its {@code id}.
 * Secrets are always written as empty strings; unset values are left out.
 */
@Component
public class JobSpecWriter {
    
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    
    public ObjectNode write(JobResourceId id, JobSpec spec) {
        ObjectNode doc = NODES.objectNode();
        doc.put("id", id.format());
        doc.put("name", spec.name());
        doc.put("resource_group_name", spec.resourceGroupName());
        doc.put("job_collection_name", spec.jobCollectionName());
        
        if (spec.action() != null) {
            doc.set("action_web", writeWebAction(spec.action()));
        }
        if (spec.errorAction() != null) {
            doc.set("error_action_web", writeWebAction(spec.errorAction()));
        }
        if (spec.retry() != null) {
            doc.set("retry", writeRetry(spec.retry()));
        }
        if (spec.recurrence() != null) {
            doc.set("recurrence", writeRecurrence(spec.recurrence()));
        }
        putIfNotNull(doc, "start_time", Rfc3339.format(spec.startTime()));
        putIfNotNull(doc, "state", spec.state());
        return doc;
    }
    
    private ObjectNode writeWebAction(WebActionSpec action) {
        ObjectNode node = NODES.objectNode();
        node.put("url", action.url());
        node.put("method", action.method());
        putIfNotNull(node, "body", action.body());
        if (!action.headers().isEmpty()) {
            ObjectNode headers = node.putObject("headers");
            new TreeMap<>(action.headers()).forEach(headers::put);
        }
        if (action.authentication() != null) {
            action.authentication().accept(new AuthenticationWriter(node));
        }
        return node;
    }
    
    private ObjectNode writeRetry(RetrySpec retry) {
        ObjectNode node = NODES.objectNode();
        putIfNotNull(node, "interval", retry.interval());
        if (retry.count() != null) {
            node.put("count", retry.count());
        }
        return node;
    }
    
    private ObjectNode writeRecurrence(RecurrenceSpec recurrence) {
        ObjectNode node = NODES.objectNode();
        node.put("frequency", recurrence.frequency());
        if (recurrence.interval() != null) {
            node.put("interval", recurrence.interval());
        }
        if (recurrence.count() != null) {
            node.put("count", recurrence.count());
        }
        putIfNotNull(node, "end_time", Rfc3339.format(recurrence.endTime()));
        
        ScheduleSpec schedule = recurrence.schedule();
        if (schedule != null) {
            writeIntegers(node, "minutes", schedule.minutes());
            writeIntegers(node, "hours", schedule.hours());
            if (!schedule.weekDays().isEmpty()) {
                ArrayNode days = node.putArray("week_days");
                schedule.weekDays().toList().forEach(days::add);
            }
            writeIntegers(node, "month_days", schedule.monthDays());
            if (!schedule.monthlyOccurrences().isEmpty()) {
                ArrayNode occurrences = node.putArray("monthly_occurrences");
                for (MonthlyOccurrenceSpec occurrence : schedule.monthlyOccurrences().toList()) {
                    ObjectNode element = occurrences.addObject();
                    element.put("day", occurrence.day());
                    if (occurrence.occurrence() != null) {
                        element.put("occurrence", occurrence.occurrence());
                    }
                }
            }
        }
        return node;
    }
    
    private static void writeIntegers(ObjectNode node, String key, KeyedSet<Integer> values) {
        if (!values.isEmpty()) {
            ArrayNode array = node.putArray(key);
            values.toList().forEach(array::add);
        }
    }
    
    private static void putIfNotNull(ObjectNode node, String key, String value) {
        if (value != null) {
            node.put(key, value);
        }
    }
    
    private static final class AuthenticationWriter implements AuthenticationSpec.Visitor<Void> {
        
        private final ObjectNode action;
        
        AuthenticationWriter(ObjectNode action) {
            this.action = action;
        }
        
        @Override
        public Void visitBasic(BasicAuthenticationSpec basic) {
            ObjectNode node = action.putObject("authentication_basic");
            node.put("username", basic.username());
            node.put("password", AuthenticationSpec.MASKED_SECRET);
            return null;
        }
        
        @Override
        public Void visitCertificate(CertificateAuthenticationSpec certificate) {
            ObjectNode node = action.putObject("authentication_certificate");
            node.put("pfx", AuthenticationSpec.MASKED_SECRET);
            node.put("password", AuthenticationSpec.MASKED_SECRET);
            putIfNotNull(node, "thumbprint", certificate.thumbprint());
            putIfNotNull(node, "expiration", Rfc3339.format(certificate.expiration()));
            putIfNotNull(node, "subject_name", certificate.subjectName());
            return null;
        }
        
        @Override
        public Void visitActiveDirectory(ActiveDirectoryAuthenticationSpec activeDirectory) {
            ObjectNode node = action.putObject("authentication_active_directory");
            node.put("tenant_id", activeDirectory.tenantId());
            node.put("client_id", activeDirectory.clientId());
            node.put("secret", AuthenticationSpec.MASKED_SECRET);
            putIfNotNull(node, "audience", activeDirectory.audience());
            return null;
        }
    }
}
