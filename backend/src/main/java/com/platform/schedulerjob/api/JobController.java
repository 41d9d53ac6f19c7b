package com.platform.schedulerjob.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.schedulerjob.document.JobSpecReader;
import com.platform.schedulerjob.document.JobSpecWriter;
import com.platform.schedulerjob.error.ResourceNotFoundException;
import com.platform.schedulerjob.model.JobSpec;
import com.platform.schedulerjob.reconciliation.JobReconciler;
import com.platform.schedulerjob.reconciliation.ObservedJob;
import com.platform.schedulerjob.reconciliation.ReconciliationRecord;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for scheduler job reconciliation.
 */
@RestController
@RequestMapping("/api/jobs")
public class JobController {
    
    private final JobReconciler reconciler;
    private final JobSpecReader reader;
    private final JobSpecWriter writer;
    
    public JobController(JobReconciler reconciler, JobSpecReader reader, JobSpecWriter writer) {
        this.reconciler = reconciler;
        this.reader = reader;
        this.writer = writer;
    }
    
    @PutMapping
    public ObjectNode apply(@RequestBody JsonNode document) {
        JobSpec spec = reader.read(document);
        ObservedJob observed = reconciler.apply(spec);
        return writer.write(observed.id(), observed.spec());
    }
    
    @GetMapping
    public ObjectNode read(@RequestParam String id) {
        ObservedJob observed = reconciler.read(id)
            .orElseThrow(() -> ResourceNotFoundException.job(id));
        return writer.write(observed.id(), observed.spec());
    }
    
    @DeleteMapping
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@RequestParam String id) {
        reconciler.delete(id);
    }
    
    @GetMapping("/history")
    public List<ReconciliationRecord> getHistory(@RequestParam(required = false) String job) {
        if (job != null) {
            return reconciler.getHistoryForJob(job);
        }
        return reconciler.getHistory();
    }
}
