package com.platform.schedulerjob.reconciliation;

import com.platform.schedulerjob.error.ErrorCode;
import com.platform.schedulerjob.error.ValidationException;
import com.platform.schedulerjob.error.ValidationException.FieldViolation;
import com.platform.schedulerjob.model.JobSpec;
import com.platform.schedulerjob.model.RecurrenceSpec;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Cross-field checks run on the proposed configuration before anything is sent.
 *
 * <p>The scheduler service accepts a job without an action, or a recurring job that never
 * ends, and then silently does nothing with it. Both are rejected here instead.
 */
@Component
public class JobSpecValidator {
    
    /**
     * @return every violation found; empty when the job can be reconciled
     */
    public List<FieldViolation> check(JobSpec spec) {
        List<FieldViolation> violations = new ArrayList<>();
        
        if (!spec.hasAction()) {
            violations.add(FieldViolation.of("action_web", "an action block is required"));
        }
        
        RecurrenceSpec recurrence = spec.recurrence();
        if (recurrence != null && !recurrence.hasEndCondition()) {
            violations.add(FieldViolation.of("recurrence",
                "either 'count' or 'end_time' must be set"));
        }
        
        return violations;
    }
    
    /**
     * @throws ValidationException carrying all violations at once
     */
    public void validate(JobSpec spec) {
        List<FieldViolation> violations = check(spec);
        if (!violations.isEmpty()) {
            throw new ValidationException(ErrorCode.RECONCILIATION_PRECONDITION_FAILED, violations);
        }
    }
}
