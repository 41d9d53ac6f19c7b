package com.platform.schedulerjob.mapping;

import com.platform.schedulerjob.model.RetrySpec;
import com.platform.schedulerjob.remote.RetryType;
import com.platform.schedulerjob.remote.SchedulerJobModels.RetryPolicy;

/**
 * Maps the retry block to and from the retry policy payload.
 *
 * <p>The mapping is asymmetric: an absent block encodes to {@code None}, and every
 * discriminator except {@code Fixed} decodes back to an absent block.
 */
public final class RetryPolicyMapper {
    
    private RetryPolicyMapper() {
    }
    
    public static RetryPolicy encode(RetrySpec retry) {
        if (retry == null) {
            return new RetryPolicy(RetryType.NONE.wireValue(), null, null);
        }
        
        RetryPolicy policy = new RetryPolicy(RetryType.FIXED.wireValue(), null, null);
        // passed through as-is; the duration format is only checked by the service
        if (retry.interval() != null && !retry.interval().isEmpty()) {
            policy.setRetryInterval(retry.interval());
        }
        policy.setRetryCount(retry.count());
        return policy;
    }
    
    public static RetrySpec decode(RetryPolicy policy) {
        if (policy == null) {
            return null;
        }
        boolean fixed = RetryType.fromValue(policy.getRetryType())
            .map(type -> type == RetryType.FIXED)
            .orElse(false);
        if (!fixed) {
            return null;
        }
        return new RetrySpec(policy.getRetryInterval(), policy.getRetryCount());
    }
}
