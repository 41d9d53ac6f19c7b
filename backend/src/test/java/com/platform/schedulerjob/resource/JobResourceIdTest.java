package com.platform.schedulerjob.resource;

import com.platform.schedulerjob.error.ErrorCode;
import com.platform.schedulerjob.error.ValidationException;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobResourceIdTest {
    
    private static final String ID =
        "/subscriptions/sub-1/resourceGroups/rg-jobs/providers/Microsoft.Scheduler/jobCollections/collection-1/jobs/nightly";
    
    @Test
    void parsesJobIdentifier() {
        JobResourceId id = JobResourceId.parse(ID);
        
        assertThat(id).isEqualTo(JobResourceId.of("sub-1", "rg-jobs", "collection-1", "nightly"));
        assertThat(id.format()).isEqualTo(ID);
        assertThat(id.toString()).isEqualTo(ID);
    }
    
    @Test
    void segmentNamesAreCaseInsensitive() {
        JobResourceId id = JobResourceId.parse(
            "/subscriptions/sub-1/resourcegroups/rg-jobs/providers/microsoft.scheduler/JOBCOLLECTIONS/collection-1/jobs/nightly/");
        
        assertThat(id.resourceGroup()).isEqualTo("rg-jobs");
        assertThat(id.jobCollection()).isEqualTo("collection-1");
        assertThat(id.format()).isEqualTo(ID);
    }
    
    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "/subscriptions/sub-1/resourceGroups/rg-jobs",
        "/subscriptions/sub-1/resourceGroups/rg-jobs/providers/Microsoft.Scheduler/jobCollections/collection-1/jobs",
        "/subscriptions/sub-1/resourceGroups/rg-jobs/providers/Microsoft.Web/jobCollections/collection-1/jobs/nightly",
        "/subscriptions/sub-1/subscriptions/sub-2/resourceGroups/rg/jobCollections/c/jobs/j"
    })
    void rejectsMalformedIdentifiers(String value) {
        assertThatThrownBy(() -> JobResourceId.parse(value))
            .isInstanceOf(ValidationException.class)
            .satisfies(e -> assertThat(((ValidationException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_RESOURCE_ID));
    }
}
