package com.platform.schedulerjob.error;

/**
 * Exception for resource not found errors.
 */
public class ResourceNotFoundException extends SchedulerJobException {
    
    private final String resourceType;
    private final String resourceId;
    
    public ResourceNotFoundException(ErrorCode errorCode, String resourceType, String resourceId) {
        super(errorCode, 
            String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
    
    public static ResourceNotFoundException job(String resourceId) {
        return new ResourceNotFoundException(ErrorCode.JOB_NOT_FOUND, "Scheduler Job", resourceId);
    }
    
    public String getResourceType() {
        return resourceType;
    }
    
    public String getResourceId() {
        return resourceId;
    }
}
