package com.platform.schedulerjob;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Scheduler Job Control Plane
 * 
 * Reconciles declarative scheduler job configurations against the
 * Azure Scheduler management API:
 * - Create/update with read-back of the observed job
 * - Read, reporting jobs that no longer exist
 * - Idempotent delete
 */
@SpringBootApplication
public class SchedulerJobApplication {

    public static void main(String[] args) {
        SpringApplication.run(SchedulerJobApplication.class, args);
    }
}
