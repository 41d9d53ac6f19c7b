package com.platform.schedulerjob.remote;

import java.util.Arrays;
import java.util.Optional;

/**
 * Action discriminator of a job. Only the web variants are produced by this service;
 * queue and topic actions are recognised on read and otherwise ignored.
 */
public enum JobActionType {
    HTTP("Http", true),
    HTTPS("Https", true),
    STORAGE_QUEUE("StorageQueue", false),
    SERVICE_BUS_QUEUE("ServiceBusQueue", false),
    SERVICE_BUS_TOPIC("ServiceBusTopic", false);
    
    private final String wireValue;
    private final boolean web;
    
    JobActionType(String wireValue, boolean web) {
        this.wireValue = wireValue;
        this.web = web;
    }
    
    public String wireValue() {
        return wireValue;
    }
    
    public boolean isWeb() {
        return web;
    }
    
    /**
     * Case-insensitive lookup; the service is not consistent about the case it returns.
     */
    public static Optional<JobActionType> fromValue(String value) {
        return Arrays.stream(values())
            .filter(type -> type.wireValue.equalsIgnoreCase(value))
            .findFirst();
    }
}
