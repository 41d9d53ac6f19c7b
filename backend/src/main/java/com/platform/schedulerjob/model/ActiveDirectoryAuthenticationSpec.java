package com.platform.schedulerjob.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Active Directory OAuth authentication.
 *
 * @param audience {@code null} defers to the service management endpoint of the environment
 */
public record ActiveDirectoryAuthenticationSpec(
    @NotBlank String tenantId,
    @NotBlank String clientId,
    @NotNull String secret,
    String audience
) implements AuthenticationSpec {
    
    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitActiveDirectory(this);
    }
    
    @Override
    public String toString() {
        return "ActiveDirectoryAuthenticationSpec[tenantId=" + tenantId
            + ", clientId=" + clientId + ", audience=" + audience + "]";
    }
}
