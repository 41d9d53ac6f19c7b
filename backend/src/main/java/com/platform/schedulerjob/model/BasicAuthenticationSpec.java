package com.platform.schedulerjob.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Username/password authentication.
 */
public record BasicAuthenticationSpec(
    @NotBlank String username,
    @NotNull String password
) implements AuthenticationSpec {
    
    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitBasic(this);
    }
    
    @Override
    public String toString() {
        return "BasicAuthenticationSpec[username=" + username + "]";
    }
}
