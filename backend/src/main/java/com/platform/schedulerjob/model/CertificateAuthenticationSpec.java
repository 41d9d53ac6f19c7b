package com.platform.schedulerjob.model;

import jakarta.validation.constraints.NotNull;

import java.time.OffsetDateTime;

/**
 * Client certificate authentication.
 *
 * @param pfx         base64 encoded PFX blob, write-only
 * @param password    PFX password, write-only
 * @param thumbprint  computed by the scheduler service, never sent
 * @param expiration  computed by the scheduler service, never sent
 * @param subjectName computed by the scheduler service, never sent
 */
public record CertificateAuthenticationSpec(
    @NotNull String pfx,
    @NotNull String password,
    String thumbprint,
    OffsetDateTime expiration,
    String subjectName
) implements AuthenticationSpec {
    
    public static CertificateAuthenticationSpec of(String pfx, String password) {
        return new CertificateAuthenticationSpec(pfx, password, null, null, null);
    }
    
    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCertificate(this);
    }
    
    @Override
    public String toString() {
        return "CertificateAuthenticationSpec[thumbprint=" + thumbprint
            + ", expiration=" + expiration + ", subjectName=" + subjectName + "]";
    }
}
