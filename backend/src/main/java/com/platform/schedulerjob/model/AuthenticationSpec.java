package com.platform.schedulerjob.model;

/**
 * Authentication attached to a web action. At most one variant can be set per action,
 * which this type enforces structurally.
 */
public sealed interface AuthenticationSpec
    permits BasicAuthenticationSpec, CertificateAuthenticationSpec, ActiveDirectoryAuthenticationSpec {
    
    /**
     * Value every secret is set to after a read: the scheduler service never returns secrets.
     */
    String MASKED_SECRET = "";
    
    <R> R accept(Visitor<R> visitor);
    
    /**
     * Exhaustive dispatch over the authentication variants.
     */
    interface Visitor<R> {
        
        R visitBasic(BasicAuthenticationSpec basic);
        
        R visitCertificate(CertificateAuthenticationSpec certificate);
        
        R visitActiveDirectory(ActiveDirectoryAuthenticationSpec activeDirectory);
    }
}
