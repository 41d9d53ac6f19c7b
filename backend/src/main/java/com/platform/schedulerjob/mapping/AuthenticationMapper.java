package com.platform.schedulerjob.mapping;

import com.platform.schedulerjob.model.ActiveDirectoryAuthenticationSpec;
import com.platform.schedulerjob.model.AuthenticationSpec;
import com.platform.schedulerjob.model.BasicAuthenticationSpec;
import com.platform.schedulerjob.model.CertificateAuthenticationSpec;
import com.platform.schedulerjob.remote.HttpAuthentication;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps authentication variants to and from the polymorphic wire payload.
 *
 * <p>Secrets are write-only. Decoding never copies a secret from the response: every
 * secret field is set to {@link AuthenticationSpec#MASKED_SECRET} instead, so repeated
 * reads produce the same configuration regardless of what the service sends back.
 */
@Slf4j
public final class AuthenticationMapper {
    
    private AuthenticationMapper() {
    }
    
    /**
     * @param defaultAudience OAuth audience used when the directory variant leaves it unset
     */
    public static HttpAuthentication encode(AuthenticationSpec authentication, String defaultAudience) {
        if (authentication == null) {
            return null;
        }
        return authentication.accept(new AuthenticationSpec.Visitor<HttpAuthentication>() {
            @Override
            public HttpAuthentication visitBasic(BasicAuthenticationSpec basic) {
                return new HttpAuthentication.Basic(basic.username(), basic.password());
            }
            
            @Override
            public HttpAuthentication visitCertificate(CertificateAuthenticationSpec certificate) {
                return new HttpAuthentication.ClientCertificate(certificate.pfx(), certificate.password());
            }
            
            @Override
            public HttpAuthentication visitActiveDirectory(ActiveDirectoryAuthenticationSpec activeDirectory) {
                HttpAuthentication.ActiveDirectoryOAuth oauth = new HttpAuthentication.ActiveDirectoryOAuth();
                oauth.setTenant(activeDirectory.tenantId());
                oauth.setClientId(activeDirectory.clientId());
                oauth.setSecret(activeDirectory.secret());
                oauth.setAudience(activeDirectory.audience() != null ? activeDirectory.audience() : defaultAudience);
                return oauth;
            }
        });
    }
    
    /**
     * @return the configuration-side variant, or {@code null} when the payload is absent or
     *         carries a discriminator this service does not manage
     */
    public static AuthenticationSpec decode(HttpAuthentication authentication) {
        if (authentication == null) {
            return null;
        }
        return authentication.accept(new HttpAuthentication.Visitor<AuthenticationSpec>() {
            @Override
            public AuthenticationSpec visitBasic(HttpAuthentication.Basic basic) {
                return new BasicAuthenticationSpec(basic.getUsername(), AuthenticationSpec.MASKED_SECRET);
            }
            
            @Override
            public AuthenticationSpec visitClientCertificate(HttpAuthentication.ClientCertificate certificate) {
                return new CertificateAuthenticationSpec(
                    AuthenticationSpec.MASKED_SECRET,
                    AuthenticationSpec.MASKED_SECRET,
                    certificate.getCertificateThumbprint(),
                    certificate.getCertificateExpirationDate(),
                    certificate.getCertificateSubjectName());
            }
            
            @Override
            public AuthenticationSpec visitActiveDirectoryOAuth(HttpAuthentication.ActiveDirectoryOAuth oauth) {
                return new ActiveDirectoryAuthenticationSpec(
                    oauth.getTenant(),
                    oauth.getClientId(),
                    AuthenticationSpec.MASKED_SECRET,
                    oauth.getAudience());
            }
            
            @Override
            public AuthenticationSpec visitUnrecognized(HttpAuthentication.Unrecognized unrecognized) {
                log.debug("Ignoring unrecognized authentication type {}", unrecognized.getType());
                return null;
            }
        });
    }
}
