package com.platform.schedulerjob.mapping;

import com.platform.schedulerjob.model.ActiveDirectoryAuthenticationSpec;
import com.platform.schedulerjob.model.AuthenticationSpec;
import com.platform.schedulerjob.model.BasicAuthenticationSpec;
import com.platform.schedulerjob.model.CertificateAuthenticationSpec;
import com.platform.schedulerjob.remote.HttpAuthentication;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class AuthenticationMapperTest {
    
    private static final String DEFAULT_AUDIENCE = "https://management.core.windows.net/";
    
    @Nested
    class Encode {
        
        @Test
        void basic() {
            HttpAuthentication encoded = AuthenticationMapper.encode(
                new BasicAuthenticationSpec("admin", "s3cret"), DEFAULT_AUDIENCE);
            
            assertThat(encoded).isInstanceOf(HttpAuthentication.Basic.class);
            HttpAuthentication.Basic basic = (HttpAuthentication.Basic) encoded;
            assertThat(basic.getType()).isEqualTo("Basic");
            assertThat(basic.getUsername()).isEqualTo("admin");
            assertThat(basic.getPassword()).isEqualTo("s3cret");
        }
        
        @Test
        void certificateSendsOnlyPfxAndPassword() {
            HttpAuthentication encoded = AuthenticationMapper.encode(
                CertificateAuthenticationSpec.of("cGZ4", "pw"), DEFAULT_AUDIENCE);
            
            HttpAuthentication.ClientCertificate certificate = (HttpAuthentication.ClientCertificate) encoded;
            assertThat(certificate.getType()).isEqualTo("ClientCertificate");
            assertThat(certificate.getPfx()).isEqualTo("cGZ4");
            assertThat(certificate.getPassword()).isEqualTo("pw");
            assertThat(certificate.getCertificateThumbprint()).isNull();
            assertThat(certificate.getCertificateExpirationDate()).isNull();
        }
        
        @Test
        void activeDirectoryWithoutAudienceUsesDefault() {
            HttpAuthentication encoded = AuthenticationMapper.encode(
                new ActiveDirectoryAuthenticationSpec("tenant", "client", "secret", null), DEFAULT_AUDIENCE);
            
            HttpAuthentication.ActiveDirectoryOAuth oauth = (HttpAuthentication.ActiveDirectoryOAuth) encoded;
            assertThat(oauth.getType()).isEqualTo("ActiveDirectoryOAuth");
            assertThat(oauth.getTenant()).isEqualTo("tenant");
            assertThat(oauth.getClientId()).isEqualTo("client");
            assertThat(oauth.getSecret()).isEqualTo("secret");
            assertThat(oauth.getAudience()).isEqualTo(DEFAULT_AUDIENCE);
        }
        
        @Test
        void activeDirectoryKeepsExplicitAudience() {
            HttpAuthentication.ActiveDirectoryOAuth oauth = (HttpAuthentication.ActiveDirectoryOAuth)
                AuthenticationMapper.encode(
                    new ActiveDirectoryAuthenticationSpec("tenant", "client", "secret", "api://custom"),
                    DEFAULT_AUDIENCE);
            
            assertThat(oauth.getAudience()).isEqualTo("api://custom");
        }
        
        @Test
        void noAuthentication() {
            assertThat(AuthenticationMapper.encode(null, DEFAULT_AUDIENCE)).isNull();
        }
    }
    
    @Nested
    class Decode {
        
        @Test
        void basicPasswordIsMasked() {
            AuthenticationSpec decoded = AuthenticationMapper.decode(new HttpAuthentication.Basic("admin", "leaked"));
            
            assertThat(decoded).isEqualTo(new BasicAuthenticationSpec("admin", AuthenticationSpec.MASKED_SECRET));
        }
        
        @Test
        void certificateKeepsComputedFieldsAndMasksSecrets() {
            OffsetDateTime expiry = OffsetDateTime.parse("2030-01-01T00:00:00Z");
            HttpAuthentication.ClientCertificate payload = new HttpAuthentication.ClientCertificate("leaked", "leaked");
            payload.setCertificateThumbprint("ABC123");
            payload.setCertificateExpirationDate(expiry);
            payload.setCertificateSubjectName("CN=jobs");
            
            AuthenticationSpec decoded = AuthenticationMapper.decode(payload);
            
            assertThat(decoded).isEqualTo(new CertificateAuthenticationSpec("", "", "ABC123", expiry, "CN=jobs"));
        }
        
        @Test
        void activeDirectorySecretIsMasked() {
            HttpAuthentication.ActiveDirectoryOAuth payload = new HttpAuthentication.ActiveDirectoryOAuth();
            payload.setTenant("tenant");
            payload.setClientId("client");
            payload.setAudience(DEFAULT_AUDIENCE);
            
            AuthenticationSpec decoded = AuthenticationMapper.decode(payload);
            
            assertThat(decoded).isEqualTo(
                new ActiveDirectoryAuthenticationSpec("tenant", "client", "", DEFAULT_AUDIENCE));
        }
        
        @Test
        void unrecognizedTypeDecodesToNoAuthentication() {
            HttpAuthentication.Unrecognized payload = new HttpAuthentication.Unrecognized();
            payload.setType("NotSpecified");
            
            assertThat(AuthenticationMapper.decode(payload)).isNull();
            assertThat(AuthenticationMapper.decode(null)).isNull();
        }
    }
}
