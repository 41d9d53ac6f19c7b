package com.platform.schedulerjob.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.OffsetDateTime;

/**
 * Polymorphic authentication payload of an HTTP request, discriminated by {@code type}.
 * Discriminators this service does not know deserialize to {@link Unrecognized}.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.EXISTING_PROPERTY,
    property = "type",
    visible = true,
    defaultImpl = HttpAuthentication.Unrecognized.class)
@JsonSubTypes({
    @JsonSubTypes.Type(value = HttpAuthentication.Basic.class, name = HttpAuthentication.Basic.TYPE),
    @JsonSubTypes.Type(value = HttpAuthentication.ClientCertificate.class, name = HttpAuthentication.ClientCertificate.TYPE),
    @JsonSubTypes.Type(value = HttpAuthentication.ActiveDirectoryOAuth.class, name = HttpAuthentication.ActiveDirectoryOAuth.TYPE)
})
public abstract class HttpAuthentication {
    
    private String type;
    
    protected HttpAuthentication(String type) {
        this.type = type;
    }
    
    public abstract <R> R accept(Visitor<R> visitor);
    
    /**
     * Exhaustive dispatch over the wire variants.
     */
    public interface Visitor<R> {
        
        R visitBasic(Basic basic);
        
        R visitClientCertificate(ClientCertificate certificate);
        
        R visitActiveDirectoryOAuth(ActiveDirectoryOAuth oauth);
        
        R visitUnrecognized(Unrecognized unrecognized);
    }
    
    @Data
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static class Basic extends HttpAuthentication {
        public static final String TYPE = "Basic";
        
        private String username;
        
        @ToString.Exclude
        private String password;
        
        public Basic() {
            super(TYPE);
        }
        
        public Basic(String username, String password) {
            this();
            this.username = username;
            this.password = password;
        }
        
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBasic(this);
        }
    }
    
    @Data
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static class ClientCertificate extends HttpAuthentication {
        public static final String TYPE = "ClientCertificate";
        
        @ToString.Exclude
        private String pfx;
        
        @ToString.Exclude
        private String password;
        
        private String certificateThumbprint;
        private OffsetDateTime certificateExpirationDate;
        private String certificateSubjectName;
        
        public ClientCertificate() {
            super(TYPE);
        }
        
        public ClientCertificate(String pfx, String password) {
            this();
            this.pfx = pfx;
            this.password = password;
        }
        
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitClientCertificate(this);
        }
    }
    
    @Data
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static class ActiveDirectoryOAuth extends HttpAuthentication {
        public static final String TYPE = "ActiveDirectoryOAuth";
        
        @ToString.Exclude
        private String secret;
        
        private String tenant;
        private String audience;
        private String clientId;
        
        public ActiveDirectoryOAuth() {
            super(TYPE);
        }
        
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitActiveDirectoryOAuth(this);
        }
    }
    
    /**
     * Any discriminator other than the three above, including {@code NotSpecified}.
     */
    @Data
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static class Unrecognized extends HttpAuthentication {
        
        public Unrecognized() {
            super(null);
        }
        
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnrecognized(this);
        }
    }
}
