package com.platform.schedulerjob.mapping;

import com.platform.schedulerjob.model.WebActionSpec;
import com.platform.schedulerjob.remote.JobActionType;
import com.platform.schedulerjob.remote.SchedulerJobModels.HttpRequest;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps a web action to and from the HTTP request payload of a job action.
 * Used unchanged for the main action and the error action.
 */
public final class ActionRequestMapper {
    
    private static final String SECURE_SCHEME = "https://";
    
    private ActionRequestMapper() {
    }
    
    /**
     * Request payload plus the action discriminator derived from the URL.
     */
    public record EncodedAction(HttpRequest request, JobActionType type) {
    }
    
    public static EncodedAction encode(WebActionSpec action, String defaultAudience) {
        HttpRequest request = new HttpRequest();
        request.setUri(action.url());
        request.setMethod(action.method());
        request.setHeaders(new HashMap<>(action.headers()));
        
        if (action.body() != null && !action.body().isEmpty()) {
            request.setBody(action.body());
        }
        
        request.setAuthentication(AuthenticationMapper.encode(action.authentication(), defaultAudience));
        
        return new EncodedAction(request, protocolOf(action.url()));
    }
    
    /**
     * The URL is the only source of the protocol. Anything not starting with
     * {@code https://} (any case) is plain HTTP; the schema boundary guarantees one of the two.
     */
    public static JobActionType protocolOf(String url) {
        if (url != null && url.toLowerCase(Locale.ROOT).startsWith(SECURE_SCHEME)) {
            return JobActionType.HTTPS;
        }
        return JobActionType.HTTP;
    }
    
    public static WebActionSpec decode(HttpRequest request) {
        Map<String, String> headers = new HashMap<>();
        if (request.getHeaders() != null) {
            request.getHeaders().forEach((name, value) -> {
                if (value != null) {
                    headers.put(name, value);
                }
            });
        }
        
        return new WebActionSpec(
            request.getUri(),
            request.getMethod(),
            request.getBody(),
            headers,
            AuthenticationMapper.decode(request.getAuthentication()));
    }
}
