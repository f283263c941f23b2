package com.pulseanalytics.api;

import com.pulseanalytics.domain.service.TenantResolver;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.UUID;

/**
 * Resolves the tenant from the API key before any handler runs.
 * 
 * The key comes from the X-API-Key header. The stream endpoint also accepts
 * an api_key query parameter, since browser EventSource cannot set headers.
 * The resolved id is exposed as a request attribute; handlers read it with
 * {@code @RequestAttribute(TENANT_ATTRIBUTE)}.
 */
@RequiredArgsConstructor
public class TenantAuthInterceptor implements HandlerInterceptor {
    
    public static final String API_KEY_HEADER = "X-API-Key";
    public static final String API_KEY_PARAM = "api_key";
    public static final String TENANT_ATTRIBUTE = "pulse.tenantId";
    
    private static final String STREAM_PATH = "/events/stream";
    
    private final TenantResolver tenantResolver;
    
    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (CorsUtils.isPreFlightRequest(request)) {
            return true;
        }
        
        String apiKey = request.getHeader(API_KEY_HEADER);
        if ((apiKey == null || apiKey.isBlank()) && request.getRequestURI().endsWith(STREAM_PATH)) {
            apiKey = request.getParameter(API_KEY_PARAM);
        }
        
        UUID tenantId = tenantResolver.resolve(apiKey);
        request.setAttribute(TENANT_ATTRIBUTE, tenantId);
        return true;
    }
}
