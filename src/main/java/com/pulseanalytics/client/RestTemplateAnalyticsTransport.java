package com.pulseanalytics.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link AnalyticsTransport} over a RestTemplate rooted at the configured base URL.
 * 
 * Every request carries the x-api-key header and a JSON content type.
 */
@Slf4j
public class RestTemplateAnalyticsTransport implements AnalyticsTransport {
    
    static final String API_KEY_HEADER = "x-api-key";
    
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper = new ObjectMapper();
    
    public RestTemplateAnalyticsTransport(ClientOptions options) {
        this(new RestTemplateBuilder(), options);
    }
    
    public RestTemplateAnalyticsTransport(RestTemplateBuilder builder, ClientOptions options) {
        this.restTemplate = builder
                .rootUri(options.getBaseUrl())
                .setConnectTimeout(options.getTimeout())
                .setReadTimeout(options.getTimeout())
                .defaultHeader(API_KEY_HEADER, options.getApiKey())
                .additionalInterceptors((request, body, execution) -> {
                    request.getHeaders().setContentType(MediaType.APPLICATION_JSON);
                    log.debug("Analytics request: {} {}", request.getMethod(), request.getURI());
                    return execution.execute(request, body);
                })
                .build();
    }
    
    @Override
    public TrackAck sendEvent(ClientEvent event) {
        return call("track", () -> restTemplate.postForObject("/track", event, TrackAck.class));
    }
    
    @Override
    public TrackAck sendBatch(List<ClientEvent> events) {
        return call("flush", () -> restTemplate.postForObject("/track/batch", Map.of("events", events), TrackAck.class));
    }
    
    @Override
    public JsonNode getEvents(Map<String, String> params) {
        // Template variables so the values are encoded exactly once
        UriComponentsBuilder uri = UriComponentsBuilder.fromPath("/events");
        params.keySet().forEach(name -> uri.queryParam(name, "{" + name + "}"));
        String template = uri.build().toUriString();
        return call("query", () -> restTemplate.getForObject(template, JsonNode.class, params));
    }
    
    @Override
    public JsonNode health() {
        return call("ping", () -> restTemplate.getForObject("/health", JsonNode.class));
    }
    
    private <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (HttpStatusCodeException ex) {
            String message = serverMessage(ex);
            log.error("Analytics {} error: {}", operation, message);
            throw new AnalyticsClientException(message, ex.getStatusCode().value(), ex);
        } catch (RestClientException ex) {
            log.error("Analytics {} error: {}", operation, ex.getMessage());
            throw new AnalyticsClientException("Analytics " + operation + " failed: " + ex.getMessage(), ex);
        }
    }
    
    // Prefer the service's {"error": "..."} text over the raw status line
    private String serverMessage(HttpStatusCodeException ex) {
        try {
            JsonNode body = objectMapper.readTree(ex.getResponseBodyAsString());
            if (body != null && body.hasNonNull("error")) {
                return body.get("error").asText();
            }
        } catch (Exception parseFailure) {
            log.debug("Error body is not JSON: {}", parseFailure.getMessage());
        }
        return ex.getMessage();
    }
}
