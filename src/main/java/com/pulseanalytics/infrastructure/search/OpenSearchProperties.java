package com.pulseanalytics.infrastructure.search;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "app.opensearch")
public class OpenSearchProperties {

    /**
     * Cluster host name.
     */
    @NotBlank
    private String host = "localhost";

    @Min(1)
    private int port = 9200;

    /**
     * http or https.
     */
    private String scheme = "http";

    /**
     * Optional basic-auth user. Credentials are sent only when both are set.
     */
    private String username;

    private String password;

    /**
     * Index names are {prefix}-events-{tenantId}-{yyyy-MM-dd}.
     */
    @NotBlank
    private String indexPrefix = "analytics";

    private int connectTimeoutMs = 2000;

    private int socketTimeoutMs = 10000;

    private int numberOfShards = 1;

    private int numberOfReplicas = 0;

    /**
     * Install the event index template when the application starts.
     */
    private boolean initializeTemplates = true;

    public boolean hasCredentials() {
        return username != null && !username.isBlank() && password != null;
    }
}
