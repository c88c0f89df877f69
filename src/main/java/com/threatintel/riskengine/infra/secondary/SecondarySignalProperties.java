package com.threatintel.riskengine.infra.secondary;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "secondary-signal")
public class SecondarySignalProperties {

    private boolean enabled = false;

    private String baseUrl = "http://localhost:8090";

    /** Path template; {@code {recordId}} is replaced with the url-encoded record id. */
    private String tierPath = "/api/v1/tiers/{recordId}";

    private long connectTimeoutMs = 2000;

    private long readTimeoutMs = 3000;
}
