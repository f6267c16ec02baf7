package net.unishelf.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Typed configuration for the resource search endpoint and its provider fan-out.
 */
@Component
@ConfigurationProperties(prefix = "app.search")
public class ResourceSearchProperties {

    private int defaultLimit = 20;
    private int maxLimit = 100;
    private Duration providerTimeout = Duration.ofSeconds(5);
    private Duration requestTimeout = Duration.ofSeconds(12);
    private List<String> defaultSources = new ArrayList<>(List.of("local", "googleBooks", "openLibrary", "core", "arxiv"));

    /**
     * Page size used when the request does not name one.
     */
    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    /**
     * Upper bound applied to requested page sizes and to each provider's candidate list.
     */
    public int getMaxLimit() {
        return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
        this.maxLimit = maxLimit;
    }

    /**
     * Deadline for a single provider call; exceeding it yields an empty list for that provider.
     */
    public Duration getProviderTimeout() {
        return providerTimeout;
    }

    public void setProviderTimeout(Duration providerTimeout) {
        this.providerTimeout = providerTimeout;
    }

    /**
     * Deadline for the whole search including the local query.
     */
    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    /**
     * Sources searched when the request does not name any.
     */
    public List<String> getDefaultSources() {
        return defaultSources;
    }

    public void setDefaultSources(List<String> defaultSources) {
        this.defaultSources = defaultSources;
    }
}
