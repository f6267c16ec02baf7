package net.unishelf.controller;

import java.util.LinkedHashMap;
import java.util.Map;
import net.unishelf.service.provider.ExternalProviderAdapter;
import net.unishelf.service.provider.ExternalProviderRegistry;
import net.unishelf.service.provider.ProviderCallMonitor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operational view of external provider calls: which providers are enabled and
 * how their calls have ended since startup.
 */
@RestController
@RequestMapping("/admin/provider-metrics")
public class ProviderMetricsController {

    private final ProviderCallMonitor callMonitor;
    private final ExternalProviderRegistry providerRegistry;

    public ProviderMetricsController(ProviderCallMonitor callMonitor, ExternalProviderRegistry providerRegistry) {
        this.callMonitor = callMonitor;
        this.providerRegistry = providerRegistry;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> providerMetrics() {
        Map<String, Object> providers = new LinkedHashMap<>();
        for (ExternalProviderAdapter adapter : providerRegistry.all()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("displayName", adapter.displayName());
            entry.put("category", adapter.category().name());
            entry.put("enabled", adapter.isEnabled());
            providers.put(adapter.name(), entry);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("providers", providers);
        body.put("calls", callMonitor.snapshot());
        return body;
    }
}
