package net.unishelf.service.provider;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Lookup of the configured provider adapters by their request token.
 * Token matching ignores case.
 */
@Component
public class ExternalProviderRegistry {

    private final Map<String, ExternalProviderAdapter> adapters;

    public ExternalProviderRegistry(List<ExternalProviderAdapter> adapters) {
        Map<String, ExternalProviderAdapter> byKey = new LinkedHashMap<>();
        for (ExternalProviderAdapter adapter : adapters) {
            ExternalProviderAdapter previous = byKey.putIfAbsent(key(adapter.name()), adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate provider adapter name: " + adapter.name());
            }
        }
        this.adapters = Collections.unmodifiableMap(byKey);
    }

    public Optional<ExternalProviderAdapter> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(adapters.get(key(name)));
    }

    /**
     * Resolves an adapter from the source name stamped on its candidates, falling
     * back to the request token.
     */
    public Optional<ExternalProviderAdapter> findBySourceName(String sourceName) {
        if (sourceName == null || sourceName.isBlank()) {
            return Optional.empty();
        }
        String wanted = sourceName.trim();
        for (ExternalProviderAdapter adapter : adapters.values()) {
            if (adapter.displayName().equalsIgnoreCase(wanted)) {
                return Optional.of(adapter);
            }
        }
        return find(wanted);
    }

    public Collection<ExternalProviderAdapter> all() {
        return adapters.values();
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
