package net.unishelf.application.search;

import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import net.unishelf.config.ResourceSearchProperties;
import net.unishelf.service.provider.ExternalProviderAdapter;
import net.unishelf.service.provider.ExternalProviderRegistry;
import net.unishelf.util.SearchQueryUtils;
import org.springframework.stereotype.Component;

/**
 * Decides which sources a search actually runs against.
 *
 * <p>Without a free-text query only the local store runs, whatever was requested:
 * external catalogs have nothing to match a filter-only search against. With a
 * query, the requested list (or the configured default) is resolved against the
 * provider registry; unknown names are ignored.</p>
 */
@Slf4j
@Component
public class SourceSelector {

    public static final String LOCAL_SOURCE = "local";

    private final ExternalProviderRegistry providerRegistry;
    private final ResourceSearchProperties searchProperties;

    public SourceSelector(ExternalProviderRegistry providerRegistry, ResourceSearchProperties searchProperties) {
        this.providerRegistry = providerRegistry;
        this.searchProperties = searchProperties;
    }

    public SourceSelection select(List<String> requestedSources, boolean hasQuery) {
        if (!hasQuery) {
            return SourceSelection.localOnly();
        }

        List<String> requested = SearchQueryUtils.flattenCsv(requestedSources);
        if (requested.isEmpty()) {
            requested = SearchQueryUtils.flattenCsv(searchProperties.getDefaultSources());
        }

        boolean includeLocal = false;
        List<ExternalProviderAdapter> adapters = new ArrayList<>();
        for (String source : requested) {
            if (LOCAL_SOURCE.equalsIgnoreCase(source)) {
                includeLocal = true;
                continue;
            }
            providerRegistry.find(source).ifPresentOrElse(
                adapter -> {
                    if (!adapters.contains(adapter)) {
                        adapters.add(adapter);
                    }
                },
                () -> log.debug("Ignoring unknown search source '{}'", source)
            );
        }

        if (!includeLocal && adapters.isEmpty()) {
            log.debug("No known source in {}; searching local only", requested);
            return SourceSelection.localOnly();
        }
        return new SourceSelection(includeLocal, adapters);
    }
}
