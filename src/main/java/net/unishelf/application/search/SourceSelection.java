package net.unishelf.application.search;

import java.util.ArrayList;
import java.util.List;
import net.unishelf.service.provider.ExternalProviderAdapter;

/**
 * Effective sources of one search: whether the local store runs, and which adapters.
 */
public record SourceSelection(boolean includeLocal, List<ExternalProviderAdapter> externalAdapters) {

    public SourceSelection {
        externalAdapters = List.copyOf(externalAdapters);
    }

    public static SourceSelection localOnly() {
        return new SourceSelection(true, List.of());
    }

    public List<String> names() {
        List<String> names = new ArrayList<>();
        if (includeLocal) {
            names.add(SourceSelector.LOCAL_SOURCE);
        }
        externalAdapters.forEach(adapter -> names.add(adapter.name()));
        return names;
    }
}
