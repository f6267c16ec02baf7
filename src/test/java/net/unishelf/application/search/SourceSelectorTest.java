package net.unishelf.application.search;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import net.unishelf.config.ResourceSearchProperties;
import net.unishelf.service.provider.ExternalProviderRegistry;
import net.unishelf.testutil.ProviderTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

class SourceSelectorTest {

    private ResourceSearchProperties properties;
    private SourceSelector selector;

    @BeforeEach
    void setUp() {
        properties = new ResourceSearchProperties();
        properties.setDefaultSources(List.of("local", "googleBooks", "core"));
        ExternalProviderRegistry registry = new ExternalProviderRegistry(List.of(
            ProviderTestSupport.scripted("googleBooks", () -> Mono.just(List.of())),
            ProviderTestSupport.scripted("openLibrary", () -> Mono.just(List.of())),
            ProviderTestSupport.scripted("core", () -> Mono.just(List.of()))));
        selector = new SourceSelector(registry, properties);
    }

    @Test
    void select_NoQuery_IsLocalOnlyWhateverWasRequested() {
        SourceSelection selection = selector.select(List.of("googleBooks", "core"), false);

        assertThat(selection.includeLocal()).isTrue();
        assertThat(selection.externalAdapters()).isEmpty();
    }

    @Test
    void select_NothingRequested_UsesConfiguredDefaults() {
        SourceSelection selection = selector.select(null, true);

        assertThat(selection.names()).containsExactly("local", "googleBooks", "core");
    }

    @Test
    void select_CommaSeparatedAndMixedCase_ResolvesInRequestOrder() {
        SourceSelection selection = selector.select(List.of("core,OPENLIBRARY", "core"), true);

        assertThat(selection.includeLocal()).isFalse();
        assertThat(selection.names()).containsExactly("core", "openLibrary");
    }

    @Test
    void select_LocalOnlyRequest_RunsNoProvider() {
        SourceSelection selection = selector.select(List.of("local"), true);

        assertThat(selection.includeLocal()).isTrue();
        assertThat(selection.externalAdapters()).isEmpty();
    }

    @Test
    void select_UnknownSourcesIgnored() {
        SourceSelection selection = selector.select(List.of("googleBooks", "worldcat"), true);

        assertThat(selection.names()).containsExactly("googleBooks");
    }

    @Test
    void select_OnlyUnknownSources_FallsBackToLocal() {
        SourceSelection selection = selector.select(List.of("worldcat", "jstor"), true);

        assertThat(selection.names()).containsExactly("local");
    }
}
