package net.unishelf.application.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import net.unishelf.adapters.persistence.ResourceRepository;
import net.unishelf.config.ResourceSearchProperties;
import net.unishelf.domain.resource.CandidateRecord;
import net.unishelf.domain.resource.ResourceFilter;
import net.unishelf.domain.resource.ResourcePage;
import net.unishelf.domain.resource.ResourceType;
import net.unishelf.exception.InvalidSearchRequestException;
import net.unishelf.exception.LocalStoreFailureException;
import net.unishelf.exception.SearchTimeoutException;
import net.unishelf.service.provider.ExternalProviderRegistry;
import net.unishelf.testutil.ProviderTestSupport;
import net.unishelf.testutil.ProviderTestSupport.ScriptedAdapter;
import net.unishelf.testutil.ResourceTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class ResourceSearchUseCaseTest {

    private ResourceRepository repository;
    private ResourceSearchProperties properties;
    private ScriptedAdapter googleBooks;
    private ScriptedAdapter core;
    private ResourceSearchUseCase useCase;

    @BeforeEach
    void setUp() {
        repository = mock(ResourceRepository.class);
        properties = new ResourceSearchProperties();
        properties.setDefaultSources(List.of("local", "googleBooks", "core"));
        googleBooks = ProviderTestSupport.scripted("googleBooks",
            () -> Mono.just(ResourceTestData.candidates("Google Books", 3)));
        core = ProviderTestSupport.scripted("core", () -> Mono.error(new IllegalStateException("HTTP 503")));
        useCase = useCase(Duration.ofSeconds(2));
    }

    private ResourceSearchUseCase useCase(Duration fanOutTimeout) {
        ExternalProviderRegistry registry = new ExternalProviderRegistry(List.of(googleBooks, core));
        return new ResourceSearchUseCase(
            repository,
            new SourceSelector(registry, properties),
            new ProviderFanOut(fanOutTimeout),
            new SearchResultAggregator(),
            properties);
    }

    private static ResourceSearchRequest query(String query, List<String> sources) {
        return new ResourceSearchRequest(query, null, null, null, null, sources, null, null);
    }

    @Test
    @DisplayName("Local hits and surviving provider hits are combined; a failing provider contributes nothing")
    void search_LocalAndProviders_CombinesCounts() {
        when(repository.find(any(), eq(1), eq(20))).thenReturn(new ResourcePage(
            List.of(ResourceTestData.aResource().build(), ResourceTestData.aResource().build()), 2, 1, 20));

        StepVerifier.create(useCase.search(query("computer networks", null)))
            .assertNext(response -> {
                assertThat(response.counts().local()).isEqualTo(2);
                assertThat(response.counts().external()).isEqualTo(3);
                assertThat(response.data().external()).containsOnlyKeys("googleBooks", "core");
                assertThat(response.data().external().get("core")).isEmpty();
                assertThat(response.pagination().pages()).isEqualTo(1);
            })
            .verifyComplete();
    }

    @Test
    void search_CancelledByCaller_CancelsInFlightProviderCalls() {
        AtomicBoolean providerCancelled = new AtomicBoolean();
        googleBooks = ProviderTestSupport.scripted("googleBooks",
            () -> Mono.<List<CandidateRecord>>never().doOnCancel(() -> providerCancelled.set(true)));
        ResourceSearchUseCase hanging = useCase(Duration.ofSeconds(30));

        StepVerifier.create(hanging.search(query("networks", List.of("googleBooks"))))
            .expectSubscription()
            .thenCancel()
            .verify(Duration.ofSeconds(5));

        assertThat(googleBooks.calls()).isEqualTo(1);
        assertThat(providerCancelled).isTrue();
    }

    @Test
    void search_LocalOnlySource_InvokesNoProvider() {
        when(repository.find(any(), anyInt(), anyInt())).thenReturn(new ResourcePage(List.of(), 0, 1, 20));

        StepVerifier.create(useCase.search(query("networks", List.of("local"))))
            .assertNext(response -> assertThat(response.data().external()).isEmpty())
            .verifyComplete();

        assertThat(googleBooks.calls()).isZero();
        assertThat(core.calls()).isZero();
    }

    @Test
    void search_ProvidersOnly_SkipsLocalStore() {
        StepVerifier.create(useCase.search(query("networks", List.of("googleBooks"))))
            .assertNext(response -> {
                assertThat(response.counts().local()).isZero();
                assertThat(response.data().local()).isEmpty();
                assertThat(response.counts().external()).isEqualTo(3);
            })
            .verifyComplete();

        verify(repository, never()).find(any(), anyInt(), anyInt());
    }

    @Test
    void search_FilterWithoutQuery_SearchesLocalOnly() {
        when(repository.find(any(), anyInt(), anyInt())).thenReturn(new ResourcePage(List.of(), 0, 1, 20));
        ResourceSearchRequest request = new ResourceSearchRequest(
            "   ", "document", null, null, "CS101", List.of("googleBooks"), null, null);

        StepVerifier.create(useCase.search(request))
            .assertNext(response -> assertThat(response.data().external()).isEmpty())
            .verifyComplete();

        ArgumentCaptor<ResourceFilter> filter = ArgumentCaptor.forClass(ResourceFilter.class);
        verify(repository).find(filter.capture(), eq(1), eq(20));
        assertThat(filter.getValue().query()).isNull();
        assertThat(filter.getValue().type()).isEqualTo(ResourceType.DOCUMENT);
        assertThat(filter.getValue().courseId()).isEqualTo("CS101");
        assertThat(googleBooks.calls()).isZero();
    }

    @Test
    void search_PageAndLimit_AreNormalized() {
        when(repository.find(any(), anyInt(), anyInt())).thenReturn(new ResourcePage(List.of(), 0, 1, 100));

        useCase.search(new ResourceSearchRequest("networks", null, null, null, null, List.of("local"), 0, 500)).block();

        verify(repository).find(any(), eq(1), eq(100));
    }

    @Test
    void search_PageBeyondLast_ReturnsEmptyItemsWithTotal() {
        when(repository.find(any(), eq(9), eq(20))).thenReturn(new ResourcePage(List.of(), 5, 9, 20));

        StepVerifier.create(useCase.search(new ResourceSearchRequest(
                "networks", null, null, null, null, List.of("local"), 9, null)))
            .assertNext(response -> {
                assertThat(response.data().local()).isEmpty();
                assertThat(response.counts().local()).isEqualTo(5);
                assertThat(response.pagination().page()).isEqualTo(9);
                assertThat(response.pagination().pages()).isEqualTo(1);
            })
            .verifyComplete();
    }

    @Test
    void search_NoQueryAndNoFilter_IsRejected() {
        StepVerifier.create(useCase.search(query(null, null)))
            .expectError(InvalidSearchRequestException.class)
            .verify();

        verify(repository, never()).find(any(), anyInt(), anyInt());
    }

    @Test
    void search_UnknownType_IsRejected() {
        ResourceSearchRequest request = new ResourceSearchRequest(
            "networks", "hologram", null, null, null, null, null, null);

        StepVerifier.create(useCase.search(request))
            .expectError(InvalidSearchRequestException.class)
            .verify();
    }

    @Test
    void search_LocalStoreFailure_FailsWholeSearch() {
        when(repository.find(any(), anyInt(), anyInt()))
            .thenThrow(new LocalStoreFailureException("search failed", new RuntimeException("connection refused")));

        StepVerifier.create(useCase.search(query("networks", null)))
            .expectError(LocalStoreFailureException.class)
            .verify();
    }

    @Test
    void search_RequestDeadlineExceeded_SignalsTimeout() {
        properties.setRequestTimeout(Duration.ofMillis(200));
        googleBooks = ProviderTestSupport.scripted("googleBooks", Mono::never);
        ResourceSearchUseCase slowUseCase = useCase(Duration.ofSeconds(10));

        StepVerifier.create(slowUseCase.search(query("networks", List.of("googleBooks"))))
            .expectError(SearchTimeoutException.class)
            .verify(Duration.ofSeconds(5));
    }
}
