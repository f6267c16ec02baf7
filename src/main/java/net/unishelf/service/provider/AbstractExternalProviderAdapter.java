package net.unishelf.service.provider;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import net.unishelf.domain.resource.CandidateRecord;
import net.unishelf.domain.resource.ProviderCategory;
import net.unishelf.exception.ProviderUnavailableException;
import net.unishelf.util.ExternalApiLogger;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

/**
 * Base class owning the failure boundary of a provider adapter.
 *
 * <p>Subclasses implement {@link #fetch(String, int)} against their provider.
 * This class skips disabled providers without I/O, applies the rate limiter,
 * circuit breaker and per-call timeout, caps the result at {@code maxResults},
 * and converts every error into an empty list after logging and counting it.</p>
 */
@Slf4j
public abstract class AbstractExternalProviderAdapter implements ExternalProviderAdapter {

    private final String name;
    private final String displayName;
    private final ProviderCategory category;
    private final boolean switchedOn;
    private final ProviderCallSupport support;
    private final CircuitBreaker circuitBreaker;
    private final RateLimiter rateLimiter;

    protected AbstractExternalProviderAdapter(String name,
                                              String displayName,
                                              ProviderCategory category,
                                              boolean switchedOn,
                                              ProviderCallSupport support) {
        this.name = name;
        this.displayName = displayName;
        this.category = category;
        this.switchedOn = switchedOn;
        this.support = support;
        this.circuitBreaker = support.circuitBreaker(name);
        this.rateLimiter = support.rateLimiter(name);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String displayName() {
        return displayName;
    }

    @Override
    public ProviderCategory category() {
        return category;
    }

    @Override
    public boolean isEnabled() {
        return disabledReason() == null;
    }

    @Override
    public final Mono<List<CandidateRecord>> search(String query, int maxResults) {
        String disabledReason = disabledReason();
        if (disabledReason != null) {
            ExternalApiLogger.logProviderDisabled(log, displayName, query, disabledReason);
            support.monitor().record(name, ProviderCallOutcome.DISABLED);
            return Mono.just(List.of());
        }
        if (!StringUtils.hasText(query) || maxResults <= 0) {
            return Mono.just(List.of());
        }

        Duration timeout = support.providerTimeout();
        return Mono.defer(() -> {
                ExternalApiLogger.logApiCallAttempt(log, displayName, query, maxResults, requiresCredential());
                return fetch(query, maxResults);
            })
            .defaultIfEmpty(List.of())
            .timeout(timeout)
            .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
            .transformDeferred(RateLimiterOperator.of(rateLimiter))
            .map(candidates -> candidates.size() > maxResults ? List.copyOf(candidates.subList(0, maxResults)) : candidates)
            .doOnNext(candidates -> {
                ExternalApiLogger.logApiCallSuccess(log, displayName, query, candidates.size());
                support.monitor().record(name, ProviderCallOutcome.SUCCESS);
            })
            .onErrorResume(ex -> {
                ProviderCallOutcome outcome = ex instanceof TimeoutException
                    ? ProviderCallOutcome.TIMEOUT
                    : ProviderCallOutcome.FAILURE;
                String reason = describeFailure(ex);
                ExternalApiLogger.logApiCallFailure(log, displayName, query, reason);
                support.monitor().record(name, outcome, reason);
                return Mono.just(List.of());
            });
    }

    /**
     * Performs the provider call. May signal any error; the caller recovers it.
     */
    protected abstract Mono<List<CandidateRecord>> fetch(String query, int maxResults);

    /**
     * Whether the provider refuses requests without a credential.
     */
    protected boolean requiresCredential() {
        return false;
    }

    /**
     * The configured credential, or {@code null} for providers that need none.
     */
    protected String credential() {
        return null;
    }

    /**
     * Wraps a transport or parsing error so logs name the provider.
     */
    protected ProviderUnavailableException unavailable(Throwable cause) {
        if (cause instanceof ProviderUnavailableException existing) {
            return existing;
        }
        return new ProviderUnavailableException(name, cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
    }

    private String disabledReason() {
        if (!switchedOn) {
            return "switched off";
        }
        if (requiresCredential() && !StringUtils.hasText(credential())) {
            return "no credential configured";
        }
        return null;
    }

    private static String describeFailure(Throwable ex) {
        if (ex instanceof CallNotPermittedException) {
            return "circuit breaker open";
        }
        if (ex instanceof RequestNotPermitted) {
            return "rate limit exceeded";
        }
        if (ex instanceof TimeoutException) {
            return "timed out";
        }
        return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    }
}
