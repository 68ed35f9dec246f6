package com.deepansh.sectools.nvd;

import com.deepansh.sectools.config.ToolProperties;
import com.deepansh.sectools.core.ExternalCallResult;
import com.deepansh.sectools.core.ExternalCallResult.Outcome;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Decorator around {@link HttpNvdClient} that adds a circuit breaker and
 * turns transport failures into results.
 *
 * Circuit breaker config (in application.yml, instance "nvd"):
 * - Opens after 50% failures in a sliding window of 10 calls
 * - Waits 60s before allowing probe calls
 *
 * Only transport errors count as failures. HTTP statuses, including 403
 * rate limiting, are ordinary results of the delegate.
 */
@Component
@Primary
@Slf4j
public class ResilientNvdClient implements NvdClient {

    static final String CIRCUIT_OPEN_MESSAGE = "NVD API is temporarily unavailable (circuit open)";

    private final NvdClient delegate;
    private final long timeoutSeconds;

    public ResilientNvdClient(@Qualifier("httpNvdClient") NvdClient delegate, ToolProperties toolProperties) {
        this.delegate = delegate;
        this.timeoutSeconds = toolProperties.nvd().timeoutSeconds();
    }

    @Override
    @CircuitBreaker(name = "nvd", fallbackMethod = "fallback")
    public ExternalCallResult query(Map<String, ?> queryParams) {
        return delegate.query(queryParams);
    }

    /**
     * Reached when the delegate threw or the circuit is open.
     */
    public ExternalCallResult fallback(Map<String, ?> queryParams, Throwable ex) {
        if (ex instanceof CallNotPermittedException) {
            log.warn("NVD circuit breaker is OPEN, rejecting call {}", queryParams);
            return ExternalCallResult.httpFailed(Outcome.INFRASTRUCTURE_FAILURE, CIRCUIT_OPEN_MESSAGE);
        }
        log.error("NVD call failed: {}", ex.getMessage());
        return HttpNvdClient.classifyFailure(ex, timeoutSeconds);
    }
}
