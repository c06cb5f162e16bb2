package com.incident.rca.reasoning;

import com.incident.rca.config.AnalysisConfig;
import com.incident.rca.config.MetricsConfig;
import com.incident.rca.model.FailureType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs reasoning backend calls on the pipeline executor with a time bound.
 *
 * Each call may take at most the enrichment timeout from submission, and never runs past the
 * deadline of the pipeline run it belongs to. A call that overruns is cancelled with an
 * interrupt. Nothing here throws: every call settles into a {@link ReasoningOutcome}.
 */
@Component
public class BoundedReasoningClient {

    private static final Logger log = LoggerFactory.getLogger(BoundedReasoningClient.class);

    private final ReasoningBackend backend;
    private final ExecutorService executor;
    private final AnalysisConfig config;
    private final MetricsConfig metricsConfig;

    @Autowired
    public BoundedReasoningClient(ObjectProvider<ReasoningBackend> backend,
                                  @Qualifier("pipelineExecutor") ExecutorService executor,
                                  AnalysisConfig config,
                                  MetricsConfig metricsConfig) {
        this(backend.getIfAvailable(), executor, config, metricsConfig);
    }

    public BoundedReasoningClient(ReasoningBackend backend, ExecutorService executor,
                                  AnalysisConfig config, MetricsConfig metricsConfig) {
        this.backend = backend;
        this.executor = executor;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    /** True when a backend is wired and the runtime switch is on. */
    public boolean isAvailable() {
        return backend != null && config.getReasoning().isEnabled();
    }

    /**
     * Start a call without waiting for it.
     *
     * @param runDeadlineNanos {@link System#nanoTime()} value after which the run's calls are cut off
     */
    public PendingCall submit(String purpose, String prompt, Map<String, Object> context, long runDeadlineNanos) {
        long timeoutNanos = TimeUnit.MILLISECONDS.toNanos(config.getReasoning().getEnrichmentTimeoutMs());
        long expiresAt = Math.min(System.nanoTime() + timeoutNanos, runDeadlineNanos);
        try {
            Future<String> future = executor.submit(() -> backend.complete(prompt, context));
            return new PendingCall(purpose, future, expiresAt, null);
        } catch (RejectedExecutionException e) {
            log.warn("Reasoning call '{}' rejected by executor: {}", purpose, e.getMessage());
            return new PendingCall(purpose, null, expiresAt, "rejected by executor");
        }
    }

    /** Wait for a submitted call until its deadline, cancelling it on overrun. */
    public ReasoningOutcome await(PendingCall call) {
        String purpose = call.purpose();
        if (call.future() == null) {
            return unavailable(purpose, call.rejection());
        }

        long remainingNanos = call.expiresAtNanos() - System.nanoTime();
        try {
            if (remainingNanos <= 0 && !call.future().isDone()) {
                throw new TimeoutException();
            }
            String text = call.future().get(Math.max(0, remainingNanos), TimeUnit.NANOSECONDS);
            if (text == null || text.isBlank()) {
                log.warn("Reasoning call '{}' returned an empty response", purpose);
                metricsConfig.recordReasoningCall(purpose, "malformed");
                return ReasoningOutcome.failed(purpose, FailureType.BACKEND_MALFORMED_RESPONSE, "Empty response");
            }
            metricsConfig.recordReasoningCall(purpose, "success");
            return ReasoningOutcome.success(purpose, text);
        } catch (TimeoutException e) {
            call.future().cancel(true);
            return unavailable(purpose, "timed out");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return unavailable(purpose, cause.getMessage());
        } catch (CancellationException e) {
            return unavailable(purpose, "cancelled");
        } catch (InterruptedException e) {
            call.future().cancel(true);
            Thread.currentThread().interrupt();
            return unavailable(purpose, "interrupted");
        }
    }

    /** Submit and wait. */
    public ReasoningOutcome call(String purpose, String prompt, Map<String, Object> context, long runDeadlineNanos) {
        return await(submit(purpose, prompt, context, runDeadlineNanos));
    }

    /**
     * Mark a response that arrived but could not be used.
     */
    public ReasoningOutcome rejectMalformed(ReasoningOutcome outcome, String message) {
        log.warn("Reasoning call '{}' returned an unusable response: {}", outcome.purpose(), message);
        metricsConfig.recordReasoningCall(outcome.purpose(), "malformed");
        return ReasoningOutcome.failed(outcome.purpose(), FailureType.BACKEND_MALFORMED_RESPONSE, message);
    }

    private ReasoningOutcome unavailable(String purpose, String detail) {
        log.warn("Reasoning call '{}' unavailable: {}", purpose, detail);
        metricsConfig.recordReasoningCall(purpose, "unavailable");
        return ReasoningOutcome.failed(purpose, FailureType.BACKEND_UNAVAILABLE,
                "Reasoning call '" + purpose + "' " + detail);
    }

    /** Handle to an in-flight call. {@code future} is null when submission was rejected. */
    public record PendingCall(String purpose, Future<String> future, long expiresAtNanos, String rejection) {
    }
}
