package ch.so.arp.assistant.chat;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guarded access to the language model. A call passes the per community rate
 * limit, waits for a slot of the global concurrency gate and is retried with
 * backoff when an attempt fails or exceeds its timeout. Failures never escape as
 * exceptions, the outcome is always reported through a {@link ModelAnswer}.
 */
public class ModelClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(ModelClient.class);

    private static final long POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(20);

    private final LlmClient llmClient;
    private final SlidingWindowRateLimiter rateLimiter;
    private final ConcurrencyGate gate;
    private final PromptAssembler promptAssembler;
    private final BackoffStrategy backoff;
    private final ExecutorService attemptExecutor;
    private final String model;
    private final int maxAttempts;
    private final Duration callTimeout;

    public ModelClient(LlmClient llmClient, SlidingWindowRateLimiter rateLimiter, ConcurrencyGate gate,
            PromptAssembler promptAssembler, BackoffStrategy backoff, ExecutorService attemptExecutor, String model,
            int maxAttempts, Duration callTimeout) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.promptAssembler = Objects.requireNonNull(promptAssembler, "promptAssembler");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.attemptExecutor = Objects.requireNonNull(attemptExecutor, "attemptExecutor");
        this.model = Objects.requireNonNull(model, "model");
        this.maxAttempts = maxAttempts;
        this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout");
    }

    public ModelAnswer answer(AnswerRequest request, CancellationToken token) {
        if (token.isCancelled()) {
            return ModelAnswer.cancelled(0L);
        }
        if (!rateLimiter.tryAcquire(request.community())) {
            LOGGER.debug("Rate limit reached for community {}", request.community());
            return ModelAnswer.rateLimited();
        }

        AssistantSettings settings = request.settings();
        LlmRequest llmRequest = new LlmRequest(model, promptAssembler.assemble(request), settings.temperature(),
                settings.maxTokens());
        long started = System.nanoTime();
        try {
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                if (token.isCancelled()) {
                    return ModelAnswer.cancelled(elapsedMillis(started));
                }
                try {
                    LlmCompletion completion = callOnce(llmRequest, token);
                    if (completion == null) {
                        LOGGER.debug("Model call for community {} cancelled", request.community());
                        return ModelAnswer.cancelled(elapsedMillis(started));
                    }
                    return ModelAnswer.completed(completion.content(), completion.usage(), elapsedMillis(started));
                } catch (LlmCallException ex) {
                    LOGGER.warn("Model call attempt {}/{} for community {} failed: {}", attempt, maxAttempts,
                            request.community(), ex.getMessage());
                }
                if (attempt < maxAttempts && token.awaitCancellation(backoff.delayAfter(attempt))) {
                    return ModelAnswer.cancelled(elapsedMillis(started));
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return ModelAnswer.cancelled(elapsedMillis(started));
        }
        LOGGER.error("Model call for community {} failed after {} attempts", request.community(), maxAttempts);
        return ModelAnswer.failed(elapsedMillis(started));
    }

    /**
     * Run a single attempt while holding a gate slot.
     *
     * @return the completion, or {@code null} if the token was cancelled
     */
    private LlmCompletion callOnce(LlmRequest request, CancellationToken token)
            throws LlmCallException, InterruptedException {
        if (!gate.acquire(token)) {
            return null;
        }
        try {
            Future<LlmCompletion> future = attemptExecutor.submit(() -> llmClient.complete(request));
            long deadline = System.nanoTime() + callTimeout.toNanos();
            try {
                while (true) {
                    if (token.isCancelled()) {
                        future.cancel(true);
                        return null;
                    }
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        future.cancel(true);
                        throw new LlmCallException("Model call timed out after " + callTimeout.toMillis() + " ms");
                    }
                    if (awaitDone(future, Math.min(remaining, POLL_NANOS))) {
                        return completionOf(future);
                    }
                }
            } catch (InterruptedException ex) {
                future.cancel(true);
                throw ex;
            }
        } finally {
            gate.release();
        }
    }

    private static boolean awaitDone(Future<LlmCompletion> future, long nanos) throws InterruptedException {
        try {
            future.get(nanos, TimeUnit.NANOSECONDS);
            return true;
        } catch (ExecutionException ex) {
            return true;
        } catch (TimeoutException ex) {
            return false;
        }
    }

    private static LlmCompletion completionOf(Future<LlmCompletion> future)
            throws LlmCallException, InterruptedException {
        try {
            LlmCompletion completion = future.get();
            if (completion == null) {
                throw new LlmCallException("Model client returned no completion");
            }
            return completion;
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof LlmCallException callException) {
                throw callException;
            }
            throw new LlmCallException("Model call failed: " + cause.getMessage(), cause);
        }
    }

    private static long elapsedMillis(long started) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
    }
}
