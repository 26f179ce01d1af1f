package com.peargent.providers;

import com.peargent.shared.error.ModelException;
import com.peargent.shared.error.OperationTimeoutException;
import com.peargent.shared.error.PeargentException;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decorator: bounds every model call by a timeout, cancelling the in-flight call and
 * raising {@link OperationTimeoutException} when it expires. Never retries.
 */
public class TimeLimitedProvider implements ModelProvider {

    private static final ExecutorService EXECUTOR = Executors.newCachedThreadPool(r -> {
        var t = new Thread(r, "peargent-model");
        t.setDaemon(true);
        return t;
    });

    private final ModelProvider delegate;
    private final Duration timeout;

    public TimeLimitedProvider(ModelProvider delegate, Duration timeout) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.delegate = delegate;
        this.timeout = timeout;
    }

    public ModelProvider delegate() { return delegate; }

    public Duration timeout() { return timeout; }

    @Override
    public String id() { return delegate.id(); }

    @Override
    public String generate(String prompt, GenerateOptions options) {
        var future = EXECUTOR.submit(() -> delegate.generate(prompt, options));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new OperationTimeoutException("Model '" + delegate.id() + "'", timeout);
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof PeargentException pe) throw pe;
            throw new ModelException("Model '" + delegate.id() + "' failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ModelException("Model call interrupted", e);
        }
    }

    @Override
    public Iterator<String> generateStream(String prompt, GenerateOptions options) {
        return List.of(generate(prompt, options)).iterator();
    }
}
