package it.unimib.datai.frontdoor.lambda.init;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Initialization state of one execution environment. Lives as long as the handler that
 * owns it; a fresh environment starts with a fresh instance.
 *
 * <p>Only {@link InitializationGate} moves the state. Once {@link LifecycleState#READY}
 * it never goes back.
 */
public final class ExecutionState {
    private volatile LifecycleState state = LifecycleState.UNINITIALIZED;
    private volatile Duration initDuration;
    private final AtomicInteger attempts = new AtomicInteger();

    public LifecycleState state() {
        return state;
    }

    public boolean isInitialized() {
        return state == LifecycleState.READY;
    }

    /**
     * Number of setup attempts made so far, successful or not.
     */
    public int attempts() {
        return attempts.get();
    }

    /**
     * Duration of the successful setup, empty until the state is ready.
     */
    public Optional<Duration> initDuration() {
        return Optional.ofNullable(initDuration);
    }

    int beginAttempt() {
        if (state != LifecycleState.UNINITIALIZED) {
            throw new IllegalStateException("Cannot start initialization from state " + state);
        }
        state = LifecycleState.INITIALIZING;
        return attempts.incrementAndGet();
    }

    void markReady(Duration duration) {
        if (state != LifecycleState.INITIALIZING) {
            throw new IllegalStateException("Cannot complete initialization from state " + state);
        }
        initDuration = duration;
        state = LifecycleState.READY;
    }

    void rollback() {
        if (state == LifecycleState.INITIALIZING) {
            state = LifecycleState.UNINITIALIZED;
        }
    }

    @Override
    public String toString() {
        return "ExecutionState[" + state + ", attempts=" + attempts.get() + "]";
    }
}
