package it.unimib.datai.frontdoor.lambda.init;

import it.unimib.datai.frontdoor.common.runtime.ServiceSetup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Runs the service setup once per execution environment, on the first invocation
 * rather than at class-load time.
 *
 * <p>The ready check is a volatile read. Callers that find the state not ready
 * serialize on the gate, so concurrent first invocations run setup once and all of them
 * see it completed before they proceed.
 */
public final class InitializationGate {
    private static final Logger log = LoggerFactory.getLogger(InitializationGate.class);

    private final ServiceSetup setup;
    private final ExecutionState state;

    public InitializationGate(ServiceSetup setup, ExecutionState state) {
        this.setup = Objects.requireNonNull(setup, "setup");
        this.state = Objects.requireNonNull(state, "state");
    }

    /**
     * Makes sure setup has completed.
     *
     * @return {@code true} if this call ran setup to completion, {@code false} if it had
     *         already completed earlier
     * @throws InitializationException if setup fails; the state is back to
     *                                 {@link LifecycleState#UNINITIALIZED}
     */
    public boolean ensureInitialized() {
        if (state.isInitialized()) {
            return false;
        }
        synchronized (this) {
            if (state.isInitialized()) {
                return false;
            }
            int attempt = state.beginAttempt();
            log.info("First invocation, initializing services (attempt {})", attempt);
            long startNanos = System.nanoTime();
            boolean completed = false;
            try {
                setup.initialize();
                completed = true;
            } catch (InitializationException ex) {
                log.error("Service initialization failed (attempt {}), will retry on next invocation", attempt, ex);
                throw ex;
            } catch (Exception ex) {
                log.error("Service initialization failed (attempt {}), will retry on next invocation", attempt, ex);
                throw new InitializationException("Service initialization failed on attempt " + attempt, ex);
            } finally {
                // any throwable, checked or not, leaves the gate retryable
                if (!completed) {
                    state.rollback();
                }
            }
            Duration took = Duration.ofNanos(System.nanoTime() - startNanos);
            state.markReady(took);
            log.info("Services initialized in {} ms", took.toMillis());
            return true;
        }
    }

    public ExecutionState state() {
        return state;
    }
}
