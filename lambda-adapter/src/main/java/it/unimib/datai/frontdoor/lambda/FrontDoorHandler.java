package it.unimib.datai.frontdoor.lambda;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import it.unimib.datai.frontdoor.common.model.OriginKind;
import it.unimib.datai.frontdoor.common.runtime.HttpApplication;
import it.unimib.datai.frontdoor.common.runtime.ServiceSetup;
import it.unimib.datai.frontdoor.lambda.bootstrap.ScratchDirectoryBootstrap;
import it.unimib.datai.frontdoor.lambda.init.ExecutionState;
import it.unimib.datai.frontdoor.lambda.init.InitializationException;
import it.unimib.datai.frontdoor.lambda.init.InitializationGate;
import it.unimib.datai.frontdoor.lambda.metrics.HandlerMetrics;
import it.unimib.datai.frontdoor.lambda.routing.DispatchRouter;
import it.unimib.datai.frontdoor.lambda.routing.EventClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Lambda entry point in front of an {@link HttpApplication}.
 *
 * <p>Every invocation goes through the same three steps: make sure service setup has
 * run, classify the event by front door, and hand it to the adapter for that front
 * door. The adapter's response is returned as is. Failures are never turned into HTTP
 * responses here; they propagate and the platform reports the invocation as failed.
 *
 * <p>Build one instance per execution environment, typically in a static field of the
 * class Lambda instantiates:
 * <pre>{@code
 * private static final FrontDoorHandler HANDLER = FrontDoorHandler.builder()
 *         .application(app)
 *         .setup(services::start)
 *         .build();
 * }</pre>
 */
public final class FrontDoorHandler implements RequestHandler<Map<String, Object>, Map<String, Object>> {
    private static final Logger log = LoggerFactory.getLogger(FrontDoorHandler.class);
    private static final TypeReference<Map<String, Object>> EVENT_TYPE = new TypeReference<>() {};

    private final InitializationGate gate;
    private final DispatchRouter router;
    private final HandlerMetrics metrics;
    private final ObjectMapper objectMapper;
    private final String functionName;

    // Visible for testing
    FrontDoorHandler(InitializationGate gate, DispatchRouter router, HandlerMetrics metrics,
                     ObjectMapper objectMapper, String functionName) {
        this.gate = gate;
        this.router = router;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.functionName = functionName;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Map<String, Object> handleRequest(Map<String, Object> event, Context context) {
        InvocationLogContext.set(context != null ? context.getAwsRequestId() : null, null);
        try {
            ensureInitialized();

            OriginKind origin = EventClassifier.classify(event);
            InvocationLogContext.set(null, origin);
            log.debug("Classified event as {} (stage '{}')", origin, EventClassifier.stageOf(event));

            long startNanos = System.nanoTime();
            try {
                return router.dispatch(origin, event, context);
            } catch (RuntimeException ex) {
                metrics.error(functionName, origin);
                throw ex;
            } finally {
                metrics.invocation(functionName, origin);
                metrics.latency(functionName, origin).record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
            }
        } finally {
            InvocationLogContext.clear();
        }
    }

    /**
     * Stream variant for {@code RequestStreamHandler} deployments: reads the event as
     * JSON, handles it, writes the response as JSON.
     */
    public void proxyStream(InputStream input, OutputStream output, Context context) throws IOException {
        Map<String, Object> event = objectMapper.readValue(input, EVENT_TYPE);
        Map<String, Object> response = handleRequest(event, context);
        objectMapper.writeValue(output, response);
    }

    public ExecutionState state() {
        return gate.state();
    }

    public DispatchRouter router() {
        return router;
    }

    public HandlerMetrics metrics() {
        return metrics;
    }

    private void ensureInitialized() {
        boolean coldStart;
        try {
            coldStart = gate.ensureInitialized();
        } catch (InitializationException ex) {
            metrics.initFailure(functionName);
            throw ex;
        }
        if (coldStart) {
            metrics.coldStart(functionName);
            gate.state().initDuration().ifPresent(d -> metrics.initDuration(functionName).record(d));
        }
    }

    public static final class Builder {
        private HttpApplication application;
        private ServiceSetup setup = ServiceSetup.none();
        private MeterRegistry meterRegistry;
        private ObjectMapper objectMapper;
        private String functionName;
        private List<Path> scratchDirectories = List.of();

        private Builder() {}

        public Builder application(HttpApplication application) {
            this.application = application;
            return this;
        }

        public Builder setup(ServiceSetup setup) {
            this.setup = setup;
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder functionName(String functionName) {
            this.functionName = functionName;
            return this;
        }

        /**
         * Directories created before the handler is built.
         */
        public Builder scratchDirectories(List<Path> scratchDirectories) {
            this.scratchDirectories = scratchDirectories;
            return this;
        }

        /**
         * Creates the scratch directories, then the handler. Service setup does not run
         * here; it runs on the first invocation.
         *
         * @throws it.unimib.datai.frontdoor.lambda.bootstrap.BootstrapException if a scratch directory cannot be created
         */
        public FrontDoorHandler build() {
            if (application == null) {
                throw new IllegalStateException("HttpApplication must be set");
            }
            if (setup == null) {
                throw new IllegalStateException("ServiceSetup must not be null");
            }

            new ScratchDirectoryBootstrap(scratchDirectories).run();

            String effectiveName = functionName;
            if (effectiveName == null || effectiveName.isBlank()) {
                effectiveName = System.getenv("AWS_LAMBDA_FUNCTION_NAME");
            }
            if (effectiveName == null || effectiveName.isBlank()) {
                effectiveName = "unknown";
            }

            ObjectMapper effectiveMapper = objectMapper != null
                    ? objectMapper
                    : new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            MeterRegistry effectiveRegistry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();

            DispatchRouter router = DispatchRouter.create(application, FrontDoorConstants.API_GATEWAY_BASE_PATH);
            InitializationGate gate = new InitializationGate(setup, new ExecutionState());

            log.info("Front door handler built for function '{}' (gateway base path {})",
                    effectiveName, FrontDoorConstants.API_GATEWAY_BASE_PATH);
            return new FrontDoorHandler(gate, router, new HandlerMetrics(effectiveRegistry),
                    effectiveMapper, effectiveName);
        }
    }
}
