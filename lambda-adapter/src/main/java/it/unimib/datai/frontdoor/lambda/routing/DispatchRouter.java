package it.unimib.datai.frontdoor.lambda.routing;

import com.amazonaws.services.lambda.runtime.Context;
import it.unimib.datai.frontdoor.common.model.OriginKind;
import it.unimib.datai.frontdoor.common.runtime.HttpApplication;
import it.unimib.datai.frontdoor.lambda.adapter.HttpApiAdapter;
import it.unimib.datai.frontdoor.lambda.adapter.RequestAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Holds one adapter per origin and forwards each event to the one matching its origin.
 * The adapters are fixed at construction; the response is returned as the adapter
 * produced it.
 */
public final class DispatchRouter {
    private static final Logger log = LoggerFactory.getLogger(DispatchRouter.class);

    private final Map<OriginKind, RequestAdapter> adapters;

    public DispatchRouter(RequestAdapter functionUrlAdapter, RequestAdapter apiGatewayAdapter) {
        EnumMap<OriginKind, RequestAdapter> bindings = new EnumMap<>(OriginKind.class);
        bindings.put(OriginKind.FUNCTION_URL, Objects.requireNonNull(functionUrlAdapter, "functionUrlAdapter"));
        bindings.put(OriginKind.API_GATEWAY, Objects.requireNonNull(apiGatewayAdapter, "apiGatewayAdapter"));
        this.adapters = Collections.unmodifiableMap(bindings);
    }

    /**
     * Standard bindings: API Gateway requests are served under {@code gatewayBasePath},
     * Function URL requests from the root.
     */
    public static DispatchRouter create(HttpApplication application, String gatewayBasePath) {
        return new DispatchRouter(
                new HttpApiAdapter(application, ""),
                new HttpApiAdapter(application, gatewayBasePath));
    }

    public Map<String, Object> dispatch(OriginKind origin, Map<String, Object> event, Context context) {
        RequestAdapter adapter = adapterFor(origin);
        log.debug("Dispatching {} event via adapter with base path '{}'", origin, adapter.basePath());
        return adapter.handle(event, context);
    }

    public RequestAdapter adapterFor(OriginKind origin) {
        RequestAdapter adapter = adapters.get(Objects.requireNonNull(origin, "origin"));
        if (adapter == null) {
            throw new IllegalStateException("No adapter bound for origin " + origin);
        }
        return adapter;
    }
}
