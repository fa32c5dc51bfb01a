package it.unimib.datai.frontdoor.lambda;

import it.unimib.datai.frontdoor.common.model.OriginKind;
import org.slf4j.MDC;

/**
 * Per-invocation logging context. Values are exposed via SLF4J MDC for the duration of
 * one invocation so application code logging on the same thread picks them up.
 */
public final class InvocationLogContext {
    public static final String REQUEST_ID_KEY = "awsRequestId";
    public static final String ORIGIN_KEY = "origin";

    private InvocationLogContext() {}

    // Called by FrontDoorHandler, not meant for application code
    public static void set(String requestId, OriginKind origin) {
        if (requestId != null) {
            MDC.put(REQUEST_ID_KEY, requestId);
        }
        if (origin != null) {
            MDC.put(ORIGIN_KEY, origin.name());
        }
    }

    public static void clear() {
        MDC.remove(REQUEST_ID_KEY);
        MDC.remove(ORIGIN_KEY);
    }

    public static String getRequestId() {
        return MDC.get(REQUEST_ID_KEY);
    }

    public static String getOrigin() {
        return MDC.get(ORIGIN_KEY);
    }
}
