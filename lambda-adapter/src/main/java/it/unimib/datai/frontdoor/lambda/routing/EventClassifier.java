package it.unimib.datai.frontdoor.lambda.routing;

import it.unimib.datai.frontdoor.common.model.OriginKind;
import it.unimib.datai.frontdoor.lambda.FrontDoorConstants;

import java.util.Map;

/**
 * Tells Function URL events apart from API Gateway events.
 *
 * <p>Both arrive in the HTTP API v2 payload format. Function URLs always report the
 * {@code $default} stage or none at all; API Gateway reports the operator-assigned
 * stage name (e.g. {@code prod}), which is never empty nor {@code $default}.
 */
public final class EventClassifier {

    private EventClassifier() {}

    /**
     * Never throws: anything that is not a well-formed stage degrades to
     * {@link OriginKind#FUNCTION_URL}.
     */
    public static OriginKind classify(Map<String, Object> event) {
        String stage = stageOf(event);
        if (stage.isEmpty() || FrontDoorConstants.FUNCTION_URL_STAGE.equals(stage)) {
            return OriginKind.FUNCTION_URL;
        }
        return OriginKind.API_GATEWAY;
    }

    /**
     * {@code requestContext.stage}, or the empty string when it is missing or not a string.
     */
    public static String stageOf(Map<String, Object> event) {
        if (event == null) {
            return "";
        }
        if (!(event.get("requestContext") instanceof Map<?, ?> requestContext)) {
            return "";
        }
        return requestContext.get("stage") instanceof String stage ? stage : "";
    }
}
