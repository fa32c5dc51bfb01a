package it.unimib.datai.frontdoor.lambda;

public final class FrontDoorConstants {
    /** Base path of the API Gateway stage; stripped from request paths and exposed as root path. */
    public static final String API_GATEWAY_BASE_PATH = "/prod";

    /** Stage reported by Lambda Function URL events. */
    public static final String FUNCTION_URL_STAGE = "$default";

    private FrontDoorConstants() {}
}
