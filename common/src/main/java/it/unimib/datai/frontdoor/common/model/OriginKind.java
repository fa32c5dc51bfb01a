package it.unimib.datai.frontdoor.common.model;

/**
 * Front door that produced an invocation event.
 */
public enum OriginKind {
    /** Lambda Function URL: no custom stage, served from the root path. */
    FUNCTION_URL,
    /** API Gateway HTTP API: operator-assigned stage, served under a base path. */
    API_GATEWAY
}
