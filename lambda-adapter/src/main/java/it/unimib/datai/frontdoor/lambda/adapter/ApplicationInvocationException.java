package it.unimib.datai.frontdoor.lambda.adapter;

/**
 * Carries a checked exception thrown by the application across the Lambda handler
 * signature. Unchecked application exceptions are never wrapped.
 */
public class ApplicationInvocationException extends RuntimeException {

    public ApplicationInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
