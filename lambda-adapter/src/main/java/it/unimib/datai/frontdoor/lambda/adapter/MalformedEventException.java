package it.unimib.datai.frontdoor.lambda.adapter;

/**
 * The invocation event does not carry an HTTP request the adapter can translate.
 */
public class MalformedEventException extends RuntimeException {

    public MalformedEventException(String message) {
        super(message);
    }

    public MalformedEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
