package it.unimib.datai.frontdoor.lambda.init;

/**
 * Service setup failed. The execution state has been rolled back, so the next
 * invocation attempts setup again.
 */
public class InitializationException extends RuntimeException {

    public InitializationException(String message) {
        super(message);
    }

    public InitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
