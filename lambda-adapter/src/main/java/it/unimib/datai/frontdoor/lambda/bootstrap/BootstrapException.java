package it.unimib.datai.frontdoor.lambda.bootstrap;

public class BootstrapException extends RuntimeException {

    public BootstrapException(String message, Throwable cause) {
        super(message, cause);
    }
}
