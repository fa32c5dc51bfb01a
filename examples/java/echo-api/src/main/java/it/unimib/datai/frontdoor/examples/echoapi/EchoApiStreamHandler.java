package it.unimib.datai.frontdoor.examples.echoapi;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestStreamHandler;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Stream flavour of {@link EchoApiHandler}, sharing its handler instance.
 */
public class EchoApiStreamHandler implements RequestStreamHandler {

    @Override
    public void handleRequest(InputStream input, OutputStream output, Context context) throws IOException {
        EchoApiHandler.handler().proxyStream(input, output, context);
    }
}
