package it.unimib.datai.frontdoor.examples.echoapi;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.unimib.datai.frontdoor.lambda.FrontDoorHandler;
import it.unimib.datai.frontdoor.lambda.bootstrap.ScratchDirectoryBootstrap;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lambda handler class ({@code it.unimib.datai.frontdoor.examples.echoapi.EchoApiHandler::handleRequest}).
 * Serves both the Function URL and the {@code prod} API Gateway stage.
 */
public class EchoApiHandler implements RequestHandler<Map<String, Object>, Map<String, Object>> {
    static final String UPLOAD_DIR_ENV = "UPLOAD_DIR";
    static final Path UPLOAD_DIR = Path.of("/tmp/uploads");
    static final Path CHUNK_DIR = Path.of("/tmp/cached_chunks");

    private static final FrontDoorHandler HANDLER = create(
            uploadDir(System.getenv(UPLOAD_DIR_ENV)),
            ScratchDirectoryBootstrap.fromEnvironment(List.of(UPLOAD_DIR, CHUNK_DIR)).directories());

    /**
     * The upload directory is always created along with the scratch directories, whether
     * or not {@code scratchDirectories} lists it.
     */
    static FrontDoorHandler create(Path uploadDir, List<Path> scratchDirectories) {
        ObjectMapper objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        List<Path> directories = new ArrayList<>(scratchDirectories);
        if (!directories.contains(uploadDir)) {
            directories.add(uploadDir);
        }
        EchoServices services = new EchoServices(uploadDir);
        return FrontDoorHandler.builder()
                .application(new EchoApplication(services, objectMapper))
                .setup(services)
                .objectMapper(objectMapper)
                .scratchDirectories(directories)
                .build();
    }

    static Path uploadDir(String configured) {
        return configured == null || configured.isBlank() ? UPLOAD_DIR : Path.of(configured.strip());
    }

    static FrontDoorHandler handler() {
        return HANDLER;
    }

    @Override
    public Map<String, Object> handleRequest(Map<String, Object> event, Context context) {
        return HANDLER.handleRequest(event, context);
    }
}
