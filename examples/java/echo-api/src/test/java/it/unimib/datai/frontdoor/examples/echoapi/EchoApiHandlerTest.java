package it.unimib.datai.frontdoor.examples.echoapi;

import com.amazonaws.services.lambda.runtime.Context;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.unimib.datai.frontdoor.lambda.FrontDoorHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EchoApiHandlerTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tmp;

    private FrontDoorHandler handler;
    private Context context;

    @BeforeEach
    void setUp() {
        handler = EchoApiHandler.create(tmp.resolve("uploads"), List.of(tmp.resolve("uploads"), tmp.resolve("cached_chunks")));
        context = mock(Context.class);
        when(context.getAwsRequestId()).thenReturn("8f5b7c1e-2b7e-4a52-9d3f-6f1f6b0d2c11");
    }

    private Map<String, Object> event(String name) throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/events/" + name)) {
            return objectMapper.readValue(in, new TypeReference<Map<String, Object>>() {});
        }
    }

    @Test
    void buildingHandler_createsScratchDirectories_butDefersSetup() {
        assertThat(tmp.resolve("uploads")).isDirectory();
        assertThat(tmp.resolve("cached_chunks")).isDirectory();
        assertThat(handler.state().attempts()).isZero();
    }

    @Test
    void uploadDirectory_isItsOwnSetting_notTheFirstScratchDirectory() throws Exception {
        Path uploads = tmp.resolve("elsewhere/uploads");
        FrontDoorHandler reordered = EchoApiHandler.create(uploads,
                List.of(tmp.resolve("cached_chunks"), tmp.resolve("uploads")));

        Map<String, Object> event = event("function-url.json");
        Map<String, Object> requestContext = new HashMap<>(asMap(event.get("requestContext")));
        requestContext.put("http", Map.of("method", "POST", "path", "/uploads"));
        event.put("requestContext", requestContext);
        event.put("rawPath", "/uploads");
        Map<String, Object> response = reordered.handleRequest(event, context);

        assertThat(response.get("statusCode")).isEqualTo(201);
        assertThat(uploads).isDirectory();
        try (Stream<Path> files = Files.list(uploads)) {
            assertThat(files).hasSize(1);
        }
        try (Stream<Path> files = Files.list(tmp.resolve("cached_chunks"))) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    void uploadDir_defaultsWhenUnset() {
        assertThat(EchoApiHandler.uploadDir(null)).isEqualTo(EchoApiHandler.UPLOAD_DIR);
        assertThat(EchoApiHandler.uploadDir(" ")).isEqualTo(EchoApiHandler.UPLOAD_DIR);
        assertThat(EchoApiHandler.uploadDir("/mnt/uploads")).isEqualTo(Path.of("/mnt/uploads"));
    }

    @Test
    void apiGatewayEvent_isServedWithProdRootPath() throws Exception {
        Map<String, Object> response = handler.handleRequest(event("api-gateway-prod.json"), context);

        assertThat(response.get("statusCode")).isEqualTo(200);
        JsonNode body = objectMapper.readTree((String) response.get("body"));
        assertThat(body.get("path").asText()).isEqualTo("/echo");
        assertThat(body.get("rootPath").asText()).isEqualTo("/prod");
        assertThat(body.get("url").asText()).isEqualTo("/prod/echo?q=lambda&lang=en");
        assertThat(body.get("headers").get("cookie").asText()).isEqualTo("session=s-123");
        assertThat(handler.state().isInitialized()).isTrue();
    }

    @Test
    void functionUrlEvent_isServedFromRoot() throws Exception {
        Map<String, Object> response = handler.handleRequest(event("function-url.json"), context);

        assertThat(response)
                .containsEntry("statusCode", 200)
                .containsEntry("body", "hello front door")
                .containsEntry("isBase64Encoded", false);
    }

    @Test
    void bothFrontDoors_shareOneSetup() throws Exception {
        handler.handleRequest(event("function-url.json"), context);
        handler.handleRequest(event("api-gateway-prod.json"), context);
        handler.handleRequest(event("function-url.json"), context);

        assertThat(handler.state().attempts()).isEqualTo(1);
    }

    @Test
    void streamHandler_roundTripsJson() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (InputStream in = getClass().getResourceAsStream("/events/api-gateway-prod.json")) {
            handler.proxyStream(in, out, context);
        }

        JsonNode response = objectMapper.readTree(out.toByteArray());
        assertThat(response.get("statusCode").asInt()).isEqualTo(200);
        assertThat(response.get("headers").get("content-type").asText()).isEqualTo("application/json");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }
}
