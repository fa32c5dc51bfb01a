package it.unimib.datai.frontdoor.examples.echoapi;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.unimib.datai.frontdoor.common.model.ApplicationRequest;
import it.unimib.datai.frontdoor.common.model.ApplicationResponse;
import it.unimib.datai.frontdoor.common.runtime.HttpApplication;
import it.unimib.datai.frontdoor.lambda.InvocationLogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

public class EchoApplication implements HttpApplication {
    private static final Logger log = LoggerFactory.getLogger(EchoApplication.class);
    private static final String JSON = "application/json";

    private final EchoServices services;
    private final ObjectMapper objectMapper;

    public EchoApplication(EchoServices services, ObjectMapper objectMapper) {
        this.services = services;
        this.objectMapper = objectMapper;
    }

    @Override
    public ApplicationResponse handle(ApplicationRequest request) throws IOException {
        log.info("{} {} (request {})", request.method(), request.fullPath(), InvocationLogContext.getRequestId());

        String route = request.method() + " " + request.path();
        return switch (route) {
            case "GET /health" -> json(200, Map.of("status", services.isReady() ? "ok" : "starting"));
            case "GET /echo" -> json(200, describe(request));
            case "POST /echo" -> echoBody(request);
            case "POST /uploads" -> storeUpload(request);
            default -> json(404, Map.of("error", "No route for " + route));
        };
    }

    private Map<String, Object> describe(ApplicationRequest request) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("method", request.method());
        out.put("path", request.path());
        out.put("rootPath", request.rootPath());
        out.put("url", request.fullPath() + (request.queryString().isEmpty() ? "" : "?" + request.queryString()));
        out.put("headers", request.headers());
        return out;
    }

    private ApplicationResponse echoBody(ApplicationRequest request) {
        String contentType = request.header("content-type");
        Map<String, String> headers = Map.of("content-type", contentType != null ? contentType : "application/octet-stream");
        return new ApplicationResponse(200, headers, null, request.body());
    }

    private ApplicationResponse storeUpload(ApplicationRequest request) throws IOException {
        if (request.body().length == 0) {
            return json(400, Map.of("error", "Upload body is empty"));
        }
        Path stored = Files.createTempFile(services.uploadDir(), "upload-", ".bin");
        Files.write(stored, request.body());
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("file", stored.getFileName().toString());
        out.put("size", request.body().length);
        out.put("location", request.rootPath() + "/uploads/" + stored.getFileName());
        return json(201, out);
    }

    private ApplicationResponse json(int status, Object body) throws JsonProcessingException {
        return ApplicationResponse.of(status, JSON, new String(objectMapper.writeValueAsBytes(body), StandardCharsets.UTF_8));
    }
}
