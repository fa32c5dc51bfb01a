package it.unimib.datai.frontdoor.lambda.adapter;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPResponse;
import it.unimib.datai.frontdoor.common.model.ApplicationRequest;
import it.unimib.datai.frontdoor.common.model.ApplicationResponse;
import it.unimib.datai.frontdoor.common.runtime.HttpApplication;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Adapter for HTTP API payload v2 events, the format both Function URLs and HTTP API
 * stages deliver. Events are read as {@link APIGatewayV2HTTPEvent} and responses written
 * as {@link APIGatewayV2HTTPResponse}.
 *
 * <p>The same class serves both front doors; only {@link #basePath()} differs. A request
 * whose path is the base path or lies below it has the base path removed before the
 * application sees it, and the base path is handed to the application as its root path.
 */
public final class HttpApiAdapter implements RequestAdapter {
    private static final Set<String> UTF8_COMPATIBLE_CHARSETS = Set.of("utf-8", "utf8", "us-ascii");

    private final HttpApplication application;
    private final String basePath;
    private final LambdaEventMapper eventMapper = new LambdaEventMapper();

    public HttpApiAdapter(HttpApplication application, String basePath) {
        this.application = Objects.requireNonNull(application, "application");
        this.basePath = normalizeBasePath(basePath);
    }

    @Override
    public String basePath() {
        return basePath;
    }

    @Override
    public Map<String, Object> handle(Map<String, Object> event, Context context) {
        ApplicationRequest request = toRequest(event);
        ApplicationResponse response;
        try {
            response = application.handle(request);
        } catch (RuntimeException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new ApplicationInvocationException(
                    "Application failed handling " + request.method() + " " + request.fullPath(), ex);
        }
        if (response == null) {
            throw new IllegalStateException(
                    "Application returned no response for " + request.method() + " " + request.fullPath());
        }
        return toLambdaResponse(response);
    }

    ApplicationRequest toRequest(Map<String, Object> event) {
        if (event == null) {
            throw new MalformedEventException("Invocation event is empty");
        }
        APIGatewayV2HTTPEvent httpEvent = eventMapper.toEvent(event);
        APIGatewayV2HTTPEvent.RequestContext.Http http = httpEvent.getRequestContext() == null
                ? null
                : httpEvent.getRequestContext().getHttp();
        if (http == null || http.getMethod() == null || http.getMethod().isBlank()) {
            throw new MalformedEventException("Event carries no HTTP method; not an HTTP API or Function URL event");
        }

        String path = httpEvent.getRawPath() != null ? httpEvent.getRawPath() : http.getPath();
        return new ApplicationRequest(
                http.getMethod().toUpperCase(Locale.ROOT),
                stripBasePath(path),
                basePath,
                httpEvent.getRawQueryString(),
                headers(httpEvent),
                body(httpEvent));
    }

    String stripBasePath(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        if (!basePath.isEmpty()) {
            if (path.equals(basePath)) {
                return "/";
            }
            if (path.startsWith(basePath + "/")) {
                return path.substring(basePath.length());
            }
        }
        return path;
    }

    Map<String, Object> toLambdaResponse(ApplicationResponse response) {
        Map<String, String> headers = new LinkedHashMap<>();
        List<String> cookies = new ArrayList<>(response.cookies());
        for (Map.Entry<String, String> header : response.headers().entrySet()) {
            String name = header.getKey().toLowerCase(Locale.ROOT);
            if ("set-cookie".equals(name)) {
                cookies.add(header.getValue());
            } else {
                headers.merge(name, header.getValue(), (a, b) -> a + "," + b);
            }
        }

        byte[] body = response.body();
        String text;
        if (body.length == 0) {
            text = "";
        } else {
            text = isTextual(response.contentType()) ? utf8Text(body, response.contentType()) : null;
        }
        boolean binary = text == null;

        return eventMapper.toMap(APIGatewayV2HTTPResponse.builder()
                .withStatusCode(response.statusCode())
                .withHeaders(headers)
                .withCookies(cookies.isEmpty() ? null : cookies)
                .withBody(binary ? Base64.getEncoder().encodeToString(body) : text)
                .withIsBase64Encoded(binary)
                .build());
    }

    /**
     * The body as a string, or {@code null} when it is not UTF-8 text: the declared
     * charset is not UTF-8 compatible or the bytes do not decode. Such bodies go out
     * base64-encoded so the client gets the bytes unchanged.
     */
    static String utf8Text(byte[] body, String contentType) {
        String charset = charsetOf(contentType);
        if (charset != null && !UTF8_COMPATIBLE_CHARSETS.contains(charset)) {
            return null;
        }
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(body)).toString();
        } catch (CharacterCodingException ex) {
            return null;
        }
    }

    static String charsetOf(String contentType) {
        if (contentType == null) {
            return null;
        }
        for (String parameter : contentType.split(";")) {
            String p = parameter.strip();
            if (p.regionMatches(true, 0, "charset=", 0, "charset=".length())) {
                return p.substring("charset=".length()).replace("\"", "").strip().toLowerCase(Locale.ROOT);
            }
        }
        return null;
    }

    static boolean isTextual(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return true;
        }
        String type = contentType.toLowerCase(Locale.ROOT);
        return type.startsWith("text/")
                || type.contains("json")
                || type.contains("xml")
                || type.contains("javascript")
                || type.startsWith("application/x-www-form-urlencoded");
    }

    static String normalizeBasePath(String basePath) {
        if (basePath == null) {
            return "";
        }
        String trimmed = basePath.strip();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.isEmpty()) {
            return "";
        }
        return trimmed.startsWith("/") ? trimmed : "/" + trimmed;
    }

    private static Map<String, String> headers(APIGatewayV2HTTPEvent event) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (event.getHeaders() != null) {
            event.getHeaders().forEach((name, value) -> {
                if (name != null && value != null) {
                    headers.merge(name.toLowerCase(Locale.ROOT), value, (a, b) -> a + "," + b);
                }
            });
        }
        List<String> cookies = event.getCookies();
        if (cookies != null && !cookies.isEmpty()) {
            headers.put("cookie", String.join("; ", cookies));
        }
        return headers;
    }

    private static byte[] body(APIGatewayV2HTTPEvent event) {
        String body = event.getBody();
        if (body == null) {
            return new byte[0];
        }
        if (event.getIsBase64Encoded()) {
            try {
                return Base64.getDecoder().decode(body);
            } catch (IllegalArgumentException ex) {
                throw new MalformedEventException("Body is flagged as base64 but cannot be decoded", ex);
            }
        }
        return body.getBytes(StandardCharsets.UTF_8);
    }
}
