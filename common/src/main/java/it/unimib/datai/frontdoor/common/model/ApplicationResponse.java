package it.unimib.datai.frontdoor.common.model;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP response produced by the wrapped application.
 *
 * @param statusCode HTTP status
 * @param headers    single-valued response headers
 * @param cookies    {@code Set-Cookie} values, one per cookie
 * @param body       raw body bytes
 */
public record ApplicationResponse(
        int statusCode,
        Map<String, String> headers,
        List<String> cookies,
        byte[] body
) {
    public ApplicationResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        cookies = cookies == null ? List.of() : List.copyOf(cookies);
        body = body == null ? new byte[0] : body;
    }

    /**
     * UTF-8 encoded body; no {@code content-type} header when {@code contentType} is null.
     */
    public static ApplicationResponse of(int statusCode, String contentType, String body) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (contentType != null) {
            headers.put("content-type", contentType);
        }
        return new ApplicationResponse(statusCode, headers, List.of(), body.getBytes(StandardCharsets.UTF_8));
    }

    public static ApplicationResponse empty(int statusCode) {
        return new ApplicationResponse(statusCode, Map.of(), List.of(), null);
    }

    public String contentType() {
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if ("content-type".equalsIgnoreCase(e.getKey())) {
                return e.getValue();
            }
        }
        return null;
    }
}
