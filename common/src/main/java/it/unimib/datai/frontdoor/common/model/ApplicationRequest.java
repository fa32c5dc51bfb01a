package it.unimib.datai.frontdoor.common.model;

import java.util.Locale;
import java.util.Map;

/**
 * HTTP request as seen by the wrapped application.
 *
 * @param method      HTTP method, upper case
 * @param path        request path with any base path already stripped, never empty
 * @param rootPath    externally visible mount point of the application, empty when served from the root
 * @param queryString raw query string without the leading {@code ?}, empty when absent
 * @param headers     header names in lower case
 * @param body        decoded request body, empty when absent
 */
public record ApplicationRequest(
        String method,
        String path,
        String rootPath,
        String queryString,
        Map<String, String> headers,
        byte[] body
) {
    public ApplicationRequest {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? new byte[0] : body;
        rootPath = rootPath == null ? "" : rootPath;
        queryString = queryString == null ? "" : queryString;
    }

    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Path as the client addressed it, i.e. {@link #rootPath()} followed by {@link #path()}.
     */
    public String fullPath() {
        return "/".equals(path) && !rootPath.isEmpty() ? rootPath : rootPath + path;
    }
}
