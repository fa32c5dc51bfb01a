package it.unimib.datai.frontdoor.lambda.adapter;

import com.amazonaws.services.lambda.runtime.Context;

import java.util.Map;

/**
 * Translates a Lambda HTTP event into a call to the application and the application's
 * answer back into a Lambda HTTP response.
 */
public interface RequestAdapter {

    /**
     * @param event   the invocation event as delivered by the platform
     * @param context the invocation context, passed through untouched
     * @return the platform-shaped response ({@code statusCode}, {@code headers}, {@code body}, ...)
     */
    Map<String, Object> handle(Map<String, Object> event, Context context);

    /**
     * Prefix stripped from incoming paths and exposed to the application as its root
     * path. Empty when requests are served from the root.
     */
    String basePath();
}
