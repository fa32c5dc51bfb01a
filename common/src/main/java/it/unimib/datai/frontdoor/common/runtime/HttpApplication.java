package it.unimib.datai.frontdoor.common.runtime;

import it.unimib.datai.frontdoor.common.model.ApplicationRequest;
import it.unimib.datai.frontdoor.common.model.ApplicationResponse;

/**
 * The application behind the front door. Implementations must be safe to call from
 * several invocations at once.
 */
@FunctionalInterface
public interface HttpApplication {
    ApplicationResponse handle(ApplicationRequest request) throws Exception;
}
