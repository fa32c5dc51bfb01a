package it.unimib.datai.frontdoor.common.runtime;

/**
 * One-time preparation of the services an {@link HttpApplication} depends on, such as
 * opening connections or warming caches.
 *
 * <p>Not assumed to be idempotent. The caller runs it at most once per successful
 * completion; a failed attempt may be followed by another one.
 */
@FunctionalInterface
public interface ServiceSetup {
    void initialize() throws Exception;

    static ServiceSetup none() {
        return () -> { };
    }
}
