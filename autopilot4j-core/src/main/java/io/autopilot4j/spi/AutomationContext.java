package io.autopilot4j.spi;

/**
 * Handle to a live automation context (browser, API client) bound to one profile directory.
 */
public interface AutomationContext extends AutoCloseable {

    /**
     * Checks for a marker that only an authenticated session shows.
     */
    boolean isAuthenticated() throws Exception;
}
