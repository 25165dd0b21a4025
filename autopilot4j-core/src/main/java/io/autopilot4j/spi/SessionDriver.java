package io.autopilot4j.spi;

import io.autopilot4j.session.SessionKey;

import java.nio.file.Path;

/**
 * Opens automation contexts. Called at most once per live session, under the session's lock.
 */
public interface SessionDriver {

    AutomationContext open(SessionKey key, Path profileDir) throws Exception;
}
