package io.autopilot4j.session;

@FunctionalInterface
public interface SessionCallback<R> {

    R apply(AutomationSession session) throws Exception;
}
