package io.autopilot4j.core;

import io.autopilot4j.ActionExecutor;
import io.autopilot4j.session.AutomationSession;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActionExecutorRegistryTest {

    @Test
    void shouldResolveExecutorsByJobType() {
        StringExecutor post = new StringExecutor("twitter:post");
        ActionExecutorRegistry registry = new ActionExecutorRegistry(List.of(post, new StringExecutor("linkedin:post")));

        assertSame(post, registry.getRequired("twitter:post"));
        assertTrue(registry.find("facebook:post").isEmpty());
        assertEquals(Platform.LINKEDIN, registry.getRequired("linkedin:post").platform());
    }

    @Test
    void duplicateJobTypesShouldBeRejected() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> new ActionExecutorRegistry(List.of(new StringExecutor("twitter:post"), new StringExecutor("twitter:post"))));
        assertTrue(e.getMessage().contains("twitter:post"));
    }

    @Test
    void missingExecutorShouldFailLoudly() {
        ActionExecutorRegistry registry = new ActionExecutorRegistry(List.of());

        assertThrows(IllegalStateException.class, () -> registry.getRequired("twitter:post"));
    }

    @Test
    void customJobTypeWithoutPlatformShouldBeReported() {
        StringExecutor custom = new StringExecutor("newsletter:send");

        assertThrows(IllegalStateException.class, custom::platform);
    }

    static final class StringExecutor implements ActionExecutor<String> {
        private final String type;

        StringExecutor(String type) {
            this.type = type;
        }

        @Override
        public String jobType() {
            return type;
        }

        @Override
        public Class<String> payloadClass() {
            return String.class;
        }

        @Override
        public ActionResult execute(AutomationSession session, String payload) {
            return ActionResult.of(payload);
        }
    }
}
