package warden.adapter.out.notification;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.support.TestConfigs;

@DisplayName("LoggingNotifier")
class LoggingNotifierTest {

    @Test
    @DisplayName("should substitute first name, code and email")
    void shouldRenderTemplate() {
        var rendered = LoggingNotifier.render(
                "Hi {first_name}, use {code} for {email}", "jo@example.com", "XYZ", Map.of("first_name", "Jo"));

        assertEquals("Hi Jo, use XYZ for jo@example.com", rendered);
    }

    @Test
    @DisplayName("should leave unknown placeholders alone")
    void shouldLeaveUnknownPlaceholders() {
        assertEquals("{unknown} XYZ", LoggingNotifier.render("{unknown} {code}", "jo@example.com", "XYZ", null));
    }

    @Test
    @DisplayName("should complete both kinds of delivery")
    void shouldDeliver() {
        var notifier = new LoggingNotifier(TestConfigs.notifications());

        assertDoesNotThrow(() -> notifier.sendVerificationEmail("jo@example.com", "code", Map.of("first_name", "Jo"))
                .await()
                .indefinitely());
        assertDoesNotThrow(() -> notifier.sendPasswordResetEmail("jo@example.com", "code", Map.of("first_name", "Jo"))
                .await()
                .indefinitely());
    }
}
