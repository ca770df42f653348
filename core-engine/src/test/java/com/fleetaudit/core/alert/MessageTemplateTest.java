package com.fleetaudit.core.alert;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link MessageTemplate}.
 */
class MessageTemplateTest {

    private static final Map<String, Object> FIELDS = Map.of(
            "hostname", "web01",
            "used_pct", 87.456,
            "users", 1234567L,
            "ratio", 0.25,
            "delta", -42L,
            "enabled", true);

    @Test
    @DisplayName("Should substitute plain placeholders")
    void shouldSubstitute() {
        assertThat(MessageTemplate.render("{hostname} has {users} users", FIELDS))
                .isEqualTo("web01 has 1234567 users");
        assertThat(MessageTemplate.render("enabled={enabled}", FIELDS)).isEqualTo("enabled=True");
    }

    @Test
    @DisplayName("Should apply numeric format specs")
    void shouldFormatNumbers() {
        assertThat(MessageTemplate.render("Disk at {used_pct:.1f}%", FIELDS)).isEqualTo("Disk at 87.5%");
        assertThat(MessageTemplate.render("{users:,d}", FIELDS)).isEqualTo("1,234,567");
        assertThat(MessageTemplate.render("{ratio:.0%}", FIELDS)).isEqualTo("25%");
        assertThat(MessageTemplate.render("{used_pct:.2e}", FIELDS)).isEqualTo("8.75e+01");
        assertThat(MessageTemplate.render("{delta:+d}", FIELDS)).isEqualTo("-42");
    }

    @Test
    @DisplayName("Should pad and align to the requested width")
    void shouldPad() {
        assertThat(MessageTemplate.format("web", ">6")).isEqualTo("   web");
        assertThat(MessageTemplate.format("web", "6")).isEqualTo("web   ");
        assertThat(MessageTemplate.format(42L, "6d")).isEqualTo("    42");
        assertThat(MessageTemplate.format("ab", "*^6")).isEqualTo("**ab**");
        assertThat(MessageTemplate.format(42L, "05d")).isEqualTo("00042");
        assertThat(MessageTemplate.format(-42L, "05d")).isEqualTo("-0042");
    }

    @Test
    @DisplayName("Should treat doubled braces as literals")
    void shouldEscapeBraces() {
        assertThat(MessageTemplate.render("{{hostname}} is {hostname}", FIELDS)).isEqualTo("{hostname} is web01");
    }

    @Test
    @DisplayName("Should render a present null as an empty string")
    void shouldRenderNullAsEmpty() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("owner", null);

        assertThat(MessageTemplate.render("owner=[{owner}]", fields)).isEqualTo("owner=[]");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{missing} is missing",
            "unclosed {hostname",
            "stray } brace",
            "{hostname:d}",
            "{used_pct:d}",
            "{users:q}",
            "{host name}",
    })
    @DisplayName("Should return the raw template when interpolation fails")
    void shouldFallBackToRawTemplate(String template) {
        assertThat(MessageTemplate.render(template, FIELDS)).isEqualTo(template);
    }

    @Test
    @DisplayName("Should render null templates as an empty message")
    void shouldHandleNullTemplate() {
        assertThat(MessageTemplate.render(null, FIELDS)).isEmpty();
        assertThat(MessageTemplate.render("static text", null)).isEqualTo("static text");
    }
}
