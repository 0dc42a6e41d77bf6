package com.uwb.positioning.parser;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Field table of the inline telemetry grammar.
 *
 * <p>Each field is a {@code label:value} pair that may appear anywhere on the line, in any order.
 * Labels are case-insensitive and only match at a token boundary, so {@code tid} never matches
 * inside a longer word. Fields not listed here ({@code mask}, {@code seq}, {@code rssi}, ...) are
 * ignored.
 */
public enum TelemetryField {

    TAG_ID("tid", "(\\d+)", true),
    RANGE("range", "\\(([^)]*)\\)", true),
    SPAN_X("kx", "([^,;\\s)]*)", false),
    SPAN_Y("ky", "([^,;\\s)]*)", false),
    COMMAND("cmd", "([^,;\\s)]*)", false),
    USER("user", "([^,;\\s)]*)", false);

    private static final String LABEL_BOUNDARY = "(?<![A-Za-z0-9_])";
    private static final String SEPARATOR = "\\s*:\\s*";

    private final String label;
    private final boolean mandatory;
    private final Pattern pattern;

    TelemetryField(String label, String valuePattern, boolean mandatory) {
        this.label = label;
        this.mandatory = mandatory;
        this.pattern = Pattern.compile(
            LABEL_BOUNDARY + Pattern.quote(label) + SEPARATOR + valuePattern,
            Pattern.CASE_INSENSITIVE);
    }

    public String getLabel() {
        return label;
    }

    public boolean isMandatory() {
        return mandatory;
    }

    /**
     * Returns the raw value of the first occurrence of this field, trimmed. An empty value is
     * reported as absent.
     */
    public Optional<String> extract(String line) {
        Matcher matcher = pattern.matcher(line);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String value = matcher.group(1).trim();
        if (value.isEmpty() && this != RANGE) {
            return Optional.empty();
        }
        return Optional.of(value);
    }
}
