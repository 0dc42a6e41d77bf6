package com.uwb.positioning.parser;

import com.uwb.positioning.dto.RawReading;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses one telemetry line such as
 * {@code AT+RANGE=tid:4,mask:01,seq:218,range:(100,110,103,0,0,0,0,0),kx:152.75,ky:101.3,cmd:2,user:user1}
 * into a {@link RawReading}.
 *
 * <p>A line is invalid only when the tag id or the parenthesised distance list is missing. Every
 * other defect is recovered locally: an unparsable distance or span token becomes an absent value
 * and an unparsable command falls back to 0. The parser holds no state.
 */
@Slf4j
@Component
public class TelemetryLineParser {

    static final int DEFAULT_COMMAND = 0;

    private static final Pattern NUMBER =
        Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final String NOT_A_NUMBER = "nan";

    /**
     * Parses a telemetry line.
     *
     * @param line the raw line, may be {@code null}
     * @param capturedAt timestamp assigned to the reading
     * @return the reading, or empty when a mandatory field is missing
     */
    public Optional<RawReading> parse(String line, Instant capturedAt) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }

        Map<TelemetryField, String> fields = new EnumMap<>(TelemetryField.class);
        for (TelemetryField field : TelemetryField.values()) {
            Optional<String> value = field.extract(line);
            if (value.isPresent()) {
                fields.put(field, value.get());
            } else if (field.isMandatory()) {
                log.debug("Rejecting line without {} field: {}", field.getLabel(), line);
                return Optional.empty();
            }
        }

        return Optional.of(new RawReading(
            fields.get(TelemetryField.TAG_ID),
            parseDistances(fields.get(TelemetryField.RANGE)),
            parseNumber(fields.get(TelemetryField.SPAN_X)),
            parseNumber(fields.get(TelemetryField.SPAN_Y)),
            parseCommand(fields.get(TelemetryField.COMMAND)),
            fields.get(TelemetryField.USER),
            capturedAt));
    }

    /**
     * Splits the distance list and right-pads or truncates it to exactly eight slots.
     */
    List<Double> parseDistances(String rangeList) {
        String[] tokens = rangeList.split(",", -1);
        List<Double> distances = new ArrayList<>(RawReading.SLOT_COUNT);
        for (int slot = 0; slot < RawReading.SLOT_COUNT; slot++) {
            distances.add(slot < tokens.length ? parseNumber(tokens[slot]) : null);
        }
        return distances;
    }

    /**
     * Parses a numeric token; empty, {@code nan}, anything unparsable and values outside the
     * double range yield {@code null}.
     */
    Double parseNumber(String token) {
        if (token == null) {
            return null;
        }
        String trimmed = token.trim();
        if (trimmed.isEmpty() || NOT_A_NUMBER.equalsIgnoreCase(trimmed)) {
            return null;
        }
        if (!NUMBER.matcher(trimmed).matches()) {
            log.debug("Ignoring unparsable numeric token '{}'", trimmed);
            return null;
        }
        double value = Double.parseDouble(trimmed);
        if (!Double.isFinite(value)) {
            log.debug("Ignoring out-of-range numeric token '{}'", trimmed);
            return null;
        }
        return value;
    }

    private int parseCommand(String token) {
        if (token == null || !INTEGER.matcher(token).matches()) {
            return DEFAULT_COMMAND;
        }
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            log.debug("Command value out of range '{}', using default", token);
            return DEFAULT_COMMAND;
        }
    }
}
