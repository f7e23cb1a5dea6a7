package com.timesync.reconciliation.identity;

import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Encodes and decodes the event identity carried in the free-text description
 * of an external time registration.
 *
 * <p>The marker is always the last line of the description and has the exact
 * form {@code [event_id: <uuid>]}, the uuid rendered as lowercase hyphenated hex.
 * Any final line that opens with {@code [event_id:} but does not carry a
 * parseable uuid is malformed, and a malformed marker makes the record
 * unidentified just like a missing one.
 */
@Slf4j
public class EventIdentityCodec {

    static final String MARKER_PREFIX = "[event_id:";

    private static final Pattern MARKER_PATTERN =
        Pattern.compile("^\\[event_id:\\s*([0-9A-Fa-f]{8}-[0-9A-Fa-f]{4}-[0-9A-Fa-f]{4}-[0-9A-Fa-f]{4}-[0-9A-Fa-f]{12})\\s*]$");

    /**
     * Extracts the identity from the last line of a description.
     */
    public Optional<UUID> extract(String description) {
        String lastLine = lastLine(description);
        if (lastLine == null) {
            return Optional.empty();
        }
        Matcher matcher = MARKER_PATTERN.matcher(lastLine);
        if (!matcher.matches()) {
            if (isMarkerLine(lastLine)) {
                log.debug("Malformed event marker ignored: {}", lastLine);
            }
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(matcher.group(1)));
        } catch (IllegalArgumentException e) {
            log.debug("Unparseable event identity in marker: {}", lastLine);
            return Optional.empty();
        }
    }

    public MarkerState inspect(String description) {
        String lastLine = lastLine(description);
        if (lastLine == null || !isMarkerLine(lastLine)) {
            return MarkerState.ABSENT;
        }
        return extract(description).isPresent() ? MarkerState.VALID : MarkerState.MALFORMED;
    }

    /**
     * Appends a marker line, or replaces the final line when it already is one.
     * Embedding the same identity twice yields the same string.
     */
    public String embed(String description, UUID identity) {
        if (identity == null) {
            throw new IllegalArgumentException("identity must not be null");
        }
        String body = strip(description);
        String marker = render(identity);
        return body.isEmpty() ? marker : body + "\n" + marker;
    }

    /**
     * Returns the business content of a description, without the marker line
     * and without trailing blank lines.
     */
    public String strip(String description) {
        if (description == null) {
            return "";
        }
        String trimmed = stripTrailing(description);
        String lastLine = lastLine(trimmed);
        if (lastLine != null && isMarkerLine(lastLine)) {
            int cut = trimmed.lastIndexOf('\n');
            trimmed = cut < 0 ? "" : stripTrailing(trimmed.substring(0, cut));
        }
        return trimmed;
    }

    public String render(UUID identity) {
        return MARKER_PREFIX + " " + identity.toString().toLowerCase(Locale.ROOT) + "]";
    }

    private static boolean isMarkerLine(String line) {
        return line.startsWith(MARKER_PREFIX);
    }

    private static String lastLine(String description) {
        if (description == null) {
            return null;
        }
        String trimmed = stripTrailing(description);
        if (trimmed.isEmpty()) {
            return null;
        }
        int newline = trimmed.lastIndexOf('\n');
        return (newline < 0 ? trimmed : trimmed.substring(newline + 1)).strip();
    }

    private static String stripTrailing(String text) {
        return text.replace("\r\n", "\n").replace('\r', '\n').stripTrailing();
    }
}
