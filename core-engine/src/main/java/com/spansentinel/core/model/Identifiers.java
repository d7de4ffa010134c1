package com.spansentinel.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.UUID;

/**
 * Parsing of identifier references handed to the engine by its callers
 * (rule ids, trace ids, span ids).
 *
 * @since 1.0.0
 */
public final class Identifiers {

    private Identifiers() {
        // utility class, not instantiable
    }

    /**
     * Parse a UUID reference.
     *
     * @param kind what the identifier refers to, used in the error message
     *             (e.g. {@code "trace"})
     * @param raw  the textual UUID
     * @return the parsed identifier
     * @throws NullPointerException     if {@code raw} is {@code null}
     * @throws IllegalArgumentException if {@code raw} is not a valid UUID
     */
    public static UUID parse(String kind, String raw) {
        Objects.requireNonNull(raw, kind + " id must not be null");
        try {
            UUID id = UUID.fromString(raw.trim());
            // UUID.fromString accepts shortened groups such as "1-1-1-1-1"
            if (!id.toString().equalsIgnoreCase(raw.trim())) {
                throw new IllegalArgumentException("non-canonical form");
            }
            return id;
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Malformed " + kind + " id: '" + raw + "'", e);
        }
    }

    /**
     * Parse an optional UUID reference; blank input yields {@code null}.
     *
     * @param kind what the identifier refers to
     * @param raw  the textual UUID, may be {@code null} or blank
     * @return the parsed identifier, or {@code null}
     * @throws IllegalArgumentException if {@code raw} is present but malformed
     */
    public static UUID parseOptional(String kind, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return parse(kind, raw);
    }

    /**
     * Derive a stable identifier from a name, for rules that do not declare
     * one explicitly.
     *
     * @param name the name to derive from; must not be {@code null}
     * @return a name-based (type 3) UUID
     */
    public static UUID fromName(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8));
    }
}
