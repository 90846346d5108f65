// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.extraction;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.jsoup.nodes.Attributes;

/**
 * Typed access to the FTML attributes of one element, together with the keys whose rules haven't run yet.
 * <p>
 * Reading an attribute marks its key as consumed: a rule owns every attribute it reads, so the key's own rule won't
 * run afterwards. The {@code take} variants additionally remove the attribute from the element, so it doesn't appear
 * in the serialized output. Values are trimmed; an empty value counts as absent.
 * <p>
 * Required values that are absent, and values that don't parse, signal an {@link ExtractionErrorCondition}.
 */
public final class FtmlAttributes {
    /**
     * Wraps the given element attributes, queueing {@code keys} in the order their rules should run.
     */
    public FtmlAttributes(final Attributes attributes, final Collection<FtmlKey> keys) {
        this.attributes = attributes;
        remaining = new ArrayDeque<>(keys);
    }

    /**
     * Removes and returns the next key whose rule should run, or {@code null} once none are left.
     */
    public @Nullable FtmlKey nextKey() {
        return remaining.pollFirst();
    }

    /**
     * Returns whether the element carries the given attribute, without consuming it.
     */
    public boolean has(final FtmlKey key) {
        return attributes.hasKey(key.attributeName());
    }

    /**
     * Returns the value of a required attribute.
     */
    public String get(final FtmlKey key) {
        final var value = getOptional(key);
        if (value == null) {
            throw ExtractionErrorCondition.signal(key, ExtractionError.Reason.MISSING_KEY, "required value missing");
        }
        return value;
    }

    /**
     * Returns the value of an optional attribute, or {@code null} if it's absent or empty.
     */
    public @Nullable String getOptional(final FtmlKey key) {
        remaining.remove(key);
        final var name = key.attributeName();
        if (!attributes.hasKey(name)) {
            return null;
        }
        final var value = attributes.get(name).strip();
        return value.isEmpty() ? null : value;
    }

    /**
     * Returns the parsed value of an optional attribute, or {@code null} if it's absent.
     *
     * @param parser Parses the value, returning {@code null} if it's malformed.
     * @param reason The error reason reported for malformed values.
     */
    public <T> @Nullable T getOptional(
        final FtmlKey key,
        final Function<String, @Nullable T> parser,
        final ExtractionError.Reason reason
    ) {
        final var value = getOptional(key);
        return (value != null) ? parse(key, value, parser, reason) : null;
    }

    /**
     * Returns the parsed value of a required attribute.
     */
    public <T> T get(
        final FtmlKey key,
        final Function<String, @Nullable T> parser,
        final ExtractionError.Reason reason
    ) {
        return parse(key, get(key), parser, reason);
    }

    /**
     * Returns the boolean value of an attribute. An absent attribute is {@code false}, a present one without a value
     * is {@code true}.
     */
    public boolean getBoolean(final FtmlKey key) {
        final var present = has(key);
        final var value = getOptional(key);
        if (value == null) {
            return present;
        }
        return parse(key, value, FtmlAttributes::parseBoolean, ExtractionError.Reason.INVALID_VALUE);
    }

    /**
     * Returns the comma-separated values of an attribute, trimmed, without empty entries.
     */
    public List<String> getList(final FtmlKey key) {
        final var value = getOptional(key);
        final var result = new ArrayList<String>();
        if (value != null) {
            for (final var part : value.split(",")) {
                final var stripped = part.strip();
                if (!stripped.isEmpty()) {
                    result.add(stripped);
                }
            }
        }
        return result;
    }

    /**
     * Like {@link #getOptional(FtmlKey)}, removing the attribute from the element.
     */
    public @Nullable String takeOptional(final FtmlKey key) {
        final var value = getOptional(key);
        attributes.remove(key.attributeName());
        return value;
    }

    /**
     * Like {@link #getOptional(FtmlKey, Function, ExtractionError.Reason)}, removing the attribute from the element.
     */
    public <T> @Nullable T takeOptional(
        final FtmlKey key,
        final Function<String, @Nullable T> parser,
        final ExtractionError.Reason reason
    ) {
        final var value = takeOptional(key);
        return (value != null) ? parse(key, value, parser, reason) : null;
    }

    /**
     * Like {@link #getBoolean(FtmlKey)}, removing the attribute from the element.
     */
    public boolean takeBoolean(final FtmlKey key) {
        final var value = getBoolean(key);
        attributes.remove(key.attributeName());
        return value;
    }

    /**
     * Like {@link #getList(FtmlKey)}, removing the attribute from the element.
     */
    public List<String> takeList(final FtmlKey key) {
        final var value = getList(key);
        attributes.remove(key.attributeName());
        return value;
    }

    private static <T> T parse(
        final FtmlKey key,
        final String value,
        final Function<String, @Nullable T> parser,
        final ExtractionError.Reason reason
    ) {
        final var result = parser.apply(value);
        if (result == null) {
            throw ExtractionErrorCondition.signal(key, reason, "cannot parse '" + value + '\'');
        }
        return result;
    }

    private static @Nullable Boolean parseBoolean(final String value) {
        return switch (value) {
            case "true" -> Boolean.TRUE;
            case "false" -> Boolean.FALSE;
            default -> null;
        };
    }

    private final Attributes attributes;
    private final Deque<FtmlKey> remaining;
}
