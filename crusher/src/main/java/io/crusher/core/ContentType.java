package io.crusher.core;

import java.util.Locale;
import java.util.Optional;

/**
 * Content types a crusher can declare support for. The tag is the file extension used on tasks.
 */
public enum ContentType {
    JS("js"),
    CSS("css");

    private final String tag;

    ContentType(String tag) { this.tag = tag; }

    public String tag() { return tag; }

    public static Optional<ContentType> fromTag(String tag) {
        if (tag == null) return Optional.empty();
        String t = tag.trim().toLowerCase(Locale.ROOT);
        if (t.startsWith(".")) t = t.substring(1);
        for (ContentType type : values()) {
            if (type.tag.equals(t)) return Optional.of(type);
        }
        return Optional.empty();
    }

    @Override
    public String toString() { return tag; }
}
