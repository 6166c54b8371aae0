package org.carball.sascan.model.source;

import java.util.Objects;

/**
 * The text of one analyzed file together with the name it is reported under.
 */
public record SourceUnit(String name, String text) {

    public SourceUnit {
        Objects.requireNonNull(name, "name");
        text = text == null ? "" : text;
    }

    public static SourceUnit of(String name, String text) {
        return new SourceUnit(name, text);
    }
}
