package ai.pipestream.regulatory.entity;

import java.util.Locale;

public enum ValueType {
    PERCENTAGE,
    CURRENCY,
    NUMBER,
    DATE,
    TEXT;

    /**
     * Lenient lookup for values coming from the extractor. Unknown or missing
     * names fall back to TEXT.
     */
    public static ValueType fromExternal(String name) {
        if (name == null || name.isBlank()) {
            return TEXT;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return TEXT;
        }
    }
}
