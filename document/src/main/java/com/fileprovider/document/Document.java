package com.fileprovider.document;

/**
 * A parsed configuration value.
 *
 * <p>Exactly one of three variants: {@link ScalarValue}, {@link ListValue} or
 * {@link MapValue}. Code that needs to branch on the variant switches over
 * {@link #kind()} so that the compiler checks every variant is handled.</p>
 */
public sealed interface Document permits ScalarValue, ListValue, MapValue {

    /**
     * Variant tag of a {@link Document}.
     */
    enum Kind {
        SCALAR,
        LIST,
        MAP
    }

    /**
     * @return the variant of this value
     */
    Kind kind();

    /**
     * Convert to plain Java values ({@code String}, {@code Boolean}, {@code Number},
     * {@code null}, {@code List} and {@code Map}) suitable for JSON serialization.
     *
     * @return a freshly built plain representation
     */
    Object toPlain();

    /**
     * @return true if this value is a {@link MapValue}
     */
    default boolean isMap() {
        return kind() == Kind.MAP;
    }
}
