package com.fileprovider.document;

/**
 * A leaf value: string, boolean, number, or null.
 *
 * @param value the unwrapped value, may be null
 */
public record ScalarValue(Object value) implements Document {

    public ScalarValue {
        if (value != null
                && !(value instanceof String)
                && !(value instanceof Boolean)
                && !(value instanceof Number)) {
            throw new IllegalArgumentException("Unsupported scalar type: " + value.getClass().getName());
        }
    }

    public static ScalarValue of(Object value) {
        return new ScalarValue(value);
    }

    @Override
    public Kind kind() {
        return Kind.SCALAR;
    }

    @Override
    public Object toPlain() {
        return value;
    }
}
