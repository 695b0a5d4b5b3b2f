package com.fileprovider.document;

import java.util.ArrayList;
import java.util.List;

/**
 * An ordered list of values.
 *
 * @param elements the elements, copied into an immutable list
 */
public record ListValue(List<Document> elements) implements Document {

    public ListValue {
        elements = List.copyOf(elements);
    }

    public static ListValue of(Document... elements) {
        return new ListValue(List.of(elements));
    }

    @Override
    public Kind kind() {
        return Kind.LIST;
    }

    @Override
    public Object toPlain() {
        List<Object> plain = new ArrayList<>(elements.size());
        for (Document element : elements) {
            plain.add(element.toPlain());
        }
        return plain;
    }
}
