package com.huntflow.statement;

import java.util.Collections;
import java.util.List;

/**
 * Attribute projection of DISP and assignments; {@code *} selects everything
 */
public class AttributeSelector {
    private static final AttributeSelector ALL = new AttributeSelector(Collections.emptyList());

    private final List<String> attributes;

    private AttributeSelector(List<String> attributes) {
        this.attributes = attributes;
    }

    public static AttributeSelector all() {
        return ALL;
    }

    public static AttributeSelector of(List<String> attributes) {
        if (attributes == null || attributes.isEmpty() || attributes.contains("*")) {
            return ALL;
        }
        return new AttributeSelector(List.copyOf(attributes));
    }

    public boolean isAll() {
        return attributes.isEmpty();
    }

    public List<String> getAttributes() {
        return attributes;
    }

    @Override
    public String toString() {
        return isAll() ? "*" : String.join(",", attributes);
    }
}
