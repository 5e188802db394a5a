package com.huntflow.pattern;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Lazy pointer to the values of {@code variable.attribute} in the session
 */
public class Reference {

    private static final Pattern VARIABLE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String variable;
    private final String attribute;

    public Reference(String variable, String attribute) {
        this.variable = variable;
        this.attribute = attribute;
    }

    /**
     * Split {@code var.attr.path} on the first dot; null when the text is not a reference
     */
    public static Reference parse(String text) {
        if (text == null) {
            return null;
        }
        int dot = text.indexOf('.');
        if (dot <= 0 || dot == text.length() - 1) {
            return null;
        }
        String variable = text.substring(0, dot);
        if (!VARIABLE.matcher(variable).matches()) {
            return null;
        }
        return new Reference(variable, text.substring(dot + 1));
    }

    public String getVariable() {
        return variable;
    }

    public String getAttribute() {
        return attribute;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Reference)) return false;
        Reference that = (Reference) o;
        return variable.equals(that.variable) && attribute.equals(that.attribute);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, attribute);
    }

    @Override
    public String toString() {
        return variable + "." + attribute;
    }
}
