package me.christianrobert.closureconv.transformer.ast;

import me.christianrobert.closureconv.transformer.type.TypeInfo;

/**
 * Formal parameter of a function or lambda, with an optional declared type hint.
 */
public class Parameter {

    private final String name;
    private final TypeInfo declaredType;  // null when the source has no annotation

    public Parameter(String name) {
        this(name, null);
    }

    public Parameter(String name, TypeInfo declaredType) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Parameter name cannot be null or empty");
        }
        this.name = name;
        this.declaredType = declaredType;
    }

    public String getName() {
        return name;
    }

    public TypeInfo getDeclaredType() {
        return declaredType;
    }

    public boolean hasDeclaredType() {
        return declaredType != null;
    }

    @Override
    public String toString() {
        return declaredType == null ? name : name + ": " + declaredType;
    }
}
