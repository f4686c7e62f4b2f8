package me.christianrobert.closureconv.transformer.shadow;

import me.christianrobert.closureconv.transformer.type.TypeInfo;

/**
 * How an assignment to a name is emitted.
 */
public class ShadowDecision {

    public enum Kind {
        FRESH,          // first binding: declare
        REUSE,          // compatible rebinding: plain assignment
        SHADOW_RENAME   // incompatible rebinding: declare a new identifier
    }

    private final Kind kind;
    private final String name;
    private final String identifier;
    private final TypeInfo type;
    private final String aliasTarget;

    private ShadowDecision(Kind kind, String name, String identifier, TypeInfo type, String aliasTarget) {
        this.kind = kind;
        this.name = name;
        this.identifier = identifier;
        this.type = type;
        this.aliasTarget = aliasTarget;
    }

    public static ShadowDecision fresh(String name, TypeInfo type, String aliasTarget) {
        return new ShadowDecision(Kind.FRESH, name, name, type, aliasTarget);
    }

    public static ShadowDecision reuse(String name, String identifier, TypeInfo type, String aliasTarget) {
        return new ShadowDecision(Kind.REUSE, name, identifier, type, aliasTarget);
    }

    public static ShadowDecision shadowRename(String name, String newId, TypeInfo type, String aliasTarget) {
        return new ShadowDecision(Kind.SHADOW_RENAME, name, newId, type, aliasTarget);
    }

    public Kind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    /**
     * Identifier the assignment writes to. For SHADOW_RENAME this is the new identifier.
     */
    public String getIdentifier() {
        return identifier;
    }

    public TypeInfo getType() {
        return type;
    }

    /**
     * Container the assigned name will reference, or null for a plain value.
     */
    public String getAliasTarget() {
        return aliasTarget;
    }

    public boolean isAlias() {
        return aliasTarget != null;
    }

    /**
     * True when the assignment introduces a declaration.
     */
    public boolean declares() {
        return kind != Kind.REUSE;
    }

    @Override
    public String toString() {
        return kind + "(" + name + (kind == Kind.SHADOW_RENAME ? " -> " + identifier : "") + ")";
    }
}
