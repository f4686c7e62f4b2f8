package me.christianrobert.closureconv.transformer.analysis;

import me.christianrobert.closureconv.transformer.context.BindingKind;
import me.christianrobert.closureconv.transformer.type.TypeInfo;

import java.util.Objects;

/**
 * A free variable of a closure body, as bound in the enclosing scope at capture time.
 */
public class CapturedVariable {

    private final String name;
    private final BindingKind bindingKind;
    private final TypeInfo type;
    private final String aliasTarget;  // null unless the enclosing binding is an alias

    public CapturedVariable(String name, BindingKind bindingKind, TypeInfo type, String aliasTarget) {
        this.name = name;
        this.bindingKind = bindingKind;
        this.type = type != null ? type : TypeInfo.UNKNOWN;
        this.aliasTarget = aliasTarget;
    }

    public String getName() {
        return name;
    }

    public BindingKind getBindingKind() {
        return bindingKind;
    }

    public TypeInfo getType() {
        return type;
    }

    /**
     * Aliases are borrowed: the environment holds the reference, the owner keeps destruction
     * responsibility.
     */
    public boolean isAlias() {
        return aliasTarget != null;
    }

    public String getAliasTarget() {
        return aliasTarget;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CapturedVariable that = (CapturedVariable) o;
        return name.equals(that.name) &&
                bindingKind == that.bindingKind &&
                type.equals(that.type) &&
                Objects.equals(aliasTarget, that.aliasTarget);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, bindingKind, type, aliasTarget);
    }

    @Override
    public String toString() {
        return name + ":" + bindingKind + (aliasTarget != null ? "(alias of " + aliasTarget + ")" : "");
    }
}
