package me.christianrobert.closureconv.transformer.shadow;

import me.christianrobert.closureconv.transformer.context.AliasTable;
import me.christianrobert.closureconv.transformer.context.ConversionContext;
import me.christianrobert.closureconv.transformer.context.ConversionContext.VariableBinding;
import me.christianrobert.closureconv.transformer.context.RenameTable;
import me.christianrobert.closureconv.transformer.type.TypeInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether an assignment declares, reassigns or shadows, and tracks container aliases.
 *
 * <p><strong>Decisions:</strong></p>
 * <ul>
 *   <li>FRESH - the name is not bound in the current function</li>
 *   <li>REUSE - bound, and the new value fits the existing binding</li>
 *   <li>SHADOW_RENAME - bound, but the new value does not fit: list/tuple vs dict/set,
 *       two different classes, primitive vs class instance, plain value vs alias reference,
 *       or the name currently holds a converted closure</li>
 * </ul>
 *
 * <p>Deciding has no side effects. The caller renders the right-hand side first and then calls
 * {@link #commit}; only then does the rename become visible. A REUSE commit makes the existing
 * declaration mutable; FRESH and SHADOW_RENAME start a new, immutable one:</p>
 * <pre>
 * total = 0                   # FRESH:  const total = 0;
 * total = Record(total)       # SHADOW_RENAME: const total__3 = Record.init(total);
 * use(total)                  #         use(total__3)
 * </pre>
 */
public class ShadowAliasResolver {

    private static final Logger log = LoggerFactory.getLogger(ShadowAliasResolver.class);

    public ShadowDecision resolveShadowOrReuse(String name, TypeInfo newType, ConversionContext context) {
        return resolveShadowOrReuse(name, newType, null, context);
    }

    /**
     * Decides how {@code name = value} is emitted.
     *
     * @param name        Assigned source name
     * @param newType     Inferred type of the value
     * @param aliasTarget Container the value names when the assignment creates an alias, else null
     * @param context     Current conversion state
     */
    public ShadowDecision resolveShadowOrReuse(String name, TypeInfo newType, String aliasTarget, ConversionContext context) {
        TypeInfo type = newType != null ? newType : TypeInfo.UNKNOWN;
        VariableBinding binding = context.lookupInCurrentFunction(name);

        if (binding == null) {
            return ShadowDecision.fresh(name, type, aliasTarget);
        }

        if (needsShadow(binding, type, aliasTarget)) {
            String newId = name + "__" + context.nextUniqueId();
            return ShadowDecision.shadowRename(name, newId, type, aliasTarget);
        }

        TypeInfo merged = type.isUnknown() ? binding.getType() : type;
        return ShadowDecision.reuse(name, context.resolveName(name), merged, aliasTarget);
    }

    /**
     * Applies a decision to the context. Call after the right-hand side has been rendered.
     */
    public void commit(ShadowDecision decision, ConversionContext context) {
        String name = decision.getName();
        RenameTable renames = context.getRenameTable();
        AliasTable aliases = context.getAliasTable();

        switch (decision.getKind()) {
            case FRESH:
                context.registerVariable(newBinding(decision));
                if (renames.isRenamed(name)) {
                    // Local binding hides an outer rename of the same name
                    renames.put(name, name);
                }
                break;

            case REUSE:
                VariableBinding existing = context.lookupVariable(name);
                context.updateVariable(existing.rebind(
                        decision.getType(),
                        decision.isAlias() ? decision.getAliasTarget() : existing.getAliasTarget()));
                break;

            case SHADOW_RENAME:
                VariableBinding previous = context.lookupVariable(name);
                context.registerVariable(newBinding(decision));
                renames.put(name, decision.getIdentifier());
                if (previous != null && previous.isAlias() && !decision.isAlias()) {
                    aliases.remove(name);
                }
                log.debug("Shadowing '{}' as '{}' ({} -> {})", name, decision.getIdentifier(),
                        previous != null ? previous.getType() : TypeInfo.UNKNOWN, decision.getType());
                break;

            default:
                throw new IllegalStateException("Unhandled shadow decision: " + decision.getKind());
        }

        if (decision.isAlias()) {
            aliases.put(name, decision.getAliasTarget());
        }
    }

    /**
     * True if a value of type {@code next} cannot be stored in a binding of type {@code current}.
     * Unknown types are always compatible.
     */
    public boolean isIncompatible(TypeInfo current, TypeInfo next) {
        if (current.isUnknown() || next.isUnknown()) {
            return false;
        }
        if ((current.isSequence() && next.isHashed()) || (current.isHashed() && next.isSequence())) {
            return true;
        }
        if (current.isClassInstance() && next.isClassInstance()) {
            return !current.getClassName().equals(next.getClassName());
        }
        return (current.isPrimitive() && next.isClassInstance())
                || (current.isClassInstance() && next.isPrimitive());
    }

    private boolean needsShadow(VariableBinding binding, TypeInfo newType, String aliasTarget) {
        if (binding.isClosure()) {
            return true;
        }
        boolean wasAlias = binding.isAlias();
        boolean isAlias = aliasTarget != null;
        if (wasAlias != isAlias) {
            return true;
        }
        if (wasAlias) {
            // Retargeting an alias keeps the reference binding
            return false;
        }
        return isIncompatible(binding.getType(), newType);
    }

    // Starts as const; a later REUSE or in-place mutation marks the declaration
    private VariableBinding newBinding(ShadowDecision decision) {
        if (decision.isAlias()) {
            return VariableBinding.alias(decision.getName(), decision.getAliasTarget(), decision.getType(), false);
        }
        return VariableBinding.local(decision.getName(), decision.getType(), false);
    }
}
