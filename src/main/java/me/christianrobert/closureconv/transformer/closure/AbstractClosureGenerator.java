package me.christianrobert.closureconv.transformer.closure;

import me.christianrobert.closureconv.transformer.analysis.CapturedVariable;
import me.christianrobert.closureconv.transformer.analysis.EffectAnalyzer;
import me.christianrobert.closureconv.transformer.ast.FunctionFragment;
import me.christianrobert.closureconv.transformer.builder.Emitter;
import me.christianrobert.closureconv.transformer.context.BindingKind;
import me.christianrobert.closureconv.transformer.context.ConversionContext;
import me.christianrobert.closureconv.transformer.context.ConversionContext.VariableBinding;
import me.christianrobert.closureconv.transformer.context.RenameTable;
import me.christianrobert.closureconv.transformer.context.ScopeKind;
import me.christianrobert.closureconv.transformer.type.TypeInfo;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared emission steps of the three closure shapes.
 *
 * <p>Subclasses write the shape-specific declarations and call {@link #emitBody} for the
 * routine body. The body is emitted in its own CLOSURE frame: parameters, captures and the
 * self-handle are renamed there, and the frame is dropped again afterwards.</p>
 */
abstract class AbstractClosureGenerator {

    protected final EffectAnalyzer effects;

    protected AbstractClosureGenerator(EffectAnalyzer effects) {
        this.effects = effects;
    }

    /**
     * Writes the closure's declarations at the emitter's current position.
     */
    abstract void generate(ClosurePlan plan, ConversionContext context, Emitter emitter);

    /**
     * Emits the routine body (without braces) at the current indentation.
     *
     * @param captureRenames Captured name to the expression reading it inside the body
     * @param selfHandle     Identifier the body calls itself through, or null
     */
    protected void emitBody(ClosurePlan plan,
                            ConversionContext context,
                            Emitter emitter,
                            Map<String, String> captureRenames,
                            String selfHandle) {
        emitBody(plan, context, emitter, captureRenames, selfHandle, ScopeKind.CLOSURE);
    }

    protected void emitBody(ClosurePlan plan,
                            ConversionContext context,
                            Emitter emitter,
                            Map<String, String> captureRenames,
                            String selfHandle,
                            ScopeKind frameKind) {
        FunctionFragment fragment = plan.getFragment();
        ClosureSignature signature = plan.getSignature();

        // Enclosing bindings of the captures, looked up before the closure frame hides them
        Map<String, VariableBinding> outerBindings = new LinkedHashMap<>();
        for (CapturedVariable captured : plan.getRepresentation().getCaptures()) {
            outerBindings.put(captured.getName(), context.lookupVariable(captured.getName()));
        }
        Map<String, VariableBinding> enclosingAggregates = enclosingAggregates(plan, context);

        context.pushScope(frameKind, frameKind.name().toLowerCase() + ":" + fragment.getName());
        try {
            RenameTable renames = context.getRenameTable();

            for (ClosureSignature.ParamSlot slot : signature.getParams()) {
                context.declareParameter(slot.getSourceName(), slot.getType());
                if (slot.isUsed()) {
                    renames.put(slot.getSourceName(), slot.getEmittedName());
                }
            }

            for (CapturedVariable captured : plan.getRepresentation().getCaptures()) {
                VariableBinding outer = outerBindings.get(captured.getName());
                boolean closure = outer != null && outer.isClosure();
                context.registerVariable(new VariableBinding(
                        captured.getName(),
                        captured.getType(),
                        false,
                        closure ? BindingKind.CLOSURE : BindingKind.CAPTURE,
                        captured.getAliasTarget(),
                        closure ? outer.getWrapperId() : null,
                        closure && outer.isFallible()));
                renames.put(captured.getName(), captureRenames.get(captured.getName()));
            }

            // Recursive closures further out are called through their aggregate's name
            for (VariableBinding aggregate : enclosingAggregates.values()) {
                context.registerVariable(VariableBinding.selfHandle(
                        aggregate.getName(), aggregate.getWrapperId(), aggregate.isFallible()));
                renames.put(aggregate.getName(), aggregate.getWrapperId());
            }

            if (selfHandle != null) {
                context.registerVariable(VariableBinding.selfHandle(
                        fragment.getName(), plan.getWrapperId(), signature.isFallible()));
                renames.put(fragment.getName(), selfHandle);
            }

            for (ClosureSignature.ParamSlot slot : signature.getParams()) {
                if (slot.isReassigned()) {
                    emitter.emitLine("var " + slot.getCopyName() + " = " + slot.getEmittedName() + ";");
                    renames.put(slot.getSourceName(), slot.getCopyName());
                }
            }

            emitter.emitStatements(fragment.getBody());

            if (context.getOptions().isDefaultReturn()
                    && signature.needsDefaultReturn()
                    && !effects.endsWithReturn(fragment.getBody())) {
                emitter.emitLine("return " + signature.defaultReturnValue() + ";");
            }
        } finally {
            context.popScope();
        }
    }

    /**
     * Self-handles of enclosing recursive closures that the body reads without binding the name
     * itself.
     */
    private Map<String, VariableBinding> enclosingAggregates(ClosurePlan plan, ConversionContext context) {
        FunctionFragment fragment = plan.getFragment();
        Map<String, VariableBinding> aggregates = new LinkedHashMap<>();
        for (String name : plan.getUsage().getReferencedNames()) {
            if (fragment.hasFormal(name) || plan.getUsage().isLocallyAssigned(name) || name.equals(fragment.getName())) {
                continue;
            }
            VariableBinding binding = context.lookupVariable(name);
            if (binding != null && binding.isSelfHandle()) {
                aggregates.put(name, binding);
            }
        }
        return aggregates;
    }

    /**
     * Field type of a captured variable: its native type when known, otherwise the type of the
     * enclosing expression it is initialized from.
     */
    protected String fieldType(CapturedVariable captured, String initializer) {
        TypeInfo type = captured.getType();
        if (type.isUnknown()) {
            return "@TypeOf(" + initializer + ")";
        }
        if (captured.isAlias()) {
            return "*" + type.toNativeType();
        }
        return type.toNativeType();
    }
}
