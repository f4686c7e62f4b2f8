package me.christianrobert.closureconv.transformer.closure;

import me.christianrobert.closureconv.transformer.analysis.EffectAnalyzer;
import me.christianrobert.closureconv.transformer.analysis.UsageAnalysis;
import me.christianrobert.closureconv.transformer.ast.FunctionFragment;
import me.christianrobert.closureconv.transformer.ast.Parameter;
import me.christianrobert.closureconv.transformer.context.ConversionContext;
import me.christianrobert.closureconv.transformer.context.ConversionOptions;
import me.christianrobert.closureconv.transformer.context.Diagnostic;
import me.christianrobert.closureconv.transformer.type.TypeInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Emitted parameter list and return type of one converted function.
 *
 * <p>Every formal keeps its position. Formals the body never touches become {@code _}
 * placeholders in the implementation routine:</p>
 * <pre>
 * def pick(a, b, c): return c      →  fn __fn_pick_4(_: i64, _: i64, __p_c_4: i64) i64
 * def bump(n): n += 1; return n    →  fn __fn_bump_5(__p_n_5: i64) i64 {
 *                                         var __v_n_5 = __p_n_5;
 * </pre>
 */
public class ClosureSignature {

    private static final Logger log = LoggerFactory.getLogger(ClosureSignature.class);

    /**
     * One formal parameter slot.
     */
    public static class ParamSlot {
        private final String sourceName;
        private final String emittedName;
        private final String nativeType;
        private final TypeInfo type;
        private final boolean used;
        private final boolean reassigned;
        private final String copyName;

        ParamSlot(String sourceName, String emittedName, String nativeType, TypeInfo type,
                  boolean used, boolean reassigned, String copyName) {
            this.sourceName = sourceName;
            this.emittedName = emittedName;
            this.nativeType = nativeType;
            this.type = type;
            this.used = used;
            this.reassigned = reassigned;
            this.copyName = copyName;
        }

        public String getSourceName() {
            return sourceName;
        }

        public String getEmittedName() {
            return emittedName;
        }

        public String getNativeType() {
            return nativeType;
        }

        public TypeInfo getType() {
            return type;
        }

        public boolean isUsed() {
            return used;
        }

        public boolean isReassigned() {
            return reassigned;
        }

        /**
         * Name of the private mutable copy, or null when the formal is never assigned.
         */
        public String getCopyName() {
            return copyName;
        }

        /**
         * Name the body refers to: the copy if there is one, otherwise the parameter.
         */
        public String getBodyName() {
            return copyName != null ? copyName : emittedName;
        }

        /**
         * Declaration in the implementation routine, {@code _} when unused.
         */
        public String implDeclaration() {
            return (used ? emittedName : "_") + ": " + nativeType;
        }

        /**
         * Declaration in a forwarding wrapper, always named.
         */
        public String wrapperDeclaration() {
            return emittedName + ": " + nativeType;
        }
    }

    private final int id;
    private final List<ParamSlot> params;
    private final TypeInfo returnType;  // null when inference failed
    private final String returnTypeName;
    private final boolean fallible;

    private ClosureSignature(int id, List<ParamSlot> params, TypeInfo returnType, String returnTypeName, boolean fallible) {
        this.id = id;
        this.params = Collections.unmodifiableList(params);
        this.returnType = returnType;
        this.returnTypeName = returnTypeName;
        this.fallible = fallible;
    }

    /**
     * Computes the signature of a function.
     *
     * <p>The return type comes from the source annotation, then from the type oracle; a
     * body without any valued return is void. When none applies, the configured unknown-return
     * policy decides the emitted type and an analysis-limitation diagnostic is recorded.</p>
     */
    public static ClosureSignature build(FunctionFragment fragment,
                                         UsageAnalysis usage,
                                         EffectAnalyzer effects,
                                         ConversionContext context,
                                         int id) {
        ConversionOptions options = context.getOptions();

        List<ParamSlot> slots = new ArrayList<>();
        for (Parameter param : fragment.getParams()) {
            String name = param.getName();
            boolean reassigned = usage.isParameterReassigned(name);
            boolean used = usage.isParameterUsed(name) || reassigned;
            TypeInfo type = param.hasDeclaredType() ? param.getDeclaredType() : TypeInfo.UNKNOWN;
            String nativeType = param.hasDeclaredType() ? type.toNativeType() : options.getDefaultParamType();
            slots.add(new ParamSlot(name, "__p_" + name + "_" + id, nativeType, type, used, reassigned,
                    reassigned ? "__v_" + name + "_" + id : null));
        }
        for (String collector : new String[]{fragment.getVarArg(), fragment.getKwArg()}) {
            if (collector != null) {
                boolean used = usage.isParameterUsed(collector);
                slots.add(new ParamSlot(collector, "__p_" + collector + "_" + id, "anytype",
                        TypeInfo.UNKNOWN, used, false, null));
            }
        }

        TypeInfo returnType = inferReturnType(fragment, effects, context);
        String returnTypeName;
        if (returnType != null) {
            returnTypeName = returnType.toNativeType();
        } else {
            returnTypeName = options.getUnknownReturnPolicy() == ConversionOptions.UnknownReturnPolicy.PLACEHOLDER
                    ? options.getPlaceholderType()
                    : TypeInfo.UNKNOWN.toNativeType();
            log.warn("Return type of '{}' could not be inferred, emitting {}", fragment.getName(), returnTypeName);
            context.addDiagnostic(Diagnostic.analysisLimitation(fragment.getName(),
                    "return type could not be inferred, emitted as " + returnTypeName));
        }

        boolean fallible = options.isFallibleReturns() && effects.canProduceErrors(fragment.getBody());
        return new ClosureSignature(id, slots, returnType, returnTypeName, fallible);
    }

    private static TypeInfo inferReturnType(FunctionFragment fragment, EffectAnalyzer effects, ConversionContext context) {
        if (fragment.getReturnAnnotation() != null) {
            return fragment.getReturnAnnotation();
        }
        Optional<TypeInfo> inferred = context.getTypeEvaluator().inferredReturnType(fragment.getName());
        if (inferred.isPresent() && !inferred.get().isUnknown()) {
            return inferred.get();
        }
        if (!effects.hasReturnWithValue(fragment.getBody())) {
            return TypeInfo.NONE;
        }
        return null;
    }

    public int getId() {
        return id;
    }

    public List<ParamSlot> getParams() {
        return params;
    }

    public boolean isReturnTypeKnown() {
        return returnType != null;
    }

    public TypeInfo getReturnType() {
        return returnType;
    }

    public boolean isFallible() {
        return fallible;
    }

    /**
     * Return type as written after a routine's parameter list: {@code !i64} when fallible.
     */
    public String routineReturnType() {
        return fallible ? "!" + returnTypeName : returnTypeName;
    }

    /**
     * Return type as a type expression: {@code anyerror!i64} when fallible.
     */
    public String valueReturnType() {
        return fallible ? "anyerror!" + returnTypeName : returnTypeName;
    }

    public String implParameterList() {
        List<String> parts = new ArrayList<>();
        for (ParamSlot slot : params) {
            parts.add(slot.implDeclaration());
        }
        return String.join(", ", parts);
    }

    public String wrapperParameterList() {
        List<String> parts = new ArrayList<>();
        for (ParamSlot slot : params) {
            parts.add(slot.wrapperDeclaration());
        }
        return String.join(", ", parts);
    }

    public String forwardArguments() {
        List<String> parts = new ArrayList<>();
        for (ParamSlot slot : params) {
            parts.add(slot.getEmittedName());
        }
        return String.join(", ", parts);
    }

    public List<String> parameterTypes() {
        List<String> types = new ArrayList<>();
        for (ParamSlot slot : params) {
            types.add(slot.getNativeType());
        }
        return types;
    }

    /**
     * Whether a default return has to be appended after a body that does not end in one.
     */
    public boolean needsDefaultReturn() {
        return returnType != null && !returnType.isNone();
    }

    /**
     * Zero value of the return type.
     */
    public String defaultReturnValue() {
        if (returnType == null) {
            return "undefined";
        }
        switch (returnType.getCategory()) {
            case INT:
                return "0";
            case FLOAT:
                return "0.0";
            case BOOL:
                return "false";
            case STRING:
            case BYTES:
                return "\"\"";
            default:
                return "undefined";
        }
    }
}
