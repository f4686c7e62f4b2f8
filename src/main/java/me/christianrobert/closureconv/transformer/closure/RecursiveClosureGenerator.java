package me.christianrobert.closureconv.transformer.closure;

import me.christianrobert.closureconv.transformer.analysis.CapturedVariable;
import me.christianrobert.closureconv.transformer.analysis.EffectAnalyzer;
import me.christianrobert.closureconv.transformer.builder.Emitter;
import me.christianrobert.closureconv.transformer.context.ConversionContext;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Emits a closure that calls itself.
 *
 * <p>The aggregate holds the captures in persistent fields, which are set once right after
 * the declaration; recursive calls go through the stable self-handle {@code call}.</p>
 *
 * <pre>
 * const fact = struct {
 *     var __c_step: i64 = undefined;
 *     pub fn call(__p_n_0: i64) !i64 {
 *         return (if ((__p_n_0 &lt;= 1)) 1 else (__p_n_0 * try call((__p_n_0 - __c_step))));
 *     }
 * };
 * fact.__c_step = step;
 * </pre>
 */
class RecursiveClosureGenerator extends AbstractClosureGenerator {

    RecursiveClosureGenerator(EffectAnalyzer effects) {
        super(effects);
    }

    @Override
    void generate(ClosurePlan plan, ConversionContext context, Emitter emitter) {
        ClosureSignature signature = plan.getSignature();

        Map<String, String> initializers = new LinkedHashMap<>();
        Map<String, String> bodyRenames = new LinkedHashMap<>();
        for (CapturedVariable captured : plan.getRepresentation().getCaptures()) {
            initializers.put(captured.getName(), context.resolveName(captured.getName()));
            bodyRenames.put(captured.getName(), fieldName(captured));
        }

        // STEP 1: aggregate with persistent fields and the call operation
        emitter.emitLine("const " + plan.getWrapperId() + " = struct {");
        emitter.indent();
        for (CapturedVariable captured : plan.getRepresentation().getCaptures()) {
            emitter.emitLine("var " + fieldName(captured) + ": "
                    + fieldType(captured, initializers.get(captured.getName())) + " = undefined;");
        }
        emitter.emitLine("pub fn call(" + signature.implParameterList() + ") " + signature.routineReturnType() + " {");
        emitter.indent();
        emitBody(plan, context, emitter, bodyRenames, ClosureSynthesizer.SELF_HANDLE);
        emitter.dedent();
        emitter.emitLine("}");
        emitter.dedent();
        emitter.emitLine("};");

        // STEP 2: one-time field initialization from the enclosing bindings
        for (CapturedVariable captured : plan.getRepresentation().getCaptures()) {
            emitter.emitLine(plan.getWrapperId() + "." + fieldName(captured) + " = "
                    + initializers.get(captured.getName()) + ";");
        }
    }

    private String fieldName(CapturedVariable captured) {
        return "__c_" + captured.getName();
    }
}
