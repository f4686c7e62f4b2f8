package me.christianrobert.closureconv.transformer.closure;

import me.christianrobert.closureconv.transformer.analysis.EffectAnalyzer;
import me.christianrobert.closureconv.transformer.builder.Emitter;
import me.christianrobert.closureconv.transformer.context.ConversionContext;
import me.christianrobert.closureconv.transformer.context.ScopeKind;

import java.util.Collections;

/**
 * Emits a module-level function. Nested functions inside it are converted as the body is
 * emitted.
 *
 * <pre>
 * pub fn make_adder(__p_base_0: i64) i64 {
 *     ...
 * }
 * </pre>
 */
class TopLevelFunctionGenerator extends AbstractClosureGenerator {

    TopLevelFunctionGenerator(EffectAnalyzer effects) {
        super(effects);
    }

    @Override
    void generate(ClosurePlan plan, ConversionContext context, Emitter emitter) {
        ClosureSignature signature = plan.getSignature();
        emitter.emitLine("pub fn " + plan.getWrapperId() + "(" + signature.implParameterList() + ") "
                + signature.routineReturnType() + " {");
        emitter.indent();
        emitBody(plan, context, emitter, Collections.emptyMap(), null, ScopeKind.FUNCTION);
        emitter.dedent();
        emitter.emitLine("}");
    }
}
