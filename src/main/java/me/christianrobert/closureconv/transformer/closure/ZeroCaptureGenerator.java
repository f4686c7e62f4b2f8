package me.christianrobert.closureconv.transformer.closure;

import me.christianrobert.closureconv.transformer.analysis.EffectAnalyzer;
import me.christianrobert.closureconv.transformer.builder.Emitter;
import me.christianrobert.closureconv.transformer.context.ConversionContext;

import java.util.Collections;

/**
 * Emits a closure without free variables.
 *
 * <pre>
 * const __ZeroImpl_square_2 = struct {
 *     fn __fn_square_2(__p_x_2: i64) i64 {
 *         return (__p_x_2 * __p_x_2);
 *     }
 * };
 * const square = struct {
 *     pub fn call(_: @This(), __p_x_2: i64) i64 {
 *         return __ZeroImpl_square_2.__fn_square_2(__p_x_2);
 *     }
 * }{};
 * </pre>
 */
class ZeroCaptureGenerator extends AbstractClosureGenerator {

    ZeroCaptureGenerator(EffectAnalyzer effects) {
        super(effects);
    }

    @Override
    void generate(ClosurePlan plan, ConversionContext context, Emitter emitter) {
        ClosureSignature signature = plan.getSignature();
        String implName = "__ZeroImpl_" + plan.suffix();
        String fnName = "__fn_" + plan.suffix();

        // STEP 1: implementation routine
        emitter.emitLine("const " + implName + " = struct {");
        emitter.indent();
        emitter.emitLine("fn " + fnName + "(" + signature.implParameterList() + ") "
                + signature.routineReturnType() + " {");
        emitter.indent();
        emitBody(plan, context, emitter, Collections.emptyMap(), null);
        emitter.dedent();
        emitter.emitLine("}");
        emitter.dedent();
        emitter.emitLine("};");

        // STEP 2: zero-size wrapper exposing the uniform call operation
        String params = signature.wrapperParameterList();
        emitter.emitLine("const " + plan.getWrapperId() + " = struct {");
        emitter.indent();
        emitter.emitLine("pub fn call(_: @This()" + (params.isEmpty() ? "" : ", " + params) + ") "
                + signature.routineReturnType() + " {");
        emitter.indent();
        emitter.emitLine("return " + (signature.isFallible() ? "try " : "")
                + implName + "." + fnName + "(" + signature.forwardArguments() + ");");
        emitter.dedent();
        emitter.emitLine("}");
        emitter.dedent();
        emitter.emitLine("}{};");
    }
}
