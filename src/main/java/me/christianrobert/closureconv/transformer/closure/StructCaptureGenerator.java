package me.christianrobert.closureconv.transformer.closure;

import me.christianrobert.closureconv.transformer.analysis.CaptureSet;
import me.christianrobert.closureconv.transformer.analysis.CapturedVariable;
import me.christianrobert.closureconv.transformer.analysis.EffectAnalyzer;
import me.christianrobert.closureconv.transformer.builder.Emitter;
import me.christianrobert.closureconv.transformer.context.ConversionContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Emits a closure whose free variables are copied into an environment struct.
 *
 * <pre>
 * const __CaptureType_adder_1 = struct {
 *     outer: i64,
 * };
 * const __ClosureImpl_adder_1 = struct {
 *     fn call_adder_1(__cap_adder_1: __CaptureType_adder_1, __p_x_1: i64) i64 {
 *         return (__p_x_1 + __cap_adder_1.outer);
 *     }
 * };
 * const __closure_adder_1 = runtime.Closure1(__CaptureType_adder_1, i64, i64, __ClosureImpl_adder_1.call_adder_1){ .captures = .{ .outer = outer } };
 * const adder = __closure_adder_1;
 * </pre>
 *
 * Capture values are read through the enclosing renames, so a closure defined inside another
 * closure initializes its fields from the outer environment.
 */
class StructCaptureGenerator extends AbstractClosureGenerator {

    StructCaptureGenerator(EffectAnalyzer effects) {
        super(effects);
    }

    @Override
    void generate(ClosurePlan plan, ConversionContext context, Emitter emitter) {
        ClosureSignature signature = plan.getSignature();
        CaptureSet captures = plan.getRepresentation().getCaptures();

        String captureType = "__CaptureType_" + plan.suffix();
        String implName = "__ClosureImpl_" + plan.suffix();
        String callName = "call_" + plan.suffix();
        String envParam = "__cap_" + plan.suffix();
        String closureName = "__closure_" + plan.suffix();

        // Initializers are resolved in the enclosing scope, before the body frame exists
        Map<String, String> initializers = new LinkedHashMap<>();
        Map<String, String> bodyRenames = new LinkedHashMap<>();
        for (CapturedVariable captured : captures) {
            initializers.put(captured.getName(), context.resolveName(captured.getName()));
            bodyRenames.put(captured.getName(), envParam + "." + captured.getName());
        }

        // STEP 1: environment type
        emitter.emitLine("const " + captureType + " = struct {");
        emitter.indent();
        for (CapturedVariable captured : captures) {
            emitter.emitLine(captured.getName() + ": " + fieldType(captured, initializers.get(captured.getName())) + ",");
        }
        emitter.dedent();
        emitter.emitLine("};");

        // STEP 2: implementation routine taking the environment first
        boolean envUsed = plan.getUsage().areCapturesUsed(captures.getNames());
        String params = signature.implParameterList();
        emitter.emitLine("const " + implName + " = struct {");
        emitter.indent();
        emitter.emitLine("fn " + callName + "(" + (envUsed ? envParam : "_") + ": " + captureType
                + (params.isEmpty() ? "" : ", " + params) + ") " + signature.routineReturnType() + " {");
        emitter.indent();
        emitBody(plan, context, emitter, bodyRenames, null);
        emitter.dedent();
        emitter.emitLine("}");
        emitter.dedent();
        emitter.emitLine("};");

        // STEP 3: closure value with the captured values
        List<String> typeArgs = new ArrayList<>();
        typeArgs.add(captureType);
        typeArgs.addAll(signature.parameterTypes());
        typeArgs.add(signature.valueReturnType());
        typeArgs.add(implName + "." + callName);

        List<String> fieldInits = new ArrayList<>();
        for (Map.Entry<String, String> init : initializers.entrySet()) {
            fieldInits.add("." + init.getKey() + " = " + init.getValue());
        }

        emitter.emitLine("const " + closureName + " = runtime.Closure" + signature.getParams().size()
                + "(" + String.join(", ", typeArgs) + "){ .captures = .{ " + String.join(", ", fieldInits) + " } };");
        emitter.emitLine("const " + plan.getWrapperId() + " = " + closureName + ";");
    }
}
