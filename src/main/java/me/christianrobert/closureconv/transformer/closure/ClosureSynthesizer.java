package me.christianrobert.closureconv.transformer.closure;

import me.christianrobert.closureconv.transformer.analysis.CaptureResolver;
import me.christianrobert.closureconv.transformer.analysis.CaptureSet;
import me.christianrobert.closureconv.transformer.analysis.EffectAnalyzer;
import me.christianrobert.closureconv.transformer.analysis.UsageAnalysis;
import me.christianrobert.closureconv.transformer.analysis.VariableUsageAnalyzer;
import me.christianrobert.closureconv.transformer.ast.FunctionFragment;
import me.christianrobert.closureconv.transformer.builder.Emitter;
import me.christianrobert.closureconv.transformer.context.ConversionContext;
import me.christianrobert.closureconv.transformer.context.ConversionContext.VariableBinding;
import me.christianrobert.closureconv.transformer.context.ConversionException;
import me.christianrobert.closureconv.transformer.context.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

/**
 * Converts one nested function into closure-free declarations.
 *
 * <p><strong>Pipeline:</strong></p>
 * <ol>
 *   <li>{@link VariableUsageAnalyzer} - reads, locals, self-recursion</li>
 *   <li>{@link CaptureResolver} - free variables bound in enclosing frames</li>
 *   <li>{@link RepresentationSelector} - ZERO_CAPTURE, STRUCT_CAPTURE or RECURSIVE_SELF_CAPTURE</li>
 *   <li>{@link ClosureSignature} - parameter slots, return type, fallibility</li>
 *   <li>shape generator - writes the declarations through the {@link Emitter}</li>
 * </ol>
 *
 * <p>After emission the closure is registered in the enclosing frame: the source name is bound
 * as a CLOSURE (so call sites emit {@code <wrapper>.call(args)}) and renamed to the wrapper
 * identifier. If the source name is already visible, or names an imported module, the wrapper
 * is emitted as {@code __local_<name>_<id>} instead and the rename redirects to it.</p>
 */
public class ClosureSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(ClosureSynthesizer.class);

    /**
     * Identifier a recursive closure calls itself through inside its own body.
     */
    public static final String SELF_HANDLE = "call";

    private final VariableUsageAnalyzer usageAnalyzer;
    private final CaptureResolver captureResolver;
    private final RepresentationSelector selector;
    private final EffectAnalyzer effects;

    private final ZeroCaptureGenerator zeroCaptureGenerator;
    private final StructCaptureGenerator structCaptureGenerator;
    private final RecursiveClosureGenerator recursiveGenerator;
    private final TopLevelFunctionGenerator topLevelGenerator;

    public ClosureSynthesizer() {
        this(new VariableUsageAnalyzer(), new CaptureResolver(), new RepresentationSelector(), new EffectAnalyzer());
    }

    public ClosureSynthesizer(VariableUsageAnalyzer usageAnalyzer,
                              CaptureResolver captureResolver,
                              RepresentationSelector selector,
                              EffectAnalyzer effects) {
        this.usageAnalyzer = usageAnalyzer;
        this.captureResolver = captureResolver;
        this.selector = selector;
        this.effects = effects;
        this.zeroCaptureGenerator = new ZeroCaptureGenerator(effects);
        this.structCaptureGenerator = new StructCaptureGenerator(effects);
        this.recursiveGenerator = new RecursiveClosureGenerator(effects);
        this.topLevelGenerator = new TopLevelFunctionGenerator(effects);
    }

    public SynthesizedClosure synthesize(FunctionFragment fragment, ConversionContext context, Emitter emitter) {
        return synthesize(fragment, context, emitter, Collections.emptyList());
    }

    /**
     * Converts a nested function at the emitter's current position.
     *
     * @param fragment     Nested function to convert
     * @param context      Conversion state; its innermost frame is the enclosing scope
     * @param emitter      Target of the emitted declarations
     * @param outerFormals Formals of the enclosing function when its frame is not in the context
     * @return Emitted code, representation and the renames added to the enclosing scope
     * @throws ConversionException INVALID_FRAGMENT for a null fragment, UNSUPPORTED_CAPTURE
     *                             for a capture without a single representation
     */
    public SynthesizedClosure synthesize(FunctionFragment fragment,
                                         ConversionContext context,
                                         Emitter emitter,
                                         List<String> outerFormals) {
        if (fragment == null) {
            throw new ConversionException(ConversionException.ErrorKind.INVALID_FRAGMENT,
                    "Cannot synthesize a closure from a null fragment");
        }

        UsageAnalysis usage = usageAnalyzer.analyze(fragment);
        CaptureSet captures = captureResolver.resolve(fragment, usage, context, outerFormals);
        ClosureRepresentation representation = selector.select(captures, usage.isSelfRecursive());

        int id = context.nextUniqueId();
        ClosureSignature signature = ClosureSignature.build(fragment, usage, effects, context, id);
        String wrapperId = chooseWrapperId(fragment.getName(), id, context);

        log.debug("Converting '{}' as {} (captures={}, wrapper={})",
                fragment.getName(), representation.getShape(), captures.getNames(), wrapperId);

        ClosurePlan plan = new ClosurePlan(fragment, usage, representation, signature, wrapperId);
        int mark = emitter.mark();
        generatorFor(representation.getShape()).generate(plan, context, emitter);
        String code = emitter.since(mark);

        // Visible to code after the definition only
        context.registerVariable(VariableBinding.closure(fragment.getName(), wrapperId, signature.isFallible()));
        context.getRenameTable().put(fragment.getName(), wrapperId);

        log.trace("Emitted closure '{}':\n{}", fragment.getName(), code);
        return new SynthesizedClosure(fragment.getName(), wrapperId, representation, signature, code,
                RenameTableDelta.of(fragment.getName(), wrapperId));
    }

    /**
     * Emits a module-level function, converting every nested function in its body.
     *
     * @return The emitted function
     */
    public String emitFunction(FunctionFragment fragment, ConversionContext context, Emitter emitter) {
        if (fragment == null) {
            throw new ConversionException(ConversionException.ErrorKind.INVALID_FRAGMENT,
                    "Cannot emit a null function fragment");
        }

        UsageAnalysis usage = usageAnalyzer.analyze(fragment);
        int id = context.nextUniqueId();
        ClosureSignature signature = ClosureSignature.build(fragment, usage, effects, context, id);

        ClosurePlan plan = new ClosurePlan(fragment, usage, ClosureRepresentation.zeroCapture(), signature,
                fragment.getName());
        int mark = emitter.mark();
        topLevelGenerator.generate(plan, context, emitter);
        return emitter.since(mark);
    }

    public VariableUsageAnalyzer getUsageAnalyzer() {
        return usageAnalyzer;
    }

    public EffectAnalyzer getEffects() {
        return effects;
    }

    private AbstractClosureGenerator generatorFor(ClosureShape shape) {
        switch (shape) {
            case ZERO_CAPTURE:
                return zeroCaptureGenerator;
            case STRUCT_CAPTURE:
                return structCaptureGenerator;
            case RECURSIVE_SELF_CAPTURE:
                return recursiveGenerator;
            default:
                throw new IllegalStateException("Unhandled closure shape: " + shape);
        }
    }

    private String chooseWrapperId(String name, int id, ConversionContext context) {
        if (!context.isDeclared(name)) {
            return name;
        }
        String local = "__local_" + name + "_" + id;
        String reason = context.isImportedModule(name) ? "imported module" : "visible binding";
        log.debug("Wrapper for '{}' collides with {}, emitting {}", name, reason, local);
        context.addDiagnostic(Diagnostic.nameCollision(name,
                "'" + name + "' collides with " + reason + ", emitted as " + local));
        return local;
    }
}
