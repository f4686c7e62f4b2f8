package me.christianrobert.closureconv.transformer.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.closureconv.config.service.ConfigService;
import me.christianrobert.closureconv.transformer.ast.FunctionFragment;
import me.christianrobert.closureconv.transformer.builder.NativeCodeBuilder;
import me.christianrobert.closureconv.transformer.closure.RenameTableDelta;
import me.christianrobert.closureconv.transformer.closure.SynthesizedClosure;
import me.christianrobert.closureconv.transformer.context.ConversionContext;
import me.christianrobert.closureconv.transformer.context.ConversionException;
import me.christianrobert.closureconv.transformer.context.ConversionOptions;
import me.christianrobert.closureconv.transformer.context.ConversionResult;
import me.christianrobert.closureconv.transformer.shadow.ShadowAliasResolver;
import me.christianrobert.closureconv.transformer.shadow.ShadowDecision;
import me.christianrobert.closureconv.transformer.type.TypeEvaluator;
import me.christianrobert.closureconv.transformer.type.TypeInfo;
import me.christianrobert.closureconv.transformer.util.AstTreeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;

/**
 * Entry point of the closure conversion.
 *
 * <p>Architecture:
 * <pre>
 * FunctionFragment → VariableUsageAnalyzer → CaptureResolver → RepresentationSelector
 *                                                                     ↓
 *                  ConversionResult ← NativeCodeBuilder ← ClosureSynthesizer
 * </pre>
 *
 * <p>Each call works on a caller-supplied {@link ConversionContext}; create one per converted
 * function with {@link #newContext(TypeEvaluator)}. Conversion failures are returned as
 * failed results, never thrown.</p>
 */
@ApplicationScoped
public class ClosureConversionService {

    private static final Logger log = LoggerFactory.getLogger(ClosureConversionService.class);

    @Inject
    ConfigService configService;

    private final ShadowAliasResolver shadowResolver = new ShadowAliasResolver();

    /**
     * Creates a conversion context configured from the current settings.
     *
     * @param typeEvaluator Type oracle of the surrounding compiler
     */
    public ConversionContext newContext(TypeEvaluator typeEvaluator) {
        return new ConversionContext(typeEvaluator, currentOptions());
    }

    /**
     * Converts one nested function at the innermost scope of the context.
     *
     * <p>On success the closure's source name is renamed in the context, so later code of the
     * enclosing function calls the wrapper. The result carries the rename, the chosen shape and
     * the diagnostics recorded during this conversion.</p>
     *
     * @param fragment Nested function
     * @param context  Conversion state of the enclosing function
     * @return ConversionResult containing either the emitted declarations or error details
     */
    public ConversionResult synthesizeClosure(FunctionFragment fragment, ConversionContext context) {
        if (fragment == null) {
            return ConversionResult.failure(null, "Function fragment cannot be null");
        }
        if (context == null) {
            return ConversionResult.failure(fragment.getName(), "Conversion context cannot be null");
        }

        log.debug("Synthesizing closure '{}'", fragment.getName());
        NativeCodeBuilder builder = new NativeCodeBuilder(context);

        try {
            SynthesizedClosure closure = builder.getSynthesizer().synthesize(fragment, context, builder);
            log.debug("Closure '{}' converted as {}", fragment.getName(), closure.getShape());
            return ConversionResult.success(fragment.getName(), closure.getCode(), closure.getRenameDelta(),
                    closure.getShape(), context.drainDiagnostics());

        } catch (ConversionException e) {
            log.warn("Closure conversion failed: {}", e.getDetailedMessage());
            context.drainDiagnostics();
            return ConversionResult.failure(fragment.getName(), e);
        }
    }

    /**
     * Decides how an assignment to {@code name} is emitted. The decision is not committed.
     *
     * @see ShadowAliasResolver#commit(ShadowDecision, ConversionContext)
     */
    public ShadowDecision resolveShadowOrReuse(String name, TypeInfo newType, ConversionContext context) {
        return shadowResolver.resolveShadowOrReuse(name, newType, context);
    }

    public ConversionResult convertFunction(FunctionFragment fragment, ConversionContext context) {
        return convertFunction(fragment, context, false);
    }

    /**
     * Emits a module-level function with every nested function converted.
     *
     * @param fragment   Module-level function
     * @param context    Fresh conversion context
     * @param includeAst Whether to include the source tree in the result (for debugging)
     * @return ConversionResult containing the function and optionally the tree
     */
    public ConversionResult convertFunction(FunctionFragment fragment, ConversionContext context, boolean includeAst) {
        if (fragment == null) {
            return ConversionResult.failure(null, "Function fragment cannot be null");
        }
        if (context == null) {
            return ConversionResult.failure(fragment.getName(), "Conversion context cannot be null");
        }

        log.debug("Converting function '{}'", fragment.getName());

        String astTree = null;
        if (includeAst) {
            log.debug("Generating tree representation with type information");
            astTree = AstTreeFormatter.format(fragment, context);
        }

        NativeCodeBuilder builder = new NativeCodeBuilder(context);
        try {
            String code = builder.buildFunction(fragment);
            log.trace("Converted function '{}':\n{}", fragment.getName(), code);

            if (includeAst) {
                return ConversionResult.successWithAst(fragment.getName(), code, RenameTableDelta.EMPTY, null,
                        context.drainDiagnostics(), astTree);
            }
            return ConversionResult.success(fragment.getName(), code, RenameTableDelta.EMPTY, null,
                    context.drainDiagnostics());

        } catch (ConversionException e) {
            log.warn("Function conversion failed: {}", e.getDetailedMessage());
            context.drainDiagnostics();
            return ConversionResult.failure(fragment.getName(), e);
        }
    }

    private ConversionOptions currentOptions() {
        ConversionOptions options = ConversionOptions.defaults();
        if (configService == null) {
            return options;
        }

        String policy = configService.getConfigValueAsString(ConfigService.UNKNOWN_RETURN_POLICY);
        if (policy != null) {
            try {
                options.setUnknownReturnPolicy(ConversionOptions.UnknownReturnPolicy.valueOf(policy.trim().toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring unknown value '{}' for {}", policy, ConfigService.UNKNOWN_RETURN_POLICY);
            }
        }

        String placeholder = configService.getConfigValueAsString(ConfigService.PLACEHOLDER_TYPE);
        if (placeholder != null && !placeholder.trim().isEmpty()) {
            options.setPlaceholderType(placeholder.trim());
        }
        String paramType = configService.getConfigValueAsString(ConfigService.DEFAULT_PARAM_TYPE);
        if (paramType != null && !paramType.trim().isEmpty()) {
            options.setDefaultParamType(paramType.trim());
        }

        Boolean fallible = configService.getConfigValueAsBoolean(ConfigService.FALLIBLE_RETURNS);
        if (fallible != null) {
            options.setFallibleReturns(fallible);
        }
        Boolean defaultReturn = configService.getConfigValueAsBoolean(ConfigService.DEFAULT_RETURN);
        if (defaultReturn != null) {
            options.setDefaultReturn(defaultReturn);
        }

        options.setImportedModules(new LinkedHashSet<>(
                configService.getConfigValueAsStringList(ConfigService.IMPORTED_MODULES)));
        return options;
    }
}
