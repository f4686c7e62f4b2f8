package me.christianrobert.closureconv.transformer.analysis;

import me.christianrobert.closureconv.transformer.ast.FunctionFragment;
import me.christianrobert.closureconv.transformer.context.BindingKind;
import me.christianrobert.closureconv.transformer.context.ConversionContext;
import me.christianrobert.closureconv.transformer.context.ConversionContext.VariableBinding;
import me.christianrobert.closureconv.transformer.context.ConversionContext.VariableScope;
import me.christianrobert.closureconv.transformer.context.ConversionException;
import me.christianrobert.closureconv.transformer.context.ScopeKind;
import me.christianrobert.closureconv.transformer.type.TypeInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Decides which referenced names of a nested function become fields of its environment.
 *
 * <p>A name is captured when it is read in the body, is not a formal or a local of the
 * function, is not the function's own name, and is bound in an enclosing function, closure or
 * block frame of the context. Names bound only at module level, or nowhere, are globals and
 * are left to global resolution.</p>
 *
 * <p>The context must hold the enclosing scopes only: call this before the function's own
 * frame is pushed.</p>
 */
public class CaptureResolver {

    private static final Logger log = LoggerFactory.getLogger(CaptureResolver.class);

    public CaptureSet resolve(FunctionFragment fragment, UsageAnalysis usage, ConversionContext context) {
        return resolve(fragment, usage, context, Collections.emptyList());
    }

    /**
     * Resolves captures, also accepting names from the enclosing function's formal list when
     * that function's frame is not materialized in the context.
     *
     * @param outerFormals Formals of the enclosing function, may be empty
     * @throws ConversionException UNSUPPORTED_CAPTURE when a captured variable's type is a
     *                             union that includes a non-primitive member
     */
    public CaptureSet resolve(FunctionFragment fragment,
                              UsageAnalysis usage,
                              ConversionContext context,
                              List<String> outerFormals) {
        List<CapturedVariable> captured = new ArrayList<>();

        for (String name : usage.getReferencedNames()) {
            if (fragment.hasFormal(name) || usage.isLocallyAssigned(name) || name.equals(fragment.getName())) {
                continue;
            }

            VariableScope scope = context.lookupScopeOf(name);
            if (scope != null && scope.getKind() != ScopeKind.MODULE) {
                VariableBinding binding = scope.getVariable(name);
                if (binding.isSelfHandle()) {
                    // Enclosing recursive aggregate is reached by name, not through a field
                    log.trace("'{}' in '{}' resolves to aggregate '{}'", name, fragment.getName(), binding.getWrapperId());
                    continue;
                }
                checkCapturable(fragment.getName(), name, binding.getType());
                captured.add(new CapturedVariable(name, binding.getKind(), binding.getType(), binding.getAliasTarget()));
            } else if (scope == null && outerFormals.contains(name)) {
                captured.add(new CapturedVariable(name, BindingKind.PARAMETER, TypeInfo.UNKNOWN, null));
            } else {
                log.trace("'{}' in '{}' left for global resolution", name, fragment.getName());
            }
        }

        CaptureSet result = new CaptureSet(captured);
        log.debug("Captures of '{}': {}", fragment.getName(), result.getNames());
        return result;
    }

    private void checkCapturable(String functionName, String name, TypeInfo type) {
        if (type.isUnion() && !type.isPrimitiveUnion()) {
            throw ConversionException.unsupportedCapture(functionName, name,
                    "type " + type + " has no single representation");
        }
    }
}
