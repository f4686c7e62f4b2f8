package me.christianrobert.closureconv.transformer.closure;

import me.christianrobert.closureconv.transformer.analysis.UsageAnalysis;
import me.christianrobert.closureconv.transformer.ast.FunctionFragment;

/**
 * Everything a generator needs to emit one closure, decided before any code is written.
 */
class ClosurePlan {

    private final FunctionFragment fragment;
    private final UsageAnalysis usage;
    private final ClosureRepresentation representation;
    private final ClosureSignature signature;
    private final String wrapperId;

    ClosurePlan(FunctionFragment fragment,
                UsageAnalysis usage,
                ClosureRepresentation representation,
                ClosureSignature signature,
                String wrapperId) {
        this.fragment = fragment;
        this.usage = usage;
        this.representation = representation;
        this.signature = signature;
        this.wrapperId = wrapperId;
    }

    FunctionFragment getFragment() {
        return fragment;
    }

    UsageAnalysis getUsage() {
        return usage;
    }

    ClosureRepresentation getRepresentation() {
        return representation;
    }

    ClosureSignature getSignature() {
        return signature;
    }

    String getWrapperId() {
        return wrapperId;
    }

    String getName() {
        return fragment.getName();
    }

    int getId() {
        return signature.getId();
    }

    /**
     * {@code <name>_<id>}, the suffix shared by every identifier synthesized for this closure.
     */
    String suffix() {
        return fragment.getName() + "_" + signature.getId();
    }
}
