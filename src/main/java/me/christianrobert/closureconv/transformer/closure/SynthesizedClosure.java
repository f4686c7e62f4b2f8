package me.christianrobert.closureconv.transformer.closure;

import me.christianrobert.closureconv.transformer.analysis.CapturedVariable;

import java.util.List;

/**
 * Outcome of converting one nested function.
 */
public class SynthesizedClosure {

    private final String sourceName;
    private final String wrapperId;
    private final ClosureRepresentation representation;
    private final ClosureSignature signature;
    private final String code;
    private final RenameTableDelta renameDelta;

    public SynthesizedClosure(String sourceName,
                              String wrapperId,
                              ClosureRepresentation representation,
                              ClosureSignature signature,
                              String code,
                              RenameTableDelta renameDelta) {
        this.sourceName = sourceName;
        this.wrapperId = wrapperId;
        this.representation = representation;
        this.signature = signature;
        this.code = code;
        this.renameDelta = renameDelta;
    }

    public String getSourceName() {
        return sourceName;
    }

    /**
     * Identifier call sites use: {@code <wrapperId>.call(args)}.
     */
    public String getWrapperId() {
        return wrapperId;
    }

    public ClosureRepresentation getRepresentation() {
        return representation;
    }

    public ClosureShape getShape() {
        return representation.getShape();
    }

    public ClosureSignature getSignature() {
        return signature;
    }

    public boolean isFallible() {
        return signature.isFallible();
    }

    public String getCode() {
        return code;
    }

    public RenameTableDelta getRenameDelta() {
        return renameDelta;
    }

    /**
     * Captured aliases: the environment references them, their owner keeps them alive.
     */
    public List<CapturedVariable> getBorrowedCaptures() {
        return representation.getCaptures().getBorrowed();
    }

    @Override
    public String toString() {
        return "SynthesizedClosure{" + sourceName + " -> " + wrapperId + ", " + representation.getShape() + "}";
    }
}
