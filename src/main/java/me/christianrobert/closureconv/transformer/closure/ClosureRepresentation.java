package me.christianrobert.closureconv.transformer.closure;

import me.christianrobert.closureconv.transformer.analysis.CaptureSet;

import java.util.Objects;

/**
 * Selected shape of a closure together with the captures it carries.
 */
public class ClosureRepresentation {

    private final ClosureShape shape;
    private final CaptureSet captures;
    private final boolean selfRecursive;

    private ClosureRepresentation(ClosureShape shape, CaptureSet captures, boolean selfRecursive) {
        this.shape = shape;
        this.captures = captures;
        this.selfRecursive = selfRecursive;
    }

    public static ClosureRepresentation zeroCapture() {
        return new ClosureRepresentation(ClosureShape.ZERO_CAPTURE, CaptureSet.EMPTY, false);
    }

    public static ClosureRepresentation structCapture(CaptureSet captures) {
        if (captures.isEmpty()) {
            throw new IllegalArgumentException("Struct capture needs at least one captured variable");
        }
        return new ClosureRepresentation(ClosureShape.STRUCT_CAPTURE, captures, false);
    }

    public static ClosureRepresentation recursiveSelfCapture(CaptureSet captures) {
        return new ClosureRepresentation(ClosureShape.RECURSIVE_SELF_CAPTURE, captures, true);
    }

    public ClosureShape getShape() {
        return shape;
    }

    public CaptureSet getCaptures() {
        return captures;
    }

    public boolean isSelfRecursive() {
        return selfRecursive;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ClosureRepresentation that = (ClosureRepresentation) o;
        return selfRecursive == that.selfRecursive &&
                shape == that.shape &&
                captures.equals(that.captures);
    }

    @Override
    public int hashCode() {
        return Objects.hash(shape, captures, selfRecursive);
    }

    @Override
    public String toString() {
        return "ClosureRepresentation{" + shape + ", captures=" + captures.getNames() + "}";
    }
}
