package me.christianrobert.closureconv.transformer.closure;

import me.christianrobert.closureconv.transformer.analysis.CaptureSet;

/**
 * Chooses the closure shape. Pure function of its inputs.
 *
 * <pre>
 * self-recursive            → RECURSIVE_SELF_CAPTURE (with or without captures)
 * captures, not recursive   → STRUCT_CAPTURE
 * no captures, no recursion → ZERO_CAPTURE
 * </pre>
 */
public class RepresentationSelector {

    public ClosureRepresentation select(CaptureSet captures, boolean selfRecursive) {
        CaptureSet set = captures != null ? captures : CaptureSet.EMPTY;
        if (selfRecursive) {
            return ClosureRepresentation.recursiveSelfCapture(set);
        }
        if (set.isEmpty()) {
            return ClosureRepresentation.zeroCapture();
        }
        return ClosureRepresentation.structCapture(set);
    }
}
