package me.christianrobert.closureconv.transformer.closure;

/**
 * How a nested function is represented in the closure-free target.
 */
public enum ClosureShape {
    ZERO_CAPTURE,           // no free variables: plain routine behind a zero-size wrapper
    STRUCT_CAPTURE,         // free variables copied into an environment struct
    RECURSIVE_SELF_CAPTURE  // calls itself: aggregate with persistent fields and a stable self-handle
}
