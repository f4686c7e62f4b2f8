package me.christianrobert.closureconv.transformer.context;

/**
 * Kind of a frame on the conversion scope stack.
 */
public enum ScopeKind {
    MODULE,    // top level: bindings are globals, never captured
    FUNCTION,  // top-level function body
    CLOSURE,   // body of a nested function or lambda being converted
    BLOCK      // nested block that introduces its own bindings
}
