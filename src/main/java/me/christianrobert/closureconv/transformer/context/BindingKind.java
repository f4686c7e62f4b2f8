package me.christianrobert.closureconv.transformer.context;

/**
 * How a name came to be bound in its scope.
 */
public enum BindingKind {
    PARAMETER,  // formal parameter of the enclosing function
    LOCAL,      // assigned in the function body
    CAPTURE,    // field of a closure environment
    CLOSURE,    // converted nested function; call sites go through its wrapper
    SELF,       // recursive closure seen from its own body or a function nested in it; never captured
    GLOBAL,     // module-level binding
    IMPORT      // imported module name
}
