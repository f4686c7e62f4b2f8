package me.christianrobert.closureconv.transformer.context;

import me.christianrobert.closureconv.transformer.type.TypeEvaluator;
import me.christianrobert.closureconv.transformer.type.TypeInfo;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one closure conversion.
 *
 * <p>Holds everything the analyzers, the synthesizer and the code builder need to agree on
 * while a function is converted:</p>
 * <ul>
 *   <li>{@link #scopeStack} - stack of {@link VariableScope} frames (module, function, closure, block)</li>
 *   <li>{@link #renameTable} - active source-name to emitted-identifier renames</li>
 *   <li>{@link #aliasTable} - which names share a reference-semantics container</li>
 *   <li>the unique-id counter used for every synthesized identifier</li>
 *   <li>diagnostics collected along the way</li>
 * </ul>
 *
 * <p>One context per conversion; never shared between threads. The module frame is pushed
 * by the constructor and holds the imported module names.</p>
 */
public class ConversionContext {

    // ========== Scope Tracking (Inner Classes) ==========

    /**
     * A single frame of the scope stack.
     *
     * <p><strong>Example scope hierarchy:</strong></p>
     * <pre>
     * MODULE: helper, math (import)
     *   ↳ FUNCTION make_counter: start, total
     *     ↳ CLOSURE increment: step
     * </pre>
     */
    public static class VariableScope {
        private final Map<String, VariableBinding> variables = new LinkedHashMap<>();
        private final ScopeKind kind;
        private final String scopeName;

        public VariableScope(ScopeKind kind, String scopeName) {
            this.kind = kind;
            this.scopeName = scopeName;
        }

        public void addVariable(VariableBinding binding) {
            variables.put(binding.getName(), binding);
        }

        public VariableBinding getVariable(String name) {
            return variables.get(name);
        }

        public boolean hasVariable(String name) {
            return variables.containsKey(name);
        }

        public ScopeKind getKind() {
            return kind;
        }

        public String getScopeName() {
            return scopeName;
        }

        public Map<String, VariableBinding> getVariables() {
            return Collections.unmodifiableMap(variables);
        }

        public boolean isFunctionBoundary() {
            return kind == ScopeKind.FUNCTION || kind == ScopeKind.CLOSURE;
        }

        @Override
        public String toString() {
            return "VariableScope{" +
                    "kind=" + kind +
                    ", scopeName='" + scopeName + '\'' +
                    ", variables=" + variables.size() +
                    '}';
        }
    }

    /**
     * What is known about one bound name.
     *
     * <p><strong>Examples:</strong></p>
     * <ul>
     *   <li>{@code total = 0} → LOCAL, type INT</li>
     *   <li>{@code b = a} with {@code a} a list → LOCAL, type LIST, aliasTarget "a"</li>
     *   <li>{@code def inc(x): ...} converted → CLOSURE, wrapperId "__closure_inc_3"</li>
     *   <li>{@code fact} inside recursive {@code fact} → SELF, wrapperId "fact"</li>
     * </ul>
     */
    public static class VariableBinding {
        private final String name;
        private final TypeInfo type;
        private final Declaration declaration;
        private final BindingKind kind;
        private final String aliasTarget;  // null unless this name references another container
        private final String wrapperId;    // null unless kind is CLOSURE or SELF
        private final boolean fallible;    // closure call may fail

        public VariableBinding(String name,
                               TypeInfo type,
                               boolean mutable,
                               BindingKind kind,
                               String aliasTarget,
                               String wrapperId,
                               boolean fallible) {
            this(name, type, new Declaration(mutable), kind, aliasTarget, wrapperId, fallible);
        }

        private VariableBinding(String name,
                                TypeInfo type,
                                Declaration declaration,
                                BindingKind kind,
                                String aliasTarget,
                                String wrapperId,
                                boolean fallible) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Binding name cannot be null or empty");
            }
            this.name = name;
            this.type = type != null ? type : TypeInfo.UNKNOWN;
            this.declaration = declaration;
            this.kind = kind;
            this.aliasTarget = aliasTarget;
            this.wrapperId = wrapperId;
            this.fallible = fallible;
        }

        public static VariableBinding local(String name, TypeInfo type, boolean mutable) {
            return new VariableBinding(name, type, mutable, BindingKind.LOCAL, null, null, false);
        }

        public static VariableBinding parameter(String name, TypeInfo type) {
            return new VariableBinding(name, type, false, BindingKind.PARAMETER, null, null, false);
        }

        public static VariableBinding alias(String name, String target, TypeInfo type, boolean mutable) {
            return new VariableBinding(name, type, mutable, BindingKind.LOCAL, target, null, false);
        }

        public static VariableBinding closure(String name, String wrapperId, boolean fallible) {
            return new VariableBinding(name, TypeInfo.CLOSURE, false, BindingKind.CLOSURE, null, wrapperId, fallible);
        }

        /**
         * Name of a recursive closure as seen from inside its aggregate. The wrapper id is the
         * aggregate itself, so code nested deeper can still reach it by name.
         */
        public static VariableBinding selfHandle(String name, String wrapperId, boolean fallible) {
            return new VariableBinding(name, TypeInfo.CLOSURE, false, BindingKind.SELF, null, wrapperId, fallible);
        }

        public VariableBinding withType(TypeInfo newType) {
            return new VariableBinding(name, newType, declaration, kind, aliasTarget, wrapperId, fallible);
        }

        /**
         * The same binding after a plain reassignment. It keeps its declaration, which has to be
         * mutable from now on.
         */
        public VariableBinding rebind(TypeInfo newType, String newAliasTarget) {
            declaration.markMutable();
            return new VariableBinding(name, newType, declaration, kind, newAliasTarget, wrapperId, fallible);
        }

        public String getName() {
            return name;
        }

        public TypeInfo getType() {
            return type;
        }

        public boolean isMutable() {
            return declaration.isMutable();
        }

        public Declaration getDeclaration() {
            return declaration;
        }

        public BindingKind getKind() {
            return kind;
        }

        public String getAliasTarget() {
            return aliasTarget;
        }

        public boolean isAlias() {
            return aliasTarget != null;
        }

        public String getWrapperId() {
            return wrapperId;
        }

        public boolean isFallible() {
            return fallible;
        }

        public boolean isClosure() {
            return kind == BindingKind.CLOSURE || kind == BindingKind.SELF;
        }

        public boolean isSelfHandle() {
            return kind == BindingKind.SELF;
        }

        @Override
        public String toString() {
            return "VariableBinding{" +
                    "name='" + name + '\'' +
                    ", type=" + type +
                    ", kind=" + kind +
                    (aliasTarget != null ? ", alias->" + aliasTarget : "") +
                    (wrapperId != null ? ", wrapper=" + wrapperId : "") +
                    '}';
        }
    }

    // ========== State ==========

    private final TypeEvaluator typeEvaluator;
    private final ConversionOptions options;

    /**
     * Scope stack, innermost frame first.
     *
     * <p>Every frame above the module frame also pushes a frame on the rename and alias
     * tables, so popping the scope drops every rename made inside it.</p>
     */
    private final Deque<VariableScope> scopeStack = new ArrayDeque<>();
    private final RenameTable renameTable = new RenameTable();
    private final AliasTable aliasTable = new AliasTable();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private int uniqueCounter = 0;

    public ConversionContext(TypeEvaluator typeEvaluator) {
        this(typeEvaluator, ConversionOptions.defaults());
    }

    public ConversionContext(TypeEvaluator typeEvaluator, ConversionOptions options) {
        if (typeEvaluator == null) {
            throw new IllegalArgumentException("TypeEvaluator cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("ConversionOptions cannot be null");
        }
        this.typeEvaluator = typeEvaluator;
        this.options = options;

        VariableScope module = new VariableScope(ScopeKind.MODULE, "module");
        for (String imported : options.getImportedModules()) {
            module.addVariable(new VariableBinding(imported, TypeInfo.UNKNOWN, false,
                    BindingKind.IMPORT, null, null, false));
        }
        scopeStack.push(module);
    }

    public TypeEvaluator getTypeEvaluator() {
        return typeEvaluator;
    }

    public ConversionOptions getOptions() {
        return options;
    }

    // ========== Scope Management ==========

    /**
     * Pushes a new frame onto the scope stack.
     *
     * <pre>
     * context.pushScope(ScopeKind.CLOSURE, "closure:" + name);
     * try {
     *     // declare parameters, emit body
     * } finally {
     *     context.popScope();
     * }
     * </pre>
     */
    public VariableScope pushScope(ScopeKind kind, String scopeName) {
        if (kind == ScopeKind.MODULE) {
            throw new ConversionException(ConversionException.ErrorKind.SCOPE_VIOLATION,
                    "Module scope is created with the context and cannot be pushed again");
        }
        VariableScope scope = new VariableScope(kind, scopeName);
        scopeStack.push(scope);
        renameTable.push();
        aliasTable.push();
        return scope;
    }

    /**
     * Pops the current frame.
     *
     * @throws IllegalStateException if only the module frame is left
     */
    public VariableScope popScope() {
        if (scopeStack.size() <= 1) {
            throw new IllegalStateException("Cannot pop variable scope: only the module scope is left");
        }
        VariableScope scope = scopeStack.pop();
        renameTable.pop();
        aliasTable.pop();
        return scope;
    }

    public VariableScope currentScope() {
        return scopeStack.peek();
    }

    public int getScopeDepth() {
        return scopeStack.size();
    }

    // ========== Variable Registration and Lookup ==========

    public void registerVariable(VariableBinding binding) {
        scopeStack.peek().addVariable(binding);
    }

    /**
     * Declares a local with unknown type in the current frame.
     */
    public void declareVar(String name) {
        declareVarWithType(name, TypeInfo.UNKNOWN);
    }

    public void declareVarWithType(String name, TypeInfo type) {
        registerVariable(VariableBinding.local(name, type, false));
    }

    public void declareParameter(String name, TypeInfo type) {
        registerVariable(VariableBinding.parameter(name, type));
    }

    /**
     * Looks up a name innermost to outermost.
     *
     * @return the binding, or null if the name is not bound in any frame
     */
    public VariableBinding lookupVariable(String name) {
        VariableScope scope = lookupScopeOf(name);
        return scope != null ? scope.getVariable(name) : null;
    }

    /**
     * Returns the innermost frame binding the name, or null.
     */
    public VariableScope lookupScopeOf(String name) {
        if (name == null) {
            return null;
        }
        for (VariableScope scope : scopeStack) {
            if (scope.hasVariable(name)) {
                return scope;
            }
        }
        return null;
    }

    public boolean isDeclared(String name) {
        return lookupScopeOf(name) != null;
    }

    /**
     * Checks frames from the innermost up to and including the nearest function or closure
     * frame. Bindings of enclosing functions do not count.
     */
    public boolean isDeclaredInCurrentFunction(String name) {
        return lookupInCurrentFunction(name) != null;
    }

    public VariableBinding lookupInCurrentFunction(String name) {
        for (VariableScope scope : scopeStack) {
            VariableBinding binding = scope.getVariable(name);
            if (binding != null) {
                return binding;
            }
            if (scope.isFunctionBoundary() || scope.getKind() == ScopeKind.MODULE) {
                break;
            }
        }
        return null;
    }

    /**
     * Replaces a binding in the frame that currently holds it.
     */
    public void updateVariable(VariableBinding binding) {
        VariableScope scope = lookupScopeOf(binding.getName());
        if (scope == null) {
            throw new ConversionException(ConversionException.ErrorKind.SCOPE_VIOLATION,
                    "Cannot update undeclared variable '" + binding.getName() + "'", null, binding.getName());
        }
        scope.addVariable(binding);
    }

    /**
     * Returns the declared type of the innermost binding, or UNKNOWN.
     */
    public TypeInfo getVariableType(String name) {
        VariableBinding binding = lookupVariable(name);
        return binding != null ? binding.getType() : TypeInfo.UNKNOWN;
    }

    public boolean isImportedModule(String name) {
        VariableBinding binding = lookupVariable(name);
        return binding != null && binding.getKind() == BindingKind.IMPORT;
    }

    /**
     * Returns the closure binding visible under this name, or null when the name is not a
     * converted closure.
     */
    public VariableBinding lookupClosure(String name) {
        VariableBinding binding = lookupVariable(name);
        return binding != null && binding.isClosure() ? binding : null;
    }

    // ========== Mutation Tracking ==========

    /**
     * Records an in-place mutation ({@code x += 1}, {@code d[k] = v}, {@code items.append(v)})
     * of the binding visible under the name. An alias only points at its container, so the
     * container's binding is marked instead.
     *
     * @return false if the name is not bound in any frame
     */
    public boolean markMutated(String name) {
        String owner = aliasTable.rootOf(name);
        VariableBinding binding = lookupVariable(owner);
        if (binding == null) {
            return false;
        }
        binding.getDeclaration().markMutable();
        return true;
    }

    // ========== Renames, Aliases, Ids ==========

    public RenameTable getRenameTable() {
        return renameTable;
    }

    public AliasTable getAliasTable() {
        return aliasTable;
    }

    /**
     * Returns the identifier currently emitted for a source name.
     */
    public String resolveName(String name) {
        return renameTable.resolve(name);
    }

    /**
     * Returns the next value of the per-conversion counter used in synthesized identifiers.
     */
    public int nextUniqueId() {
        return uniqueCounter++;
    }

    // ========== Diagnostics ==========

    public void addDiagnostic(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns and clears the diagnostics recorded so far.
     */
    public List<Diagnostic> drainDiagnostics() {
        List<Diagnostic> drained = new ArrayList<>(diagnostics);
        diagnostics.clear();
        return drained;
    }
}
