package me.christianrobert.closureconv.transformer.context;

import me.christianrobert.closureconv.transformer.context.ConversionContext.VariableBinding;
import me.christianrobert.closureconv.transformer.type.SimpleTypeEvaluator;
import me.christianrobert.closureconv.transformer.type.TypeInferenceTable;
import me.christianrobert.closureconv.transformer.type.TypeInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConversionContextTest {

    private ConversionContext context;

    @BeforeEach
    void setUp() {
        context = new ConversionContext(new SimpleTypeEvaluator(TypeInferenceTable.EMPTY));
    }

    // ========== Construction ==========

    @Test
    void nullEvaluatorIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ConversionContext(null));
    }

    @Test
    void startsWithModuleFrameOnly() {
        assertEquals(1, context.getScopeDepth());
        assertEquals(ScopeKind.MODULE, context.currentScope().getKind());
        assertThrows(IllegalStateException.class, () -> context.popScope());
    }

    @Test
    void importedModulesAreBoundAtModuleLevel() {
        Set<String> modules = new LinkedHashSet<>(List.of("math", "json"));
        ConversionContext withImports = new ConversionContext(
                new SimpleTypeEvaluator(null), ConversionOptions.defaults().setImportedModules(modules));

        assertTrue(withImports.isImportedModule("math"));
        assertTrue(withImports.isDeclared("json"));
        assertFalse(withImports.isImportedModule("os"));
    }

    @Test
    void moduleFrameCannotBePushed() {
        ConversionException e = assertThrows(ConversionException.class,
                () -> context.pushScope(ScopeKind.MODULE, "again"));
        assertEquals(ConversionException.ErrorKind.SCOPE_VIOLATION, e.getKind());
    }

    // ========== Lookup ==========

    @Test
    void innerBindingHidesOuterBinding() {
        context.pushScope(ScopeKind.FUNCTION, "outer");
        context.declareVarWithType("x", TypeInfo.INT);
        context.pushScope(ScopeKind.CLOSURE, "inner");
        context.declareVarWithType("x", TypeInfo.STRING);

        assertEquals(TypeInfo.STRING, context.getVariableType("x"));

        context.popScope();
        assertEquals(TypeInfo.INT, context.getVariableType("x"));
    }

    @Test
    void currentFunctionLookupStopsAtFunctionBoundary() {
        context.pushScope(ScopeKind.FUNCTION, "outer");
        context.declareVar("total");
        context.pushScope(ScopeKind.CLOSURE, "inner");
        context.pushScope(ScopeKind.BLOCK, "loop");

        assertTrue(context.isDeclared("total"));
        assertFalse(context.isDeclaredInCurrentFunction("total"));
        assertNull(context.lookupInCurrentFunction("total"));
    }

    @Test
    void blockBindingsBelongToCurrentFunction() {
        context.pushScope(ScopeKind.FUNCTION, "f");
        context.declareVar("acc");
        context.pushScope(ScopeKind.BLOCK, "comprehension");

        assertTrue(context.isDeclaredInCurrentFunction("acc"));
    }

    @Test
    void updateOfUndeclaredVariableFails() {
        ConversionException e = assertThrows(ConversionException.class,
                () -> context.updateVariable(VariableBinding.local("ghost", TypeInfo.INT, false)));
        assertEquals(ConversionException.ErrorKind.SCOPE_VIOLATION, e.getKind());
        assertEquals("ghost", e.getVariableName());
    }

    @Test
    void updateReplacesBindingInItsOwnFrame() {
        context.pushScope(ScopeKind.FUNCTION, "f");
        context.declareVarWithType("items", TypeInfo.LIST);
        context.pushScope(ScopeKind.BLOCK, "if");

        context.updateVariable(context.lookupVariable("items").withType(TypeInfo.TUPLE));

        assertFalse(context.currentScope().hasVariable("items"));
        assertEquals(TypeInfo.TUPLE, context.getVariableType("items"));
    }

    @Test
    void lookupClosureOnlyReturnsClosureBindings() {
        context.pushScope(ScopeKind.FUNCTION, "f");
        context.registerVariable(VariableBinding.closure("adder", "__closure_adder_0", false));
        context.declareVar("plain");

        assertEquals("__closure_adder_0", context.lookupClosure("adder").getWrapperId());
        assertNull(context.lookupClosure("plain"));
        assertNull(context.lookupClosure("missing"));
    }

    // ========== Scoped renames ==========

    @Test
    void popScopeDropsRenamesAndAliasesOfTheFrame() {
        context.pushScope(ScopeKind.FUNCTION, "f");
        context.getRenameTable().put("n", "__p_n_0");
        context.getAliasTable().put("view", "items");

        context.popScope();

        assertEquals("n", context.resolveName("n"));
        assertFalse(context.getAliasTable().isAlias("view"));
    }

    // ========== Mutation tracking ==========

    @Test
    void declaredLocalStartsImmutable() {
        context.pushScope(ScopeKind.FUNCTION, "f");
        context.declareVar("count");

        assertFalse(context.lookupVariable("count").isMutable());
        assertEquals("const", context.lookupVariable("count").getDeclaration().keyword());
    }

    @Test
    void markMutatedMarksVisibleBinding() {
        context.pushScope(ScopeKind.FUNCTION, "f");
        context.declareVarWithType("count", TypeInfo.INT);
        context.pushScope(ScopeKind.BLOCK, "loop");

        assertTrue(context.markMutated("count"));

        assertTrue(context.lookupVariable("count").isMutable());
        assertEquals("var", context.lookupVariable("count").getDeclaration().keyword());
    }

    @Test
    void markMutatedThroughAliasMarksContainerOnly() {
        context.pushScope(ScopeKind.FUNCTION, "f");
        context.declareVarWithType("items", TypeInfo.LIST);
        context.registerVariable(VariableBinding.alias("view", "items", TypeInfo.LIST, false));
        context.getAliasTable().put("view", "items");

        context.markMutated("view");

        assertTrue(context.lookupVariable("items").isMutable());
        assertFalse(context.lookupVariable("view").isMutable());
    }

    @Test
    void markMutatedOfUnboundNameIsIgnored() {
        assertFalse(context.markMutated("nowhere"));
    }

    @Test
    void typeChangeKeepsDeclaration() {
        VariableBinding binding = VariableBinding.local("total", TypeInfo.INT, false);

        VariableBinding retyped = binding.withType(TypeInfo.FLOAT);
        retyped.getDeclaration().markMutable();

        assertTrue(binding.isMutable());
    }

    // ========== Ids and diagnostics ==========

    @Test
    void uniqueIdsAreSequential() {
        assertEquals(0, context.nextUniqueId());
        assertEquals(1, context.nextUniqueId());
        assertEquals(2, context.nextUniqueId());
    }

    @Test
    void drainReturnsAndClearsDiagnostics() {
        context.addDiagnostic(Diagnostic.nameCollision("helper", "collides"));

        List<Diagnostic> drained = context.drainDiagnostics();

        assertEquals(1, drained.size());
        assertEquals(Diagnostic.Severity.INFO, drained.get(0).getSeverity());
        assertTrue(context.getDiagnostics().isEmpty());
    }
}
