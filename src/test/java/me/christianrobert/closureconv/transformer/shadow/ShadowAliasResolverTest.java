package me.christianrobert.closureconv.transformer.shadow;

import me.christianrobert.closureconv.transformer.ast.FunctionFragment;
import me.christianrobert.closureconv.transformer.builder.NativeCodeBuilder;
import me.christianrobert.closureconv.transformer.context.ConversionContext;
import me.christianrobert.closureconv.transformer.context.ConversionContext.VariableBinding;
import me.christianrobert.closureconv.transformer.context.Declaration;
import me.christianrobert.closureconv.transformer.context.ScopeKind;
import me.christianrobert.closureconv.transformer.type.SimpleTypeEvaluator;
import me.christianrobert.closureconv.transformer.type.TypeInferenceTable;
import me.christianrobert.closureconv.transformer.type.TypeInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static me.christianrobert.closureconv.transformer.ast.AstFactory.*;
import static org.junit.jupiter.api.Assertions.*;

class ShadowAliasResolverTest {

    private ShadowAliasResolver resolver;
    private ConversionContext context;

    @BeforeEach
    void setUp() {
        resolver = new ShadowAliasResolver();
        context = new ConversionContext(new SimpleTypeEvaluator(TypeInferenceTable.EMPTY));
        context.pushScope(ScopeKind.FUNCTION, "f");
    }

    // ========== Decisions ==========

    @Test
    void unboundNameIsFresh() {
        ShadowDecision decision = resolver.resolveShadowOrReuse("total", TypeInfo.INT, context);

        assertEquals(ShadowDecision.Kind.FRESH, decision.getKind());
        assertEquals("total", decision.getIdentifier());
        assertTrue(decision.declares());
    }

    @Test
    void compatibleRebindingIsReused() {
        context.declareVarWithType("total", TypeInfo.INT);

        ShadowDecision decision = resolver.resolveShadowOrReuse("total", TypeInfo.INT, context);

        assertEquals(ShadowDecision.Kind.REUSE, decision.getKind());
        assertEquals("total", decision.getIdentifier());
        assertFalse(decision.declares());
    }

    @Test
    void unknownValueKeepsExistingType() {
        context.declareVarWithType("total", TypeInfo.FLOAT);

        ShadowDecision decision = resolver.resolveShadowOrReuse("total", TypeInfo.UNKNOWN, context);

        assertEquals(ShadowDecision.Kind.REUSE, decision.getKind());
        assertEquals(TypeInfo.FLOAT, decision.getType());
    }

    @Test
    void primitiveToClassInstanceShadows() {
        context.declareVarWithType("total", TypeInfo.INT);

        ShadowDecision decision = resolver.resolveShadowOrReuse("total", TypeInfo.classInstance("Record"), context);

        assertEquals(ShadowDecision.Kind.SHADOW_RENAME, decision.getKind());
        assertEquals("total__0", decision.getIdentifier());
        assertTrue(decision.declares());
    }

    @Test
    void sequenceToHashedContainerShadows() {
        context.declareVarWithType("items", TypeInfo.LIST);

        ShadowDecision decision = resolver.resolveShadowOrReuse("items", TypeInfo.DICT, context);

        assertEquals(ShadowDecision.Kind.SHADOW_RENAME, decision.getKind());
    }

    @Test
    void reassigningConvertedClosureShadows() {
        context.registerVariable(VariableBinding.closure("helper", "helper", false));

        ShadowDecision decision = resolver.resolveShadowOrReuse("helper", TypeInfo.INT, context);

        assertEquals(ShadowDecision.Kind.SHADOW_RENAME, decision.getKind());
    }

    @Test
    void bindingOfEnclosingFunctionDoesNotCount() {
        context.declareVarWithType("x", TypeInfo.INT);
        context.pushScope(ScopeKind.CLOSURE, "closure:g");

        ShadowDecision decision = resolver.resolveShadowOrReuse("x", TypeInfo.classInstance("Node"), context);

        assertEquals(ShadowDecision.Kind.FRESH, decision.getKind());
    }

    @Test
    void decidingDoesNotChangeContext() {
        context.declareVarWithType("total", TypeInfo.INT);

        resolver.resolveShadowOrReuse("total", TypeInfo.classInstance("Record"), context);

        assertEquals("total", context.resolveName("total"));
        assertEquals(TypeInfo.INT, context.getVariableType("total"));
    }

    // ========== Commit ==========

    @Test
    void committedShadowRenamesFollowingReads() {
        context.declareVarWithType("total", TypeInfo.INT);
        ShadowDecision decision = resolver.resolveShadowOrReuse("total", TypeInfo.classInstance("Record"), context);

        resolver.commit(decision, context);

        assertEquals("total__0", context.resolveName("total"));
        assertEquals(TypeInfo.classInstance("Record"), context.getVariableType("total"));
    }

    @Test
    void committedReuseMakesDeclarationMutable() {
        resolver.commit(resolver.resolveShadowOrReuse("total", TypeInfo.INT, context), context);
        Declaration declaration = context.lookupVariable("total").getDeclaration();
        assertFalse(declaration.isMutable());

        resolver.commit(resolver.resolveShadowOrReuse("total", TypeInfo.INT, context), context);

        assertTrue(declaration.isMutable());
        assertSame(declaration, context.lookupVariable("total").getDeclaration());
    }

    @Test
    void committedShadowStartsImmutableDeclaration() {
        resolver.commit(resolver.resolveShadowOrReuse("total", TypeInfo.INT, context), context);
        Declaration original = context.lookupVariable("total").getDeclaration();

        resolver.commit(resolver.resolveShadowOrReuse("total", TypeInfo.classInstance("Record"), context), context);

        Declaration shadow = context.lookupVariable("total").getDeclaration();
        assertNotSame(original, shadow);
        assertFalse(original.isMutable());
        assertFalse(shadow.isMutable());
    }

    @Test
    void freshLocalHidesOuterRename() {
        context.getRenameTable().put("x", "__p_x_3");
        context.pushScope(ScopeKind.CLOSURE, "closure:g");

        resolver.commit(resolver.resolveShadowOrReuse("x", TypeInfo.INT, context), context);
        assertEquals("x", context.resolveName("x"));

        context.popScope();
        assertEquals("__p_x_3", context.resolveName("x"));
    }

    // ========== Aliases ==========

    @Test
    void aliasAssignmentRecordsOwner() {
        context.declareVarWithType("items", TypeInfo.LIST);

        ShadowDecision decision = resolver.resolveShadowOrReuse("view", TypeInfo.LIST, "items", context);
        resolver.commit(decision, context);

        assertTrue(decision.isAlias());
        assertEquals("items", context.getAliasTable().getTarget("view"));
        assertTrue(context.lookupVariable("view").isAlias());
    }

    @Test
    void retargetedAliasIsReused() {
        context.declareVarWithType("items", TypeInfo.LIST);
        context.declareVarWithType("other", TypeInfo.LIST);
        resolver.commit(resolver.resolveShadowOrReuse("view", TypeInfo.LIST, "items", context), context);

        ShadowDecision decision = resolver.resolveShadowOrReuse("view", TypeInfo.LIST, "other", context);
        resolver.commit(decision, context);

        assertEquals(ShadowDecision.Kind.REUSE, decision.getKind());
        assertEquals("other", context.getAliasTable().getTarget("view"));
        assertEquals("other", context.lookupVariable("view").getAliasTarget());
    }

    @Test
    void plainValueOverAliasShadowsAndDropsAlias() {
        context.declareVarWithType("items", TypeInfo.LIST);
        resolver.commit(resolver.resolveShadowOrReuse("view", TypeInfo.LIST, "items", context), context);

        ShadowDecision decision = resolver.resolveShadowOrReuse("view", TypeInfo.LIST, context);
        resolver.commit(decision, context);

        assertEquals(ShadowDecision.Kind.SHADOW_RENAME, decision.getKind());
        assertFalse(context.getAliasTable().isAlias("view"));
        assertFalse(context.lookupVariable("view").isAlias());
    }

    // ========== Compatibility ==========

    @Test
    void incompatibleTypes() {
        assertTrue(resolver.isIncompatible(TypeInfo.LIST, TypeInfo.SET));
        assertTrue(resolver.isIncompatible(TypeInfo.DICT, TypeInfo.TUPLE));
        assertTrue(resolver.isIncompatible(TypeInfo.classInstance("A"), TypeInfo.classInstance("B")));
        assertTrue(resolver.isIncompatible(TypeInfo.classInstance("A"), TypeInfo.STRING));
    }

    @Test
    void compatibleTypes() {
        assertFalse(resolver.isIncompatible(TypeInfo.INT, TypeInfo.FLOAT));
        assertFalse(resolver.isIncompatible(TypeInfo.LIST, TypeInfo.TUPLE));
        assertFalse(resolver.isIncompatible(TypeInfo.classInstance("A"), TypeInfo.classInstance("A")));
        assertFalse(resolver.isIncompatible(TypeInfo.UNKNOWN, TypeInfo.classInstance("A")));
    }

    // ========== End to end ==========

    @Test
    void shadowedRecordReadsPreviousBinding() {
        // def f(): total = 0; total = Record(total); return total
        TypeInferenceTable table = TypeInferenceTable.builder()
                .className("Record")
                .returnType("f", TypeInfo.classInstance("Record"))
                .build();
        ConversionContext fresh = new ConversionContext(new SimpleTypeEvaluator(table));
        FunctionFragment f = def("f", params(),
                assign("total", intConst(0)),
                assign("total", call("Record", name("total"))),
                ret(name("total")));

        String code = new NativeCodeBuilder(fresh).buildFunction(f);

        assertEquals("pub fn f() !*Record {\n"
                + "    const total = 0;\n"
                + "    const total__1 = Record.init(total);\n"
                + "    return total__1;\n"
                + "}\n", code);
        assertFalse(code.contains("var total"));
    }

    @Test
    void reuseMakesOnlyThatDeclarationMutable() {
        // def g(): count = 0; count = count + 1; return count
        ConversionContext fresh = new ConversionContext(new SimpleTypeEvaluator(
                TypeInferenceTable.builder().returnType("g", TypeInfo.INT).build()));
        FunctionFragment g = def("g", params(),
                assign("count", intConst(0)),
                assign("count", binOp(name("count"), "+", intConst(1))),
                ret(name("count")));

        String code = new NativeCodeBuilder(fresh).buildFunction(g);

        assertEquals("pub fn g() i64 {\n"
                + "    var count = 0;\n"
                + "    count = (count + 1);\n"
                + "    return count;\n"
                + "}\n", code);
    }

    @Test
    void mutationAfterShadowMarksOnlyTheNewBinding() {
        // def f(): total = 0; total = Record(total); total.count = 1; return total
        TypeInferenceTable table = TypeInferenceTable.builder()
                .className("Record")
                .returnType("f", TypeInfo.classInstance("Record"))
                .build();
        ConversionContext fresh = new ConversionContext(new SimpleTypeEvaluator(table));
        FunctionFragment f = def("f", params(),
                assign("total", intConst(0)),
                assign("total", call("Record", name("total"))),
                assign(attr(name("total"), "count"), intConst(1)),
                ret(name("total")));

        String code = new NativeCodeBuilder(fresh).buildFunction(f);

        assertTrue(code.contains("    const total = 0;\n"), code);
        assertTrue(code.contains("    var total__1 = Record.init(total);\n"), code);
        assertTrue(code.contains("    total__1.count = 1;\n"), code);
    }
}
