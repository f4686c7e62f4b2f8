package me.christianrobert.closureconv.transformer.closure;

import me.christianrobert.closureconv.transformer.ast.FunctionFragment;
import me.christianrobert.closureconv.transformer.ast.Parameter;
import me.christianrobert.closureconv.transformer.builder.NativeCodeBuilder;
import me.christianrobert.closureconv.transformer.context.ConversionContext;
import me.christianrobert.closureconv.transformer.context.ConversionContext.VariableBinding;
import me.christianrobert.closureconv.transformer.context.ConversionException;
import me.christianrobert.closureconv.transformer.context.ConversionOptions;
import me.christianrobert.closureconv.transformer.context.Diagnostic;
import me.christianrobert.closureconv.transformer.context.ScopeKind;
import me.christianrobert.closureconv.transformer.shadow.ShadowAliasResolver;
import me.christianrobert.closureconv.transformer.type.SimpleTypeEvaluator;
import me.christianrobert.closureconv.transformer.type.TypeInferenceTable;
import me.christianrobert.closureconv.transformer.type.TypeInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;

import static me.christianrobert.closureconv.transformer.ast.AstFactory.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ClosureSynthesizer: one test per closure shape plus the signature rules
 * (placeholders, private copies, return types) and scoping of renames.
 */
class ClosureSynthesizerTest {

    private ClosureSynthesizer synthesizer;
    private ConversionContext context;
    private NativeCodeBuilder builder;

    @BeforeEach
    void setUp() {
        TypeInferenceTable table = TypeInferenceTable.builder()
                .returnType("square", TypeInfo.INT)
                .returnType("add", TypeInfo.INT)
                .returnType("fact", TypeInfo.INT)
                .returnType("countdown", TypeInfo.INT)
                .returnType("pick", TypeInfo.INT)
                .returnType("bump", TypeInfo.INT)
                .returnType("helper", TypeInfo.INT)
                .returnType("maybe", TypeInfo.INT)
                .returnType("f", TypeInfo.INT)
                .returnType("g", TypeInfo.INT)
                .build();
        setUpContext(table, ConversionOptions.defaults());
    }

    private void setUpContext(TypeInferenceTable table, ConversionOptions options) {
        synthesizer = new ClosureSynthesizer();
        context = new ConversionContext(new SimpleTypeEvaluator(table), options);
        builder = new NativeCodeBuilder(context, synthesizer, new ShadowAliasResolver());
        context.pushScope(ScopeKind.FUNCTION, "outer");
    }

    private static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    // ========== ZERO_CAPTURE ==========

    @Test
    void zeroCaptureEmitsImplementationAndWrapper() {
        // def square(x): return x * x
        FunctionFragment square = def("square", params("x"), ret(binOp(name("x"), "*", name("x"))));

        SynthesizedClosure closure = synthesizer.synthesize(square, context, builder);

        assertEquals(ClosureShape.ZERO_CAPTURE, closure.getShape());
        assertEquals(lines(
                "const __ZeroImpl_square_0 = struct {",
                "    fn __fn_square_0(__p_x_0: i64) i64 {",
                "        return (__p_x_0 * __p_x_0);",
                "    }",
                "};",
                "const square = struct {",
                "    pub fn call(_: @This(), __p_x_0: i64) i64 {",
                "        return __ZeroImpl_square_0.__fn_square_0(__p_x_0);",
                "    }",
                "}{};"), closure.getCode());
    }

    @Test
    void closureIsRegisteredInEnclosingScope() {
        FunctionFragment square = def("square", params("x"), ret(binOp(name("x"), "*", name("x"))));

        SynthesizedClosure closure = synthesizer.synthesize(square, context, builder);

        assertEquals("square", closure.getRenameDelta().get("square"));
        assertEquals("square", context.lookupClosure("square").getWrapperId());
        assertEquals(2, context.getScopeDepth(), "closure frame must be popped again");
        assertEquals("x", context.resolveName("x"), "parameter rename must not leak");
    }

    // ========== STRUCT_CAPTURE ==========

    @Test
    void structCaptureCopiesCapturedValuesIntoEnvironment() {
        // def add(x): return x + base, inside make_adder(base)
        context.declareParameter("base", TypeInfo.INT);
        FunctionFragment add = def("add", params("x"), ret(binOp(name("x"), "+", name("base"))));

        SynthesizedClosure closure = synthesizer.synthesize(add, context, builder);

        assertEquals(ClosureShape.STRUCT_CAPTURE, closure.getShape());
        assertEquals(lines(
                "const __CaptureType_add_0 = struct {",
                "    base: i64,",
                "};",
                "const __ClosureImpl_add_0 = struct {",
                "    fn call_add_0(__cap_add_0: __CaptureType_add_0, __p_x_0: i64) i64 {",
                "        return (__p_x_0 + __cap_add_0.base);",
                "    }",
                "};",
                "const __closure_add_0 = runtime.Closure1(__CaptureType_add_0, i64, i64, __ClosureImpl_add_0.call_add_0){ .captures = .{ .base = base } };",
                "const add = __closure_add_0;"), closure.getCode());
    }

    @Test
    void captureOfUnknownTypeUsesTypeOfInitializer() {
        context.declareVar("count");
        FunctionFragment add = def("add", params("x"), ret(binOp(name("count"), "+", name("x"))));

        SynthesizedClosure closure = synthesizer.synthesize(add, context, builder);

        assertTrue(closure.getCode().contains("    count: @TypeOf(count),\n"));
    }

    @Test
    void capturedAliasIsBorrowedByPointer() {
        context.declareVarWithType("items", TypeInfo.LIST);
        context.registerVariable(VariableBinding.alias("view", "items", TypeInfo.LIST, false));
        FunctionFragment add = def("add", params(), ret(call("len", name("view"))));

        SynthesizedClosure closure = synthesizer.synthesize(add, context, builder);

        assertTrue(closure.getCode().contains("    view: *runtime.PyList,\n"));
        assertEquals(1, closure.getBorrowedCaptures().size());
    }

    // ========== RECURSIVE_SELF_CAPTURE ==========

    @Test
    void recursiveClosureCallsItselfThroughSelfHandle() {
        // def fact(n): return 1 if n <= 1 else n * fact(n - 1)
        FunctionFragment fact = def("fact", params("n"),
                ret(ifExpr(compare(name("n"), "<=", intConst(1)),
                        intConst(1),
                        binOp(name("n"), "*", call("fact", binOp(name("n"), "-", intConst(1)))))));

        SynthesizedClosure closure = synthesizer.synthesize(fact, context, builder);

        assertEquals(ClosureShape.RECURSIVE_SELF_CAPTURE, closure.getShape());
        assertTrue(closure.isFallible());
        assertEquals(lines(
                "const fact = struct {",
                "    pub fn call(__p_n_0: i64) !i64 {",
                "        return (if ((__p_n_0 <= 1)) 1 else (__p_n_0 * try call((__p_n_0 - 1))));",
                "    }",
                "};"), closure.getCode());
    }

    @Test
    void recursiveClosureKeepsCapturesInPersistentFields() {
        // def countdown(n): if n <= 0: return 0; return countdown(n - step)
        context.declareVarWithType("step", TypeInfo.INT);
        FunctionFragment countdown = def("countdown", params("n"),
                ifStmt(compare(name("n"), "<=", intConst(0)), block(ret(intConst(0))), block()),
                ret(call("countdown", binOp(name("n"), "-", name("step")))));

        SynthesizedClosure closure = synthesizer.synthesize(countdown, context, builder);

        assertEquals(lines(
                "const countdown = struct {",
                "    var __c_step: i64 = undefined;",
                "    pub fn call(__p_n_0: i64) !i64 {",
                "        if ((__p_n_0 <= 0)) {",
                "            return 0;",
                "        }",
                "        return try call((__p_n_0 - __c_step));",
                "    }",
                "};",
                "countdown.__c_step = step;"), closure.getCode());
    }

    @Test
    void nestedFunctionCallsEnclosingRecursiveClosureThroughItsAggregate() {
        // def fact(n):
        //     def helper(k): return fact(k)
        //     return 1 if n <= 1 else n * helper(n - 1)
        FunctionFragment fact = def("fact", params("n"),
                defStmt(def("helper", params("k"), ret(call("fact", name("k"))))),
                ret(ifExpr(compare(name("n"), "<=", intConst(1)),
                        intConst(1),
                        binOp(name("n"), "*", call("helper", binOp(name("n"), "-", intConst(1)))))));

        SynthesizedClosure closure = synthesizer.synthesize(fact, context, builder);
        String code = closure.getCode();

        assertEquals(ClosureShape.RECURSIVE_SELF_CAPTURE, closure.getShape());
        assertFalse(code.contains(".fact.call("), code);
        assertFalse(code.contains(".fact = call"), code);
        assertFalse(code.contains("__CaptureType_helper"), code);
        assertTrue(code.contains("return try fact.call(__p_k_"), code);
        assertTrue(code.contains("(__p_n_0 * try helper.call((__p_n_0 - 1)))"), code);
    }

    @Test
    void selfHandleIsNotVisibleAfterTheClosure() {
        synthesizer.synthesize(def("fact", params("n"),
                ret(call("fact", name("n")))), context, builder);

        VariableBinding binding = context.lookupVariable("fact");
        assertNotNull(binding);
        assertFalse(binding.isSelfHandle());
        assertEquals("fact", context.resolveName("fact"));
    }

    // ========== Parameters ==========

    @Test
    void unusedParametersBecomePlaceholders() {
        // def pick(a, b, c): return c
        SynthesizedClosure closure = synthesizer.synthesize(
                def("pick", params("a", "b", "c"), ret(name("c"))), context, builder);

        assertTrue(closure.getCode().contains("fn __fn_pick_0(_: i64, _: i64, __p_c_0: i64) i64 {"));
        assertTrue(closure.getCode().contains("pub fn call(_: @This(), __p_a_0: i64, __p_b_0: i64, __p_c_0: i64) i64 {"));
        assertTrue(closure.getCode().contains("return __ZeroImpl_pick_0.__fn_pick_0(__p_a_0, __p_b_0, __p_c_0);"));
    }

    @Test
    void reassignedParameterGetsPrivateCopy() {
        // def bump(n): n += 1; return n
        SynthesizedClosure closure = synthesizer.synthesize(
                def("bump", params("n"), augAssign("n", "+", intConst(1)), ret(name("n"))), context, builder);

        assertTrue(closure.getCode().contains(lines(
                "    fn __fn_bump_0(__p_n_0: i64) i64 {",
                "        var __v_n_0 = __p_n_0;",
                "        __v_n_0 += 1;",
                "        return __v_n_0;",
                "    }")));
    }

    @Test
    void declaredParameterTypeIsUsed() {
        FunctionFragment square = new FunctionFragment("square",
                Arrays.asList(new Parameter("x", TypeInfo.FLOAT)),
                block(ret(binOp(name("x"), "*", name("x")))));

        SynthesizedClosure closure = synthesizer.synthesize(square, context, builder);

        assertTrue(closure.getCode().contains("fn __fn_square_0(__p_x_0: f64) i64 {"));
    }

    // ========== Return types ==========

    @Test
    void missingReturnOnSomePathGetsDefaultReturn() {
        // def maybe(x): if x: return 1
        SynthesizedClosure closure = synthesizer.synthesize(
                def("maybe", params("x"), ifStmt(name("x"), block(ret(intConst(1))), block())), context, builder);

        assertTrue(closure.getCode().contains(lines(
                "        if (__p_x_0) {",
                "            return 1;",
                "        }",
                "        return 0;",
                "    }")));
    }

    @Test
    void bodyWithoutValuedReturnIsVoid() {
        // def report(x): print(x)
        SynthesizedClosure closure = synthesizer.synthesize(
                def("report", params("x"), expr(call("print", name("x")))), context, builder);

        assertTrue(closure.getCode().contains("fn __fn_report_0(__p_x_0: i64) !void {"));
        assertTrue(closure.getCode().contains("        runtime.print(__p_x_0);\n    }"));
        assertTrue(context.getDiagnostics().isEmpty());
    }

    @Test
    void unknownReturnTypeIsExplicitAndReported() {
        SynthesizedClosure closure = synthesizer.synthesize(
                def("mystery", params("x"), ret(name("x"))), context, builder);

        assertTrue(closure.getCode().contains("fn __fn_mystery_0(__p_x_0: i64) runtime.Unknown {"));
        List<Diagnostic> diagnostics = context.getDiagnostics();
        assertEquals(1, diagnostics.size());
        assertEquals(Diagnostic.Kind.ANALYSIS_LIMITATION, diagnostics.get(0).getKind());
        assertEquals(Diagnostic.Severity.WARNING, diagnostics.get(0).getSeverity());
        assertEquals("mystery", diagnostics.get(0).getFunctionName());
    }

    @Test
    void placeholderPolicyEmitsConfiguredType() {
        setUpContext(TypeInferenceTable.EMPTY, ConversionOptions.defaults()
                .setUnknownReturnPolicy(ConversionOptions.UnknownReturnPolicy.PLACEHOLDER)
                .setPlaceholderType("i32"));

        SynthesizedClosure closure = synthesizer.synthesize(
                def("mystery", params("x"), ret(name("x"))), context, builder);

        assertTrue(closure.getCode().contains("fn __fn_mystery_0(__p_x_0: i64) i32 {"));
        assertEquals(1, context.getDiagnostics().size());
    }

    // ========== Name collisions ==========

    @Test
    void visibleNameCollisionIsDisambiguated() {
        context.declareVar("helper");

        SynthesizedClosure closure = synthesizer.synthesize(
                def("helper", params(), ret(intConst(1))), context, builder);

        assertEquals("__local_helper_0", closure.getWrapperId());
        assertTrue(closure.getCode().contains("const __local_helper_0 = struct {"));
        assertEquals("__local_helper_0", context.resolveName("helper"));

        Diagnostic diagnostic = context.getDiagnostics().get(0);
        assertEquals(Diagnostic.Kind.NAME_COLLISION, diagnostic.getKind());
        assertEquals(Diagnostic.Severity.INFO, diagnostic.getSeverity());
    }

    @Test
    void importedModuleNameCollides() {
        setUpContext(TypeInferenceTable.EMPTY, ConversionOptions.defaults()
                .setImportedModules(new LinkedHashSet<>(List.of("json"))));

        SynthesizedClosure closure = synthesizer.synthesize(def("json", params(), ret(intConst(1))), context, builder);

        assertEquals("__local_json_0", closure.getWrapperId());
        assertTrue(context.getDiagnostics().get(0).getMessage().contains("imported module"));
    }

    // ========== Scoping ==========

    @Test
    void renamesDoNotLeakToSiblingClosures() {
        synthesizer.synthesize(def("f", params("x"), ret(name("x"))), context, builder);
        SynthesizedClosure g = synthesizer.synthesize(def("g", params("y"), ret(name("x"))), context, builder);

        assertTrue(g.getCode().contains("fn __fn_g_1(_: i64) i64 {"));
        assertTrue(g.getCode().contains("        return x;\n"));
        assertFalse(g.getCode().contains("__p_x_0"));
    }

    @Test
    void unsupportedCaptureLeavesScopeStackIntact() {
        context.declareVarWithType("node", TypeInfo.union(Arrays.asList(TypeInfo.INT, TypeInfo.classInstance("Node"))));

        assertThrows(ConversionException.class,
                () -> synthesizer.synthesize(def("visit", params(), ret(name("node"))), context, builder));

        assertEquals(2, context.getScopeDepth());
        assertNull(context.lookupClosure("visit"));
    }

    @Test
    void nullFragmentIsRejected() {
        ConversionException e = assertThrows(ConversionException.class,
                () -> synthesizer.synthesize(null, context, builder));
        assertEquals(ConversionException.ErrorKind.INVALID_FRAGMENT, e.getKind());
    }
}
