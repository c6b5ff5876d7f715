package dev.kestrel.analysis;

import static dev.kestrel.Ast.bin;
import static dev.kestrel.Ast.block;
import static dev.kestrel.Ast.borrow;
import static dev.kestrel.Ast.borrowMut;
import static dev.kestrel.Ast.brk;
import static dev.kestrel.Ast.call;
import static dev.kestrel.Ast.decl;
import static dev.kestrel.Ast.declare;
import static dev.kestrel.Ast.disown;
import static dev.kestrel.Ast.expr;
import static dev.kestrel.Ast.fn;
import static dev.kestrel.Ast.forRange;
import static dev.kestrel.Ast.ifElse;
import static dev.kestrel.Ast.ifThen;
import static dev.kestrel.Ast.lambda;
import static dev.kestrel.Ast.let;
import static dev.kestrel.Ast.letMut;
import static dev.kestrel.Ast.lit;
import static dev.kestrel.Ast.loop;
import static dev.kestrel.Ast.pos;
import static dev.kestrel.Ast.program;
import static dev.kestrel.Ast.record;
import static dev.kestrel.Ast.ret;
import static dev.kestrel.Ast.scope;
import static dev.kestrel.Ast.set;
import static dev.kestrel.Ast.var;
import static dev.kestrel.Ast.whileLoop;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.kestrel.ast.BinaryOp;
import dev.kestrel.ast.Expr;
import dev.kestrel.ast.ParamMode;
import dev.kestrel.ast.Program;
import dev.kestrel.ast.Stmt;
import java.util.List;
import org.junit.jupiter.api.Test;

class StaticAnalyzerTest {
    /** Wraps the statements in a function so that their bindings are locals. */
    private static Program inFunction(Stmt... body) {
        return program(decl(fn("f", List.of("c"), body)));
    }

    private static Stmt consumeDecl() {
        return decl(fn("consume", List.of("v"), ret(lit(0))));
    }

    private static AnalysisException rejected(Program p) {
        return assertThrows(AnalysisException.class, () -> StaticAnalyzer.analyze(p));
    }

    private static void assertRejectedWith(AnalysisErrorKind kind, Program p) {
        AnalysisException e = rejected(p);
        assertTrue(e.has(kind), () -> "expected " + kind + " in " + e.errors());
    }

    @Test
    void acceptsWellFormedProgram() throws Exception {
        CheckedProgram checked =
                StaticAnalyzer.analyze(
                        program(
                                decl(fn("add", List.of("a", "b"), ret(bin(BinaryOp.ADD, var("a"), var("b"))))),
                                let("x", call("add", lit(1), lit(2)))));
        assertEquals(2, checked.globals().size());
        assertEquals("<main>", checked.entry().name());
        assertEquals(1, checked.hoistedFunctions().size());
    }

    @Test
    void duplicateBindingInOneScope() {
        assertRejectedWith(AnalysisErrorKind.DUPLICATE_BINDING, inFunction(let("x", lit(1)), let("x", lit(2))));
        assertRejectedWith(AnalysisErrorKind.DUPLICATE_BINDING, program(let("g", lit(1)), let("g", lit(2))));
    }

    @Test
    void shadowingInNestedScopeIsAllowed() throws Exception {
        StaticAnalyzer.analyze(inFunction(let("x", lit(1)), scope(let("x", lit(2)), ret(var("x")))));
    }

    @Test
    void parameterRedeclaredInBody() {
        Program p =
                program(
                        decl(
                                fn(
                                        "add",
                                        List.of("x", "y"),
                                        let("x", lit(1)),
                                        ret(bin(BinaryOp.ADD, var("x"), var("y"))))));
        AnalysisException e = rejected(p);
        assertTrue(e.has(AnalysisErrorKind.DUPLICATE_BINDING));
        assertEquals("x", e.errors().get(0).name());
    }

    @Test
    void readOfBindingUninitializedOnOnePath() {
        Program p = inFunction(declare("x"), ifThen(var("c"), set("x", lit(1))), ret(var("x")));
        AnalysisException e = rejected(p);
        assertTrue(e.has(AnalysisErrorKind.USE_OF_UNINITIALIZED));
        assertEquals("x", e.errors().get(0).name());
    }

    @Test
    void bindingInitializedOnEveryPath() throws Exception {
        StaticAnalyzer.analyze(
                inFunction(
                        declare("x"),
                        ifElse(var("c"), block(set("x", lit(1))), block(set("x", lit(2)))),
                        ret(var("x"))));
    }

    @Test
    void loopBodyMayNotRun() {
        Program p =
                inFunction(
                        new Stmt.Let("x", true, null, pos()),
                        whileLoop(var("c"), set("x", lit(1))),
                        ret(var("x")));
        assertRejectedWith(AnalysisErrorKind.USE_OF_UNINITIALIZED, p);
    }

    @Test
    void foreverLoopExitsOnlyThroughBreak() throws Exception {
        StaticAnalyzer.analyze(
                inFunction(
                        new Stmt.Let("x", true, null, pos()),
                        loop(set("x", lit(1)), brk()),
                        ret(var("x"))));
    }

    @Test
    void moveIntoOwnedParameter() {
        Program p =
                program(
                        consumeDecl(),
                        decl(fn("f", List.of(), let("a", record("k", lit(1))), expr(call("consume", var("a"))), ret(var("a")))));
        AnalysisException e = rejected(p);
        assertTrue(e.has(AnalysisErrorKind.USE_AFTER_MOVE));
    }

    @Test
    void reassignmentAfterMoveRestoresBinding() throws Exception {
        StaticAnalyzer.analyze(
                program(
                        consumeDecl(),
                        decl(
                                fn(
                                        "f",
                                        List.of(),
                                        letMut("a", record("k", lit(1))),
                                        expr(call("consume", var("a"))),
                                        set("a", record("k", lit(2))),
                                        ret(var("a"))))));
    }

    @Test
    void sharedParameterDoesNotMove() throws Exception {
        StaticAnalyzer.analyze(
                program(
                        decl(fn("peek", List.of(ParamMode.SHARED), List.of("v"), ret(lit(0)))),
                        decl(
                                fn(
                                        "f",
                                        List.of(),
                                        let("a", record("k", lit(1))),
                                        expr(call("peek", var("a"))),
                                        ret(var("a"))))));
    }

    @Test
    void movedOnOneBranchIsMovedAfterJoin() {
        Program p =
                program(
                        consumeDecl(),
                        decl(
                                fn(
                                        "f",
                                        List.of("c"),
                                        let("a", record("k", lit(1))),
                                        ifThen(var("c"), expr(call("consume", var("a")))),
                                        ret(var("a")))));
        assertRejectedWith(AnalysisErrorKind.USE_AFTER_MOVE, p);
    }

    @Test
    void disownedBindingCannotBeRead() {
        assertRejectedWith(
                AnalysisErrorKind.USE_AFTER_MOVE, inFunction(let("a", record()), disown("a"), ret(var("a"))));
    }

    @Test
    void movingSameBindingTwiceInOneCall() {
        Program p =
                program(
                        decl(fn("pair", List.of("x", "y"), ret(lit(0)))),
                        decl(fn("f", List.of(), let("a", record()), expr(call("pair", var("a"), var("a"))))));
        assertRejectedWith(AnalysisErrorKind.USE_AFTER_MOVE, p);
    }

    @Test
    void conflictingBorrowsInOneCallRegardlessOfOrder() {
        Stmt touch =
                decl(
                        fn(
                                "touch",
                                List.of(ParamMode.EXCLUSIVE, ParamMode.SHARED),
                                List.of("p", "q"),
                                ret(lit(0))));
        Program exclusiveFirst =
                program(
                        touch,
                        decl(fn("f", List.of(), letMut("v", record()), expr(call("touch", borrowMut("v"), borrow("v"))))));
        Program sharedFirst =
                program(
                        decl(
                                fn(
                                        "touch",
                                        List.of(ParamMode.SHARED, ParamMode.EXCLUSIVE),
                                        List.of("q", "p"),
                                        ret(lit(0)))),
                        decl(fn("f", List.of(), letMut("v", record()), expr(call("touch", borrow("v"), borrowMut("v"))))));
        assertRejectedWith(AnalysisErrorKind.CONFLICTING_BORROW, exclusiveFirst);
        assertRejectedWith(AnalysisErrorKind.CONFLICTING_BORROW, sharedFirst);
    }

    @Test
    void exclusiveLetBorrowBlocksReadsUntilBlockEnds() throws Exception {
        assertRejectedWith(
                AnalysisErrorKind.CONFLICTING_BORROW,
                inFunction(letMut("v", record()), let("r", borrowMut("v")), ret(var("v"))));

        StaticAnalyzer.analyze(
                inFunction(letMut("v", record()), scope(let("r", borrowMut("v"))), ret(var("v"))));
    }

    @Test
    void sharedBorrowsCoexist() throws Exception {
        StaticAnalyzer.analyze(
                inFunction(let("v", record()), let("r1", borrow("v")), let("r2", borrow("v")), ret(var("v"))));
    }

    @Test
    void exclusiveBorrowOfImmutableBinding() {
        assertRejectedWith(
                AnalysisErrorKind.IMMUTABLE_ASSIGNMENT, inFunction(let("v", record()), let("r", borrowMut("v"))));
    }

    @Test
    void undefinedName() {
        AnalysisException e = rejected(inFunction(ret(var("nowhere"))));
        assertEquals(1, e.errors().size());
        AnalysisError error = e.errors().get(0);
        assertEquals(AnalysisErrorKind.UNDEFINED_NAME, error.kind());
        assertEquals("nowhere", error.name());
    }

    @Test
    void assignmentToImmutableBinding() {
        assertRejectedWith(AnalysisErrorKind.IMMUTABLE_ASSIGNMENT, inFunction(let("x", lit(1)), set("x", lit(2))));
        assertRejectedWith(AnalysisErrorKind.IMMUTABLE_ASSIGNMENT, program(List.of("print"), set("print", lit(1))));
    }

    @Test
    void immutableBindingAssignedInLoopBody() {
        Program p =
                inFunction(
                        declare("x"),
                        forRange("i", lit(0), lit(3), set("x", var("i"))),
                        ret(lit(0)));
        assertRejectedWith(AnalysisErrorKind.IMMUTABLE_ASSIGNMENT, p);

        assertRejectedWith(
                AnalysisErrorKind.IMMUTABLE_ASSIGNMENT,
                inFunction(declare("y"), whileLoop(var("c"), set("y", lit(1)))));
    }

    @Test
    void immutableBindingAssignedOnOneBranchThenAgain() {
        Program p = inFunction(declare("x"), ifThen(var("c"), set("x", lit(1))), set("x", lit(2)), ret(var("x")));
        assertRejectedWith(AnalysisErrorKind.IMMUTABLE_ASSIGNMENT, p);
    }

    @Test
    void immutableBindingDeclaredInsideLoopIsFreshEachIteration() throws Exception {
        StaticAnalyzer.analyze(
                inFunction(whileLoop(var("c"), declare("x"), set("x", lit(1)), expr(var("x")))));
    }

    @Test
    void assignmentToSharedParameter() {
        assertRejectedWith(
                AnalysisErrorKind.IMMUTABLE_ASSIGNMENT,
                program(decl(fn("f", List.of(ParamMode.SHARED), List.of("p"), set("p", lit(1))))));
    }

    @Test
    void reportsEveryErrorNotJustTheFirst() {
        AnalysisException e = rejected(inFunction(ret(var("a")), expr(var("b")), let("x", lit(1)), let("x", lit(2))));
        assertEquals(3, e.errors().size(), () -> e.errors().toString());
    }

    @Test
    void topLevelFunctionsAreCallableBeforeDeclaration() throws Exception {
        StaticAnalyzer.analyze(
                program(let("r", call("later", lit(1))), decl(fn("later", List.of("n"), ret(var("n"))))));
    }

    @Test
    void functionCalledBeforeTheGlobalItReads() {
        Program p = program(decl(fn("peek", List.of(), ret(var("g")))), expr(call("peek")), let("g", lit(1)));
        AnalysisException e = rejected(p);
        assertTrue(e.has(AnalysisErrorKind.USE_OF_UNINITIALIZED));
        assertEquals("g", e.errors().get(0).name());
    }

    @Test
    void functionReadingLaterGlobalMayBeCalledAfterIt() throws Exception {
        StaticAnalyzer.analyze(
                program(decl(fn("peek", List.of(), ret(var("g")))), let("g", lit(1)), expr(call("peek"))));
    }

    @Test
    void uninitializedGlobalReachedThroughCallee() {
        Program p =
                program(
                        decl(fn("outer", List.of(), ret(call("inner")))),
                        decl(fn("inner", List.of(), ret(var("g")))),
                        let("r", call("outer")),
                        let("g", lit(1)));
        assertRejectedWith(AnalysisErrorKind.USE_OF_UNINITIALIZED, p);
    }

    @Test
    void functionPassedOnBeforeTheGlobalItReads() {
        Program p =
                program(
                        decl(fn("apply", List.of("f"), ret(call(var("f"))))),
                        decl(fn("peek", List.of(), ret(var("g")))),
                        let("r", call("apply", var("peek"))),
                        let("g", lit(1)));
        assertRejectedWith(AnalysisErrorKind.USE_OF_UNINITIALIZED, p);
    }

    @Test
    void disownedGlobalReadByFunction() {
        Program p =
                program(
                        let("g", record("a", lit(1))),
                        decl(fn("peek", List.of(), ret(var("g")))),
                        disown("g"),
                        expr(call("peek")));
        assertRejectedWith(AnalysisErrorKind.USE_AFTER_MOVE, p);
    }

    @Test
    void disownedCapturedLocal() {
        Program p =
                inFunction(
                        let("v", record("a", lit(1))),
                        let("g", lambda(List.of(), ret(var("v")))),
                        disown("v"),
                        ret(call(var("g"))));
        AnalysisException e = rejected(p);
        assertTrue(e.has(AnalysisErrorKind.USE_AFTER_MOVE));
        assertTrue(e.errors().stream().allMatch(err -> err.name().equals("v")), () -> e.errors().toString());
    }

    @Test
    void anonymousClosureCreatedBeforeTheGlobalItReads() {
        Program p =
                program(
                        decl(fn("apply", List.of("f"), ret(call(var("f"))))),
                        let("r", call("apply", lambda(List.of(), ret(var("g"))))),
                        let("g", lit(1)));
        assertRejectedWith(AnalysisErrorKind.USE_OF_UNINITIALIZED, p);
    }

    @Test
    void topLevelReadBeforeLetIsUninitialized() {
        assertRejectedWith(AnalysisErrorKind.USE_OF_UNINITIALIZED, program(let("a", var("b")), let("b", lit(1))));
    }

    @Test
    void capturedVariablesResolveAsUpvalues() throws Exception {
        Expr.Var inner = var("n");
        Expr.Function closure = lambda(List.of(), ret(inner));
        Stmt.Let n = (Stmt.Let) let("n", lit(1));
        CheckedProgram checked = StaticAnalyzer.analyze(program(decl(fn("outer", List.of(), n, ret(closure)))));

        Resolved r = checked.resolution(inner);
        Resolved.Upvalue up = assertInstanceOf(Resolved.Upvalue.class, r);
        assertEquals(0, up.index());
        assertTrue(checked.declared(n).isCaptured());

        FunctionInfo info = checked.function(closure);
        assertEquals(1, info.captures().size());
        assertInstanceOf(Resolved.Local.class, info.captures().get(0));
    }

    @Test
    void uncapturedLocalIsNotBoxed() throws Exception {
        Stmt.Let n = (Stmt.Let) let("n", lit(1));
        CheckedProgram checked = StaticAnalyzer.analyze(program(decl(fn("outer", List.of(), n, ret(var("n"))))));
        assertFalse(checked.declared(n).isCaptured());
        assertEquals(SymbolKind.LOCAL, checked.declared(n).kind());
    }
}
