package dev.kestrel.ast;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class AstTest {
    private static final SourcePos P = new SourcePos(1, 1);

    @Test
    void clauseArityMustMatchModes() {
        Expr.Clause oneParam = new Expr.Clause(List.of(new Pat.Wildcard(P)), Block.of());
        assertThrows(
                IllegalArgumentException.class,
                () -> new Expr.Function(FunctionKind.FUNC, "f", List.of(), List.of(oneParam), P));
        assertThrows(
                IllegalArgumentException.class,
                () -> new Expr.Function(FunctionKind.FUNC, "f", List.of(), List.of(), P));
    }

    @Test
    void guardOnlyCondNeedsWildcardsAndGuards() {
        Stmt.Cond.Arm unguarded = new Stmt.Cond.Arm(new Pat.Wildcard(P), null, Block.of());
        assertThrows(IllegalArgumentException.class, () -> new Stmt.Cond(null, List.of(unguarded), P));

        Stmt.Cond.Arm guarded = new Stmt.Cond.Arm(new Pat.Wildcard(P), new Expr.BoolLit(true, P), Block.of());
        assertEquals(1, new Stmt.Cond(null, List.of(guarded), P).arms().size());
    }

    @Test
    void literalPatternNeedsLiteral() {
        assertThrows(IllegalArgumentException.class, () -> new Pat.Literal(new Expr.Var("x", P), P));
        assertTrue(Pat.isIrrefutable(new Pat.Binding("x", P)));
        assertFalse(Pat.isIrrefutable(new Pat.Literal(new Expr.IntLit(1, P), P)));
    }

    @Test
    void declaredFunctionNeedsName() {
        Expr.Function anonymous =
                new Expr.Function(FunctionKind.PROC, null, List.of(), List.of(new Expr.Clause(List.of(), Block.of())), P);
        assertEquals("<anonymous>", anonymous.displayName());
        assertThrows(IllegalArgumentException.class, () -> new Stmt.FunctionDecl(anonymous));
    }

    @Test
    void positionsRenderAsLineAndColumn() {
        assertEquals("3:7", new SourcePos(3, 7).toString());
        assertEquals("?", SourcePos.NONE.toString());
        assertThrows(IllegalArgumentException.class, () -> new SourcePos(-1, 0));
    }
}
