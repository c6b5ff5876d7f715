package dev.kestrel.analysis;

import dev.kestrel.ast.Expr;
import dev.kestrel.ast.Pat;
import dev.kestrel.ast.Program;
import dev.kestrel.ast.Stmt;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A program that passed {@link StaticAnalyzer}, with its resolution tables.
 *
 * <p>Only the analyzer can create one, so the compiler cannot be handed an unchecked AST. Lookups
 * are by node identity; asking about a node that is not part of {@link #program()} is an
 * internal error.</p>
 */
public final class CheckedProgram {
    private final Program program;
    private final FunctionInfo entry;
    private final List<Symbol> globals;
    private final List<Symbol> hostImports;
    private final List<Stmt.FunctionDecl> hoisted;
    private final IdentityHashMap<Object, Resolved> uses;
    private final IdentityHashMap<Object, Symbol> declarations;
    private final IdentityHashMap<Expr.Function, FunctionInfo> functions;

    CheckedProgram(
            Program program,
            FunctionInfo entry,
            List<Symbol> globals,
            List<Symbol> hostImports,
            List<Stmt.FunctionDecl> hoisted,
            Map<Object, Resolved> uses,
            Map<Object, Symbol> declarations,
            Map<Expr.Function, FunctionInfo> functions) {
        this.program = Objects.requireNonNull(program, "program");
        this.entry = Objects.requireNonNull(entry, "entry");
        this.globals = List.copyOf(globals);
        this.hostImports = List.copyOf(hostImports);
        this.hoisted = List.copyOf(hoisted);
        this.uses = new IdentityHashMap<>(uses);
        this.declarations = new IdentityHashMap<>(declarations);
        this.functions = new IdentityHashMap<>(functions);
    }

    public Program program() {
        return program;
    }

    /** Layout of the implicit function running the top-level statements. */
    public FunctionInfo entry() {
        return entry;
    }

    /** Global symbols in global-table order. */
    public List<Symbol> globals() {
        return globals;
    }

    public List<Symbol> hostImports() {
        return hostImports;
    }

    /** Top-level function declarations, whose closures the entry function creates first. */
    public List<Stmt.FunctionDecl> hoistedFunctions() {
        return hoisted;
    }

    public Resolved resolution(Expr.Var use) {
        return use(use);
    }

    public Resolved resolution(Stmt.Assign assign) {
        return use(assign);
    }

    public Resolved resolution(Stmt.Disown disown) {
        return use(disown);
    }

    public Symbol declared(Stmt.Let let) {
        return decl(let);
    }

    public Symbol declared(Stmt.FunctionDecl decl) {
        return decl(decl);
    }

    public Symbol declared(Stmt.For loop) {
        return decl(loop);
    }

    public Symbol declared(Pat.Binding binding) {
        return decl(binding);
    }

    public FunctionInfo function(Expr.Function fn) {
        FunctionInfo info = functions.get(fn);
        if (info == null) {
            throw new IllegalStateException("function `" + fn.displayName() + "` at " + fn.pos() + " was not analyzed");
        }
        return info;
    }

    private Resolved use(Object node) {
        Resolved r = uses.get(node);
        if (r == null) {
            throw new IllegalStateException("no resolution recorded for " + node);
        }
        return r;
    }

    private Symbol decl(Object node) {
        Symbol s = declarations.get(node);
        if (s == null) {
            throw new IllegalStateException("no declaration recorded for " + node);
        }
        return s;
    }
}
