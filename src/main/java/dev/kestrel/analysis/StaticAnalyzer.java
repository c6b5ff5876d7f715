package dev.kestrel.analysis;

import dev.kestrel.ast.Block;
import dev.kestrel.ast.Expr;
import dev.kestrel.ast.ParamMode;
import dev.kestrel.ast.Pat;
import dev.kestrel.ast.Program;
import dev.kestrel.ast.SourcePos;
import dev.kestrel.ast.Stmt;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Name resolution, definite initialization, move and borrow checking.
 *
 * <p>One forward walk over the program with a stack of lexical scopes per function. Branches are
 * analyzed from copies of the flow state and joined with {@link FlowState#meet}; loop bodies are
 * re-walked until their entry state stops changing. Re-walking a node reuses the symbols it
 * declared the first time, so slots and capture indices are stable.</p>
 *
 * <p>Borrows are lexical. A borrow passed as a call argument lives for the call; a borrow bound
 * with {@code let} lives until the end of the enclosing block.</p>
 */
public final class StaticAnalyzer {
    private static final Logger LOG = LoggerFactory.getLogger(StaticAnalyzer.class);

    private static final int MAX_LOOP_PASSES = 64;
    private static final String ENTRY_NAME = "<main>";

    private final Set<AnalysisError> errors = new LinkedHashSet<>();
    private final IdentityHashMap<Object, Resolved> uses = new IdentityHashMap<>();
    private final IdentityHashMap<Object, Symbol> declarations = new IdentityHashMap<>();
    private final IdentityHashMap<Object, Layout> layouts = new IdentityHashMap<>();

    private final Map<String, Symbol> globalScope = new HashMap<>();
    private final List<Symbol> globals = new ArrayList<>();
    private final List<Symbol> hostImports = new ArrayList<>();
    private final List<Reference> references = new ArrayList<>();
    private final List<Disowned> disowns = new ArrayList<>();

    private FnScope current;

    private StaticAnalyzer() {}

    public static CheckedProgram analyze(Program program) throws AnalysisException {
        return new StaticAnalyzer().run(program);
    }

    private CheckedProgram run(Program program) throws AnalysisException {
        Layout entryLayout = new Layout(ENTRY_NAME, 0);
        layouts.put(program, entryLayout);

        for (String name : program.hostImports()) {
            Symbol sym = new Symbol(name, SymbolKind.HOST, hostImports.size(), false, ParamMode.OWNED, SourcePos.NONE, null);
            if (globalScope.putIfAbsent(name, sym) != null) {
                error(AnalysisErrorKind.DUPLICATE_BINDING, SourcePos.NONE, name, "host import `" + name + "` is declared twice");
                continue;
            }
            hostImports.add(sym);
        }

        // Top-level declarations are visible everywhere; functions are callable before their declaration.
        List<Stmt.FunctionDecl> hoisted = new ArrayList<>();
        List<Symbol> globalLets = new ArrayList<>();
        for (Stmt stmt : program.statements()) {
            if (stmt instanceof Stmt.Let let) {
                globalLets.add(declareGlobal(let, let.name(), let.mutable(), let.pos(), knownFunction(let)));
            } else if (stmt instanceof Stmt.FunctionDecl decl) {
                declareGlobal(decl, decl.name(), false, decl.pos(), decl.function());
                hoisted.add(decl);
            }
        }

        current = new FnScope(null, entryLayout, true);
        current.scopes.push(new LexScope());
        for (Symbol sym : globalLets) {
            current.flow.declareUnassigned(sym);
        }
        analyzeStatements(program.statements());
        checkFunctionReferences();

        if (!errors.isEmpty()) {
            LOG.debug("analysis rejected program with {} error(s)", errors.size());
            throw new AnalysisException(new ArrayList<>(errors));
        }

        IdentityHashMap<Expr.Function, FunctionInfo> functions = new IdentityHashMap<>();
        for (Map.Entry<Object, Layout> e : layouts.entrySet()) {
            if (e.getKey() instanceof Expr.Function fn) {
                functions.put(fn, e.getValue().toInfo());
            }
        }
        LOG.debug(
                "analysis ok: {} function(s), {} global(s), {} host import(s)",
                functions.size(),
                globals.size(),
                hostImports.size());
        return new CheckedProgram(
                program, entryLayout.toInfo(), globals, hostImports, hoisted, uses, declarations, functions);
    }

    // ---------------------------------------------------------------------------------------
    // Declarations and resolution

    private Symbol declareGlobal(Object node, String name, boolean mutable, SourcePos pos, Expr.Function fn) {
        Symbol existing = globalScope.get(name);
        if (existing != null) {
            error(AnalysisErrorKind.DUPLICATE_BINDING, pos, name, "`" + name + "` is already declared at top level");
            declarations.put(node, existing);
            return existing;
        }
        Symbol sym = new Symbol(name, SymbolKind.GLOBAL, globals.size(), mutable, ParamMode.OWNED, pos, fn);
        globalScope.put(name, sym);
        globals.add(sym);
        declarations.put(node, sym);
        return sym;
    }

    private boolean atTopLevel() {
        return current.entry && current.scopes.size() == 1;
    }

    private Symbol declare(Object node, String name, boolean mutable, ParamMode mode, SourcePos pos, Expr.Function fn) {
        if (atTopLevel()) {
            return declarations.get(node);
        }
        Symbol sym = declarations.get(node);
        if (sym == null) {
            sym = new Symbol(name, SymbolKind.LOCAL, current.layout.allocate(), mutable, mode, pos, fn);
            declarations.put(node, sym);
        }
        bind(sym, pos);
        return sym;
    }

    private Symbol declareParam(Pat.Binding binding, int slot, ParamMode mode) {
        Symbol sym = declarations.get(binding);
        if (sym == null) {
            sym = new Symbol(binding.name(), SymbolKind.LOCAL, slot, false, mode, binding.pos(), null);
            declarations.put(binding, sym);
        }
        bind(sym, binding.pos());
        return sym;
    }

    private void bind(Symbol sym, SourcePos pos) {
        LexScope scope = current.scopes.peek();
        Symbol existing = scope.names.get(sym.name());
        if (existing != null && existing != sym) {
            error(
                    AnalysisErrorKind.DUPLICATE_BINDING,
                    pos,
                    sym.name(),
                    "`" + sym.name() + "` is already declared in this scope (at " + existing.pos() + ")");
            return;
        }
        scope.names.put(sym.name(), sym);
    }

    /** Declares every binding of a pattern, initialized. */
    private void declarePattern(Pat pat, ParamMode mode) {
        if (pat instanceof Pat.Binding b) {
            Symbol sym = declare(b, b.name(), false, mode, b.pos(), null);
            current.flow.set(sym, DeclState.INITIALIZED);
        } else if (pat instanceof Pat.Destructure d) {
            for (Pat.Destructure.Field f : d.fields()) {
                declarePattern(f.pattern(), mode);
            }
        } else if (pat instanceof Pat.ArrayPat a) {
            for (Pat item : a.items()) {
                declarePattern(item, mode);
            }
        }
    }

    private Resolved resolve(String name) {
        Symbol local = current.lookupLocal(name);
        if (local != null) {
            return new Resolved.Local(local);
        }
        Integer up = resolveUpvalue(current, name);
        if (up != null) {
            return new Resolved.Upvalue(up, current.layout.captureSymbols.get(up));
        }
        Symbol global = globalScope.get(name);
        if (global == null) {
            return null;
        }
        return global.kind() == SymbolKind.HOST ? new Resolved.Host(global) : new Resolved.Global(global);
    }

    private static Integer resolveUpvalue(FnScope fs, String name) {
        if (fs.enclosing == null) {
            return null;
        }
        Symbol local = fs.enclosing.lookupLocal(name);
        if (local != null) {
            local.markCaptured();
            return fs.layout.capture(local, new Resolved.Local(local));
        }
        Integer outer = resolveUpvalue(fs.enclosing, name);
        if (outer != null) {
            Symbol sym = fs.enclosing.layout.captureSymbols.get(outer);
            return fs.layout.capture(sym, new Resolved.Upvalue(outer, sym));
        }
        return null;
    }

    private static Expr.Function knownFunction(Stmt.Let let) {
        if (!let.mutable() && let.init() instanceof Expr.Function fn) {
            return fn;
        }
        return null;
    }

    // ---------------------------------------------------------------------------------------
    // Statements

    private void analyzeStatements(List<Stmt> statements) {
        for (Stmt stmt : statements) {
            analyzeStatement(stmt);
        }
    }

    private void analyzeBlock(Block block) {
        current.scopes.push(new LexScope());
        try {
            analyzeStatements(block.statements());
        } finally {
            current.scopes.pop();
        }
    }

    private void analyzeStatement(Stmt stmt) {
        if (stmt instanceof Stmt.Let let) {
            analyzeLet(let);
        } else if (stmt instanceof Stmt.Assign assign) {
            analyzeAssign(assign);
        } else if (stmt instanceof Stmt.SetField s) {
            analyzeExpr(s.target());
            analyzeExpr(s.value());
            checkWriteThrough(s.target(), s.pos());
        } else if (stmt instanceof Stmt.SetIndex s) {
            analyzeExpr(s.target());
            analyzeExpr(s.index());
            analyzeExpr(s.value());
            checkWriteThrough(s.target(), s.pos());
        } else if (stmt instanceof Stmt.FunctionDecl decl) {
            Symbol sym = declare(decl, decl.name(), false, ParamMode.OWNED, decl.pos(), decl.function());
            if (sym.kind() == SymbolKind.LOCAL) {
                current.flow.set(sym, DeclState.UNINITIALIZED);
            }
            analyzeFunction(decl.function(), sym);
            current.layout.refs.add(decl.function());
            current.flow.set(sym, DeclState.INITIALIZED);
        } else if (stmt instanceof Stmt.If s) {
            analyzeIf(s);
        } else if (stmt instanceof Stmt.Cond s) {
            analyzeCond(s);
        } else if (stmt instanceof Stmt.While s) {
            analyzeWhile(s);
        } else if (stmt instanceof Stmt.For s) {
            analyzeFor(s);
        } else if (stmt instanceof Stmt.Loop s) {
            analyzeLoop(s);
        } else if (stmt instanceof Stmt.Break) {
            LoopFrame frame = current.loops.peek();
            if (frame != null) {
                frame.breaks.add(current.flow.copy());
            }
            current.flow.markDead();
        } else if (stmt instanceof Stmt.Continue) {
            LoopFrame frame = current.loops.peek();
            if (frame != null) {
                frame.continues.add(current.flow.copy());
            }
            current.flow.markDead();
        } else if (stmt instanceof Stmt.Return r) {
            if (r.value() != null) {
                analyzeExpr(r.value());
            }
            current.flow.markDead();
        } else if (stmt instanceof Stmt.Disown d) {
            analyzeDisown(d);
        } else if (stmt instanceof Stmt.Scope s) {
            analyzeBlock(s.body());
        } else if (stmt instanceof Stmt.ExprStmt s) {
            analyzeExpr(s.expr());
        } else {
            throw new IllegalStateException("unknown Stmt: " + stmt);
        }
    }

    private void analyzeLet(Stmt.Let let) {
        Loan loan = null;
        if (let.init() instanceof Expr.Borrow b) {
            AccessMode mode = b.exclusive() ? AccessMode.EXCLUSIVE_BORROW : AccessMode.SHARED_BORROW;
            Resolved target = access(b.target(), mode);
            if (target != null) {
                loan = new Loan(target.symbol(), b.exclusive(), b.pos());
            }
        } else if (knownFunction(let) != null) {
            // Every use of the binding is checked as a reference to the function.
            analyzeFunction(knownFunction(let), null);
            current.layout.refs.add(knownFunction(let));
        } else if (let.init() != null) {
            analyzeExpr(let.init());
        }
        Symbol sym = declare(let, let.name(), let.mutable(), ParamMode.OWNED, let.pos(), knownFunction(let));
        if (let.init() == null) {
            current.flow.declareUnassigned(sym);
        } else {
            current.flow.set(sym, DeclState.INITIALIZED);
        }
        if (loan != null) {
            current.scopes.peek().loans.add(loan);
        }
    }

    private void analyzeAssign(Stmt.Assign assign) {
        analyzeExpr(assign.value());
        Resolved r = resolve(assign.name());
        if (r == null) {
            undefined(assign.name(), assign.pos());
            return;
        }
        uses.put(assign, r);
        Symbol sym = r.symbol();
        String name = assign.name();
        if (sym.kind() == SymbolKind.HOST) {
            error(AnalysisErrorKind.IMMUTABLE_ASSIGNMENT, assign.pos(), name, "cannot assign to host import `" + name + "`");
            return;
        }
        if (sym.mode() == ParamMode.SHARED) {
            error(
                    AnalysisErrorKind.IMMUTABLE_ASSIGNMENT,
                    assign.pos(),
                    name,
                    "cannot assign to `" + name + "`: it is a shared borrow");
            return;
        }
        if (!sym.isWritable()) {
            // An immutable binding may be set once, while it has never been initialized.
            boolean firstInit = !(r instanceof Resolved.Upvalue)
                    && sym.function() == null
                    && current.flow.get(sym) == DeclState.UNINITIALIZED
                    && !current.flow.mayBeAssigned(sym);
            if (!firstInit) {
                error(
                        AnalysisErrorKind.IMMUTABLE_ASSIGNMENT,
                        assign.pos(),
                        name,
                        "cannot assign twice to immutable binding `" + name + "`");
                return;
            }
        }
        checkLoans(sym, AccessMode.WRITE, assign.pos());
        if (!(r instanceof Resolved.Upvalue)) {
            current.flow.assign(sym);
        }
    }

    private void checkWriteThrough(Expr target, SourcePos pos) {
        Expr root = target;
        while (true) {
            if (root instanceof Expr.Field f) {
                root = f.target();
            } else if (root instanceof Expr.Index i) {
                root = i.target();
            } else {
                break;
            }
        }
        if (!(root instanceof Expr.Var v)) {
            return;
        }
        Resolved r = uses.get(v);
        if (r != null && r.symbol().mode() == ParamMode.SHARED) {
            error(
                    AnalysisErrorKind.IMMUTABLE_ASSIGNMENT,
                    pos,
                    v.name(),
                    "cannot write through `" + v.name() + "`: it is a shared borrow");
        }
    }

    private void analyzeDisown(Stmt.Disown d) {
        Resolved r = resolve(d.name());
        if (r == null) {
            undefined(d.name(), d.pos());
            return;
        }
        uses.put(d, r);
        Symbol sym = r.symbol();
        if (!(r instanceof Resolved.Upvalue)) {
            checkState(sym, d.pos());
        }
        checkLoans(sym, AccessMode.MOVE, d.pos());
        if (isTracked(r)) {
            current.flow.set(sym, DeclState.MOVED);
            disowns.add(new Disowned(sym, d.pos()));
        }
    }

    private void analyzeIf(Stmt.If s) {
        analyzeExpr(s.condition());
        FlowState afterCondition = current.flow;

        current.flow = afterCondition.copy();
        analyzeBlock(s.thenBlock());
        FlowState thenOut = current.flow;

        current.flow = afterCondition.copy();
        if (s.elseBlock() != null) {
            analyzeBlock(s.elseBlock());
        }
        FlowState elseOut = current.flow;

        current.flow = FlowState.meet(List.of(thenOut, elseOut));
    }

    private void analyzeCond(Stmt.Cond s) {
        if (s.scrutinee() != null) {
            analyzeExpr(s.scrutinee());
        }
        FlowState running = current.flow.copy();
        List<FlowState> exits = new ArrayList<>();
        boolean exhaustive = false;
        for (Stmt.Cond.Arm arm : s.arms()) {
            current.flow = running.copy();
            current.scopes.push(new LexScope());
            try {
                declarePattern(arm.pattern(), ParamMode.OWNED);
                if (arm.guard() != null) {
                    analyzeExpr(arm.guard());
                    // A failing guard falls through to the next arm.
                    running = FlowState.meet(List.of(running, current.flow));
                }
                analyzeBlock(arm.body());
                exits.add(current.flow);
            } finally {
                current.scopes.pop();
            }
            if (arm.guard() == null && Pat.isIrrefutable(arm.pattern())) {
                exhaustive = true;
            }
        }
        if (!exhaustive) {
            // Falling off the last arm traps.
            FlowState trapped = running.copy();
            trapped.markDead();
            exits.add(trapped);
        }
        current.flow = FlowState.meet(exits);
    }

    private void analyzeWhile(Stmt.While s) {
        FlowState pre = current.flow.copy();
        FlowState entry = pre;
        for (int pass = 0; ; pass++) {
            current.flow = entry.copy();
            analyzeExpr(s.condition());
            FlowState afterCondition = current.flow.copy();

            LoopFrame frame = runBody(s.body());

            FlowState next = backEdge(pre, frame);
            if (next.sameAs(entry) || pass >= MAX_LOOP_PASSES) {
                List<FlowState> out = new ArrayList<>();
                out.add(afterCondition);
                out.addAll(frame.breaks);
                current.flow = FlowState.meet(out);
                return;
            }
            entry = next;
        }
    }

    private void analyzeFor(Stmt.For s) {
        analyzeExpr(s.from());
        analyzeExpr(s.to());
        FlowState pre = current.flow.copy();
        FlowState entry = pre;
        for (int pass = 0; ; pass++) {
            current.flow = entry.copy();
            FlowState head = current.flow.copy();

            LoopFrame frame;
            current.scopes.push(new LexScope());
            try {
                Symbol var = declare(s, s.variable(), false, ParamMode.OWNED, s.pos(), null);
                current.flow.set(var, DeclState.INITIALIZED);
                frame = runBody(s.body());
            } finally {
                current.scopes.pop();
            }

            FlowState next = backEdge(pre, frame);
            if (next.sameAs(entry) || pass >= MAX_LOOP_PASSES) {
                List<FlowState> out = new ArrayList<>();
                out.add(head);
                out.addAll(frame.breaks);
                current.flow = FlowState.meet(out);
                return;
            }
            entry = next;
        }
    }

    private void analyzeLoop(Stmt.Loop s) {
        FlowState pre = current.flow.copy();
        FlowState entry = pre;
        for (int pass = 0; ; pass++) {
            current.flow = entry.copy();
            LoopFrame frame = runBody(s.body());
            FlowState next = backEdge(pre, frame);
            if (next.sameAs(entry) || pass >= MAX_LOOP_PASSES) {
                // Only a break leaves the loop normally.
                current.flow = FlowState.meet(frame.breaks);
                if (frame.breaks.isEmpty()) {
                    current.flow = entry.copy();
                    current.flow.markDead();
                }
                return;
            }
            entry = next;
        }
    }

    private LoopFrame runBody(Block body) {
        LoopFrame frame = new LoopFrame();
        current.loops.push(frame);
        try {
            analyzeBlock(body);
        } finally {
            current.loops.pop();
        }
        frame.continues.add(current.flow);
        return frame;
    }

    private static FlowState backEdge(FlowState pre, LoopFrame frame) {
        List<FlowState> back = new ArrayList<>();
        back.add(pre);
        back.addAll(frame.continues);
        return FlowState.meet(back);
    }

    // ---------------------------------------------------------------------------------------
    // Functions

    /**
     * @param self the binding the function is declared as, which it may capture before that
     *     binding is initialized; {@code null} for function literals
     */
    private void analyzeFunction(Expr.Function fn, Symbol self) {
        Layout layout = layouts.computeIfAbsent(fn, k -> new Layout(fn.displayName(), fn.arity()));
        FnScope outer = current;
        current = new FnScope(outer, layout, false);
        try {
            for (Expr.Clause clause : fn.clauses()) {
                current.flow = FlowState.live();
                current.loops.clear();
                current.scopes.clear();
                // Parameters and body share one scope.
                current.scopes.push(new LexScope());
                for (int i = 0; i < clause.params().size(); i++) {
                    Pat param = clause.params().get(i);
                    ParamMode mode = fn.modes().get(i);
                    if (param instanceof Pat.Binding b) {
                        current.flow.set(declareParam(b, i, mode), DeclState.INITIALIZED);
                    } else {
                        declarePattern(param, mode);
                    }
                }
                analyzeStatements(clause.body().statements());
            }
        } finally {
            current = outer;
        }

        for (Resolved source : layout.captures) {
            if (source instanceof Resolved.Local l && l.symbol() != self) {
                checkState(l.symbol(), fn.pos());
            }
        }
    }

    // ---------------------------------------------------------------------------------------
    // Expressions

    private void analyzeExpr(Expr expr) {
        if (Expr.isLiteral(expr)) {
            return;
        }
        if (expr instanceof Expr.Var v) {
            access(v, AccessMode.READ);
        } else if (expr instanceof Expr.Binary b) {
            analyzeExpr(b.left());
            analyzeExpr(b.right());
        } else if (expr instanceof Expr.Logical l) {
            analyzeExpr(l.left());
            FlowState afterLeft = current.flow.copy();
            analyzeExpr(l.right());
            // The right operand may not run.
            current.flow = FlowState.meet(List.of(afterLeft, current.flow));
        } else if (expr instanceof Expr.Unary u) {
            analyzeExpr(u.operand());
        } else if (expr instanceof Expr.Call c) {
            analyzeCall(c);
        } else if (expr instanceof Expr.Function fn) {
            analyzeFunction(fn, null);
            current.layout.refs.add(fn);
            reference(fn, fn.pos());
        } else if (expr instanceof Expr.RecordLit r) {
            for (Expr.RecordLit.FieldInit f : r.fields()) {
                analyzeExpr(f.value());
            }
        } else if (expr instanceof Expr.Field f) {
            analyzeExpr(f.target());
        } else if (expr instanceof Expr.ArrayLit a) {
            for (Expr item : a.items()) {
                analyzeExpr(item);
            }
        } else if (expr instanceof Expr.Index i) {
            analyzeExpr(i.target());
            analyzeExpr(i.index());
        } else if (expr instanceof Expr.Borrow b) {
            access(b.target(), b.exclusive() ? AccessMode.EXCLUSIVE_BORROW : AccessMode.SHARED_BORROW);
        } else {
            throw new IllegalStateException("unknown Expr: " + expr);
        }
    }

    private void analyzeCall(Expr.Call call) {
        analyzeExpr(call.callee());
        Expr.Function known = knownCallee(call.callee());

        List<Use> argUses = new ArrayList<>();
        for (int i = 0; i < call.args().size(); i++) {
            Expr arg = call.args().get(i);
            Expr.Var var;
            AccessMode mode;
            if (arg instanceof Expr.Borrow b) {
                var = b.target();
                mode = b.exclusive() ? AccessMode.EXCLUSIVE_BORROW : AccessMode.SHARED_BORROW;
            } else if (arg instanceof Expr.Var v) {
                var = v;
                mode = argumentMode(known, i);
            } else {
                analyzeExpr(arg);
                continue;
            }
            Resolved r = access(var, mode);
            if (r != null) {
                argUses.add(new Use(r, mode, var.pos()));
            }
        }

        // Every pair is checked, so the verdict does not depend on argument order.
        for (int i = 0; i < argUses.size(); i++) {
            for (int j = i + 1; j < argUses.size(); j++) {
                Use a = argUses.get(i);
                Use b = argUses.get(j);
                if (a.resolved().symbol() != b.resolved().symbol()) {
                    continue;
                }
                String name = a.resolved().symbol().name();
                if (a.mode() == AccessMode.MOVE && b.mode() == AccessMode.MOVE) {
                    error(
                            AnalysisErrorKind.USE_AFTER_MOVE,
                            call.pos(),
                            name,
                            "`" + name + "` is moved twice in the same call");
                } else if (a.mode().isExclusive() || b.mode().isExclusive()) {
                    error(
                            AnalysisErrorKind.CONFLICTING_BORROW,
                            call.pos(),
                            name,
                            "`" + name + "` is passed "
                                    + describe(a.mode())
                                    + " and "
                                    + describe(b.mode())
                                    + " to the same call");
                }
            }
        }

        for (Use u : argUses) {
            if (u.mode() == AccessMode.MOVE && isTracked(u.resolved())) {
                current.flow.set(u.resolved().symbol(), DeclState.MOVED);
            }
        }
    }

    private Expr.Function knownCallee(Expr callee) {
        if (!(callee instanceof Expr.Var v)) {
            return null;
        }
        Resolved r = uses.get(v);
        return r == null ? null : r.symbol().function();
    }

    private static AccessMode argumentMode(Expr.Function known, int index) {
        if (known == null || index >= known.arity()) {
            return AccessMode.SHARED_BORROW;
        }
        ParamMode mode = known.modes().get(index);
        if (mode == ParamMode.OWNED) {
            return AccessMode.MOVE;
        }
        return mode == ParamMode.EXCLUSIVE ? AccessMode.EXCLUSIVE_BORROW : AccessMode.SHARED_BORROW;
    }

    private static String describe(AccessMode mode) {
        switch (mode) {
            case MOVE:
                return "by move";
            case EXCLUSIVE_BORROW:
                return "exclusively";
            default:
                return "shared";
        }
    }

    /** Resolves a variable use and checks that it may be accessed this way here. */
    private Resolved access(Expr.Var v, AccessMode mode) {
        Resolved r = resolve(v.name());
        if (r == null) {
            undefined(v.name(), v.pos());
            return null;
        }
        uses.put(v, r);
        Symbol sym = r.symbol();
        if (!(r instanceof Resolved.Upvalue)) {
            checkState(sym, v.pos());
        }
        if (r instanceof Resolved.Global && !current.entry) {
            current.layout.reads.add(sym);
        }
        if (sym.function() != null) {
            current.layout.refs.add(sym.function());
            reference(sym.function(), v.pos());
        }
        if (mode == AccessMode.EXCLUSIVE_BORROW && !sym.isWritable()) {
            error(
                    AnalysisErrorKind.IMMUTABLE_ASSIGNMENT,
                    v.pos(),
                    v.name(),
                    "cannot borrow `" + v.name() + "` exclusively: it is not mutable");
        }
        checkLoans(sym, mode, v.pos());
        return r;
    }

    private void checkState(Symbol sym, SourcePos pos) {
        DeclState state = current.flow.get(sym);
        if (state == DeclState.UNINITIALIZED) {
            error(
                    AnalysisErrorKind.USE_OF_UNINITIALIZED,
                    pos,
                    sym.name(),
                    "`" + sym.name() + "` is not initialized on every path reaching this use");
        } else if (state == DeclState.MOVED) {
            error(
                    AnalysisErrorKind.USE_AFTER_MOVE,
                    pos,
                    sym.name(),
                    "`" + sym.name() + "` was moved and not initialized again");
        }
    }

    /** Records a point where a function value is called, passed on or created. */
    private void reference(Expr.Function fn, SourcePos pos) {
        if (!current.flow.isDead()) {
            references.add(new Reference(fn, current.flow.copy(), pos));
        }
    }

    /**
     * A function body sees globals and captured bindings as initialized; that holds only if they
     * are initialized, and not moved, wherever the function can be reached. Runs once every body
     * has been walked, since top-level functions may be referenced before their declaration.
     */
    private void checkFunctionReferences() {
        IdentityHashMap<Expr.Function, Set<Symbol>> reads = new IdentityHashMap<>();
        for (Reference ref : references) {
            Set<Symbol> outer = reads.computeIfAbsent(ref.function(), this::outerReads);
            String fnName = ref.function().displayName();
            for (Symbol sym : outer) {
                if (sym.function() == ref.function()) {
                    continue;
                }
                DeclState state = ref.flow().get(sym);
                if (state == DeclState.UNINITIALIZED) {
                    error(
                            AnalysisErrorKind.USE_OF_UNINITIALIZED,
                            ref.pos(),
                            sym.name(),
                            "`" + fnName + "` reads `" + sym.name() + "`, which is not initialized on every path reaching this use");
                } else if (state == DeclState.MOVED) {
                    error(
                            AnalysisErrorKind.USE_AFTER_MOVE,
                            ref.pos(),
                            sym.name(),
                            "`" + fnName + "` reads `" + sym.name() + "`, which was moved and not initialized again");
                }
            }
        }

        Set<Symbol> readByFunctions = new HashSet<>();
        for (Layout layout : layouts.values()) {
            readByFunctions.addAll(layout.reads);
        }
        for (Disowned d : disowns) {
            Symbol sym = d.symbol();
            if (sym.isCaptured()) {
                error(
                        AnalysisErrorKind.USE_AFTER_MOVE,
                        d.pos(),
                        sym.name(),
                        "cannot disown `" + sym.name() + "`: a closure still refers to it");
            } else if (readByFunctions.contains(sym)) {
                error(
                        AnalysisErrorKind.USE_AFTER_MOVE,
                        d.pos(),
                        sym.name(),
                        "cannot disown `" + sym.name() + "`: a function still reads it");
            }
        }
    }

    /** Globals and captured bindings read by a function, its nested functions and its known callees. */
    private Set<Symbol> outerReads(Expr.Function root) {
        Set<Symbol> out = new LinkedHashSet<>();
        Set<Expr.Function> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        ArrayDeque<Expr.Function> work = new ArrayDeque<>();
        work.push(root);
        while (!work.isEmpty()) {
            Expr.Function fn = work.pop();
            if (!seen.add(fn)) {
                continue;
            }
            Layout layout = layouts.get(fn);
            if (layout == null) {
                continue;
            }
            out.addAll(layout.reads);
            out.addAll(layout.captureSymbols);
            work.addAll(layout.refs);
        }
        return out;
    }

    private void checkLoans(Symbol sym, AccessMode mode, SourcePos pos) {
        for (LexScope scope : current.scopes) {
            for (Loan loan : scope.loans) {
                if (loan.target() != sym) {
                    continue;
                }
                if (loan.exclusive() || mode.isExclusive()) {
                    error(
                            AnalysisErrorKind.CONFLICTING_BORROW,
                            pos,
                            sym.name(),
                            "`" + sym.name() + "` is borrowed "
                                    + (loan.exclusive() ? "exclusively" : "shared")
                                    + " at "
                                    + loan.pos()
                                    + " and still in use");
                    return;
                }
            }
        }
    }

    /** Moves of captured variables, host imports and functions are not tracked. */
    private static boolean isTracked(Resolved r) {
        Symbol sym = r.symbol();
        return !(r instanceof Resolved.Upvalue) && sym.kind() != SymbolKind.HOST && sym.function() == null;
    }

    private void undefined(String name, SourcePos pos) {
        error(AnalysisErrorKind.UNDEFINED_NAME, pos, name, "`" + name + "` is not declared");
    }

    private void error(AnalysisErrorKind kind, SourcePos pos, String name, String message) {
        errors.add(new AnalysisError(kind, pos, name, message));
    }

    // ---------------------------------------------------------------------------------------

    private static final class Layout {
        final String name;
        final int arity;
        int nextSlot;
        final List<Resolved> captures = new ArrayList<>();
        final List<Symbol> captureSymbols = new ArrayList<>();
        final Map<Symbol, Integer> captureIndex = new HashMap<>();
        /** Globals read directly by the body. */
        final Set<Symbol> reads = new LinkedHashSet<>();
        /** Functions the body calls, passes on or creates. */
        final Set<Expr.Function> refs = Collections.newSetFromMap(new IdentityHashMap<>());

        Layout(String name, int arity) {
            this.name = name;
            this.arity = arity;
            this.nextSlot = arity;
        }

        int allocate() {
            return nextSlot++;
        }

        int capture(Symbol sym, Resolved source) {
            Integer existing = captureIndex.get(sym);
            if (existing != null) {
                return existing;
            }
            int index = captures.size();
            captures.add(source);
            captureSymbols.add(sym);
            captureIndex.put(sym, index);
            return index;
        }

        FunctionInfo toInfo() {
            return new FunctionInfo(name, arity, nextSlot, captures);
        }
    }

    private static final class FnScope {
        final FnScope enclosing;
        final Layout layout;
        final boolean entry;
        final ArrayDeque<LexScope> scopes = new ArrayDeque<>();
        final ArrayDeque<LoopFrame> loops = new ArrayDeque<>();
        FlowState flow = FlowState.live();

        FnScope(FnScope enclosing, Layout layout, boolean entry) {
            this.enclosing = enclosing;
            this.layout = layout;
            this.entry = entry;
        }

        Symbol lookupLocal(String name) {
            // Innermost first.
            for (LexScope scope : scopes) {
                Symbol sym = scope.names.get(name);
                if (sym != null) {
                    return sym;
                }
            }
            return null;
        }
    }

    private static final class LexScope {
        final Map<String, Symbol> names = new HashMap<>();
        final List<Loan> loans = new ArrayList<>();
    }

    private static final class LoopFrame {
        final List<FlowState> breaks = new ArrayList<>();
        final List<FlowState> continues = new ArrayList<>();
    }

    private record Loan(Symbol target, boolean exclusive, SourcePos pos) {}

    private record Use(Resolved resolved, AccessMode mode, SourcePos pos) {}

    private record Reference(Expr.Function function, FlowState flow, SourcePos pos) {}

    private record Disowned(Symbol symbol, SourcePos pos) {}
}
