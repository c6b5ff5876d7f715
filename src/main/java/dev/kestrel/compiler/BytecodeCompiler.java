package dev.kestrel.compiler;

import dev.kestrel.analysis.CheckedProgram;
import dev.kestrel.analysis.FunctionInfo;
import dev.kestrel.analysis.Resolved;
import dev.kestrel.analysis.Symbol;
import dev.kestrel.analysis.SymbolKind;
import dev.kestrel.ast.Block;
import dev.kestrel.ast.Expr;
import dev.kestrel.ast.LogicalOp;
import dev.kestrel.ast.Pat;
import dev.kestrel.ast.Stmt;
import dev.kestrel.bytecode.BytecodeUnit;
import dev.kestrel.bytecode.CaptureSource;
import dev.kestrel.bytecode.ConstValue;
import dev.kestrel.bytecode.Disassembler;
import dev.kestrel.bytecode.FunctionId;
import dev.kestrel.bytecode.Instruction;
import dev.kestrel.bytecode.Pattern;
import dev.kestrel.bytecode.TrapKind;
import dev.kestrel.compiler.FunctionEmitter.JumpKind;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lowers a {@link CheckedProgram} to a {@link BytecodeUnit}.
 *
 * <p>Single pass over the AST; every expression leaves exactly one value on the operand stack
 * and every statement leaves the stack as it found it. Locals whose symbol is captured hold a
 * cell, created where the binding is introduced.</p>
 */
public final class BytecodeCompiler {
    private static final Logger LOG = LoggerFactory.getLogger(BytecodeCompiler.class);

    private final CheckedProgram checked;
    private final BytecodeUnit unit = new BytecodeUnit();
    private FunctionEmitter fe;

    private BytecodeCompiler(CheckedProgram checked) {
        this.checked = checked;
    }

    public static BytecodeUnit compile(CheckedProgram program) throws CompileException {
        return new BytecodeCompiler(program).run();
    }

    private BytecodeUnit run() throws CompileException {
        for (Symbol host : checked.hostImports()) {
            unit.addHostImport(host.name());
        }
        for (Symbol global : checked.globals()) {
            unit.addGlobal(global.name());
        }

        FunctionInfo entryInfo = checked.entry();
        FunctionId entryId = unit.reserveFunction(entryInfo.name());
        unit.setEntry(entryId);
        fe = new FunctionEmitter(entryInfo.name(), 0, entryInfo.localCount(), 0);

        for (Stmt.FunctionDecl decl : checked.hoistedFunctions()) {
            fe.pos = decl.pos();
            FunctionId id = compileClosure(decl.function());
            fe.emit(new Instruction.StoreGlobal(checked.declared(decl).index()));
            unit.addEntryPoint(decl.name(), id);
        }
        compileStatements(checked.program().statements());
        fe.emit(new Instruction.PushNil());
        fe.emit(new Instruction.Return());
        unit.defineFunction(entryId, fe.finish());

        LOG.debug(
                "compiled {} function(s), {} constant(s), {} global(s)",
                unit.functions().size(),
                unit.constants().size(),
                unit.globalNames().size());
        if (LOG.isTraceEnabled()) {
            LOG.trace("\n{}", Disassembler.disassemble(unit));
        }
        return unit;
    }

    // ---------------------------------------------------------------------------------------
    // Functions

    /** Compiles the template (once per literal) and emits the closure creation. */
    private FunctionId compileClosure(Expr.Function fn) throws CompileException {
        FunctionInfo info = checked.function(fn);
        FunctionId id = compileFunction(fn, info);
        List<CaptureSource> captures = new ArrayList<>();
        for (Resolved source : info.captures()) {
            if (source instanceof Resolved.Local l) {
                captures.add(new CaptureSource.Local(l.symbol().index()));
            } else if (source instanceof Resolved.Upvalue u) {
                captures.add(new CaptureSource.Upvalue(u.index()));
            } else {
                throw new IllegalStateException("capture must be a local or an upvalue: " + source);
            }
        }
        int template = unit.addConstant(new ConstValue.Function(id));
        fe.emit(new Instruction.MakeClosure(template, captures));
        return id;
    }

    private FunctionId compileFunction(Expr.Function fn, FunctionInfo info) throws CompileException {
        FunctionId id = unit.reserveFunction(info.name());
        FunctionEmitter outer = fe;
        fe = new FunctionEmitter(info.name(), info.arity(), info.localCount(), info.captures().size());
        try {
            fe.pos = fn.pos();
            for (Expr.Clause clause : fn.clauses()) {
                List<Integer> failJumps = new ArrayList<>();
                List<Symbol> bound = new ArrayList<>();
                for (int i = 0; i < clause.params().size(); i++) {
                    Pat param = clause.params().get(i);
                    if (param instanceof Pat.Binding b) {
                        bound.add(checked.declared(b));
                    } else if (!(param instanceof Pat.Wildcard)) {
                        failJumps.add(emitPatternTest(i, param, bound));
                    }
                }
                // Cells are made only once the whole clause matched.
                for (Symbol sym : bound) {
                    boxInPlace(sym);
                }
                compileStatements(clause.body().statements());
                fe.emit(new Instruction.PushNil());
                fe.emit(new Instruction.Return());
                fe.patchJumpsHere(failJumps);
            }
            fe.pos = fn.pos();
            fe.emit(new Instruction.Trap(
                    TrapKind.NO_MATCHING_OVERLOAD, "no clause of `" + fn.displayName() + "` matches the arguments"));
            unit.defineFunction(id, fe.finish());
        } finally {
            fe = outer;
        }
        return id;
    }

    /** Emits {@code TestPattern} + {@code JumpIfFalse}; returns the jump to patch. */
    private int emitPatternTest(int slot, Pat pat, List<Symbol> bound) {
        List<Symbol> binds = new ArrayList<>();
        Pattern pattern = lowerPattern(pat, binds);
        List<Integer> bindSlots = new ArrayList<>();
        for (Symbol sym : binds) {
            bindSlots.add(sym.index());
        }
        bound.addAll(binds);
        int constant = unit.addConstant(new ConstValue.MatchPattern(pattern));
        fe.emit(new Instruction.TestPattern(slot, constant, bindSlots));
        return fe.emitJump(JumpKind.IF_FALSE);
    }

    private Pattern lowerPattern(Pat pat, List<Symbol> binds) {
        if (pat instanceof Pat.Wildcard) {
            return new Pattern.Wildcard();
        }
        if (pat instanceof Pat.Binding b) {
            binds.add(checked.declared(b));
            return new Pattern.Bind();
        }
        if (pat instanceof Pat.Literal l) {
            return new Pattern.Literal(literal(l.value()));
        }
        if (pat instanceof Pat.Destructure d) {
            List<Pattern.Destructure.Field> fields = new ArrayList<>();
            for (Pat.Destructure.Field f : d.fields()) {
                fields.add(new Pattern.Destructure.Field(f.name(), lowerPattern(f.pattern(), binds)));
            }
            return new Pattern.Destructure(fields);
        }
        if (pat instanceof Pat.ArrayPat a) {
            List<Pattern> items = new ArrayList<>();
            for (Pat item : a.items()) {
                items.add(lowerPattern(item, binds));
            }
            return new Pattern.Array(items);
        }
        throw new IllegalStateException("unknown Pat: " + pat);
    }

    private static ConstValue literal(Expr e) {
        if (e instanceof Expr.Nil) {
            return new ConstValue.Nil();
        }
        if (e instanceof Expr.BoolLit b) {
            return new ConstValue.Bool(b.value());
        }
        if (e instanceof Expr.IntLit i) {
            return new ConstValue.Int(i.value());
        }
        if (e instanceof Expr.FloatLit f) {
            return new ConstValue.Float(f.value());
        }
        if (e instanceof Expr.StrLit s) {
            return new ConstValue.Str(s.value());
        }
        throw new IllegalStateException("not a literal: " + e);
    }

    /** Wraps the value already stored in a captured local's slot into a cell. */
    private void boxInPlace(Symbol sym) {
        if (!sym.isCaptured()) {
            return;
        }
        fe.emit(new Instruction.LoadLocal(sym.index()));
        fe.emit(new Instruction.NewCell());
        fe.emit(new Instruction.StoreLocal(sym.index()));
    }

    /** Pops the top of stack into a binding being introduced. */
    private void initLocal(Symbol sym) {
        if (sym.isCaptured()) {
            fe.emit(new Instruction.NewCell());
        }
        fe.emit(new Instruction.StoreLocal(sym.index()));
    }

    // ---------------------------------------------------------------------------------------
    // Statements

    private void compileStatements(List<Stmt> statements) throws CompileException {
        for (Stmt stmt : statements) {
            compileStatement(stmt);
        }
    }

    private void compileBlock(Block block) throws CompileException {
        compileStatements(block.statements());
    }

    private void compileStatement(Stmt stmt) throws CompileException {
        fe.pos = stmt.pos();
        if (stmt instanceof Stmt.Let let) {
            Symbol sym = checked.declared(let);
            if (sym.kind() == SymbolKind.GLOBAL) {
                if (let.init() != null) {
                    compileExpr(let.init());
                    fe.emit(new Instruction.StoreGlobal(sym.index()));
                }
                return;
            }
            if (let.init() != null) {
                compileExpr(let.init());
            } else {
                fe.emit(new Instruction.PushNil());
            }
            initLocal(sym);
        } else if (stmt instanceof Stmt.Assign assign) {
            compileExpr(assign.value());
            store(checked.resolution(assign));
        } else if (stmt instanceof Stmt.SetField s) {
            compileExpr(s.target());
            compileExpr(s.value());
            fe.emit(new Instruction.SetField(s.field()));
        } else if (stmt instanceof Stmt.SetIndex s) {
            compileExpr(s.target());
            compileExpr(s.index());
            compileExpr(s.value());
            fe.emit(new Instruction.SetIndex());
        } else if (stmt instanceof Stmt.FunctionDecl decl) {
            Symbol sym = checked.declared(decl);
            if (sym.kind() == SymbolKind.GLOBAL) {
                // Hoisted into the entry prologue.
                return;
            }
            if (sym.isCaptured()) {
                // The cell exists before the closure so the function can capture itself.
                fe.emit(new Instruction.PushNil());
                fe.emit(new Instruction.NewCell());
                fe.emit(new Instruction.StoreLocal(sym.index()));
                compileClosure(decl.function());
                fe.emit(new Instruction.StoreCell(sym.index()));
            } else {
                compileClosure(decl.function());
                fe.emit(new Instruction.StoreLocal(sym.index()));
            }
        } else if (stmt instanceof Stmt.If s) {
            compileIf(s);
        } else if (stmt instanceof Stmt.Cond s) {
            compileCond(s);
        } else if (stmt instanceof Stmt.While s) {
            compileWhile(s);
        } else if (stmt instanceof Stmt.For s) {
            compileFor(s);
        } else if (stmt instanceof Stmt.Loop s) {
            int start = fe.here();
            LoopContext loop = new LoopContext();
            compileLoopBody(loop, s.body());
            fe.emit(new Instruction.Jump(start));
            closeLoop(loop, start);
        } else if (stmt instanceof Stmt.Break) {
            LoopContext loop = fe.loops.peek();
            if (loop == null) {
                throw new CompileException(stmt.pos(), "`break` outside of a loop");
            }
            loop.breakJumps.add(fe.emitJump(JumpKind.ALWAYS));
        } else if (stmt instanceof Stmt.Continue) {
            LoopContext loop = fe.loops.peek();
            if (loop == null) {
                throw new CompileException(stmt.pos(), "`continue` outside of a loop");
            }
            loop.continueJumps.add(fe.emitJump(JumpKind.ALWAYS));
        } else if (stmt instanceof Stmt.Return r) {
            if (r.value() != null) {
                compileExpr(r.value());
            } else {
                fe.emit(new Instruction.PushNil());
            }
            fe.emit(new Instruction.Return());
        } else if (stmt instanceof Stmt.Disown d) {
            // Drop the reference so the object can be collected.
            Resolved r = checked.resolution(d);
            if (r instanceof Resolved.Local || r instanceof Resolved.Global) {
                fe.emit(new Instruction.PushNil());
                store(r);
            }
        } else if (stmt instanceof Stmt.Scope s) {
            compileBlock(s.body());
        } else if (stmt instanceof Stmt.ExprStmt s) {
            compileExpr(s.expr());
            fe.emit(new Instruction.Pop());
        } else {
            throw new IllegalStateException("unknown Stmt: " + stmt);
        }
    }

    private void compileIf(Stmt.If s) throws CompileException {
        compileExpr(s.condition());
        int toElse = fe.emitJump(JumpKind.IF_FALSE);
        compileBlock(s.thenBlock());
        if (s.elseBlock() == null) {
            fe.patchJump(toElse, fe.here());
            return;
        }
        int toEnd = fe.emitJump(JumpKind.ALWAYS);
        fe.patchJump(toElse, fe.here());
        compileBlock(s.elseBlock());
        fe.patchJump(toEnd, fe.here());
    }

    private void compileCond(Stmt.Cond s) throws CompileException {
        int scrutinee = -1;
        if (s.scrutinee() != null) {
            compileExpr(s.scrutinee());
            scrutinee = fe.allocTemp();
            fe.emit(new Instruction.StoreLocal(scrutinee));
        }

        List<Integer> toEnd = new ArrayList<>();
        boolean exhaustive = false;
        for (Stmt.Cond.Arm arm : s.arms()) {
            fe.pos = arm.pattern().pos();
            List<Integer> toNext = new ArrayList<>();
            if (scrutinee >= 0) {
                Pat pat = arm.pattern();
                if (pat instanceof Pat.Binding b) {
                    fe.emit(new Instruction.LoadLocal(scrutinee));
                    initLocal(checked.declared(b));
                } else if (!(pat instanceof Pat.Wildcard)) {
                    List<Symbol> bound = new ArrayList<>();
                    toNext.add(emitPatternTest(scrutinee, pat, bound));
                    for (Symbol sym : bound) {
                        boxInPlace(sym);
                    }
                }
            }
            if (arm.guard() != null) {
                compileExpr(arm.guard());
                toNext.add(fe.emitJump(JumpKind.IF_FALSE));
            }
            compileBlock(arm.body());
            toEnd.add(fe.emitJump(JumpKind.ALWAYS));
            fe.patchJumpsHere(toNext);
            if (arm.guard() == null && Pat.isIrrefutable(arm.pattern())) {
                exhaustive = true;
                // Later arms can never be reached.
                break;
            }
        }
        if (!exhaustive) {
            fe.pos = s.pos();
            fe.emit(new Instruction.Trap(TrapKind.NO_MATCHING_ARM, "no cond arm matches"));
        }
        fe.patchJumpsHere(toEnd);
    }

    private void compileWhile(Stmt.While s) throws CompileException {
        int start = fe.here();
        compileExpr(s.condition());
        int exit = fe.emitJump(JumpKind.IF_FALSE);
        LoopContext loop = new LoopContext();
        compileLoopBody(loop, s.body());
        fe.emit(new Instruction.Jump(start));
        fe.patchJump(exit, fe.here());
        closeLoop(loop, start);
    }

    private void compileFor(Stmt.For s) throws CompileException {
        int counter = fe.allocTemp();
        int end = fe.allocTemp();
        compileExpr(s.from());
        fe.emit(new Instruction.StoreLocal(counter));
        compileExpr(s.to());
        fe.emit(new Instruction.StoreLocal(end));

        int head = fe.here();
        fe.emit(new Instruction.LoadLocal(counter));
        fe.emit(new Instruction.LoadLocal(end));
        fe.emit(new Instruction.Lt());
        int exit = fe.emitJump(JumpKind.IF_FALSE);

        // A fresh binding per iteration: closures capture the value of their own iteration.
        fe.emit(new Instruction.LoadLocal(counter));
        initLocal(checked.declared(s));

        LoopContext loop = new LoopContext();
        compileLoopBody(loop, s.body());

        int step = fe.here();
        fe.pos = s.pos();
        fe.emit(new Instruction.LoadLocal(counter));
        fe.emit(new Instruction.PushConst(unit.addConstant(new ConstValue.Int(1))));
        fe.emit(new Instruction.Add());
        fe.emit(new Instruction.StoreLocal(counter));
        fe.emit(new Instruction.Jump(head));
        fe.patchJump(exit, fe.here());
        closeLoop(loop, step);
    }

    private void compileLoopBody(LoopContext loop, Block body) throws CompileException {
        fe.loops.push(loop);
        try {
            compileBlock(body);
        } finally {
            fe.loops.pop();
        }
    }

    /** Points pending {@code continue}s at {@code continueTarget} and {@code break}s here. */
    private void closeLoop(LoopContext loop, int continueTarget) {
        for (int pc : loop.continueJumps) {
            fe.patchJump(pc, continueTarget);
        }
        fe.patchJumpsHere(loop.breakJumps);
    }

    // ---------------------------------------------------------------------------------------
    // Expressions

    private void compileExpr(Expr expr) throws CompileException {
        fe.pos = expr.pos();
        if (expr instanceof Expr.Nil) {
            fe.emit(new Instruction.PushNil());
        } else if (expr instanceof Expr.BoolLit b) {
            fe.emit(new Instruction.PushBool(b.value()));
        } else if (Expr.isLiteral(expr)) {
            fe.emit(new Instruction.PushConst(unit.addConstant(literal(expr))));
        } else if (expr instanceof Expr.Var v) {
            load(checked.resolution(v));
        } else if (expr instanceof Expr.Binary b) {
            compileExpr(b.left());
            compileExpr(b.right());
            fe.pos = b.pos();
            fe.emit(binaryInstruction(b));
        } else if (expr instanceof Expr.Logical l) {
            compileLogical(l);
        } else if (expr instanceof Expr.Unary u) {
            compileExpr(u.operand());
            fe.pos = u.pos();
            switch (u.op()) {
                case NEG:
                    fe.emit(new Instruction.Neg());
                    break;
                case NOT:
                    fe.emit(new Instruction.Not());
                    break;
                case BIT_NOT:
                    fe.emit(new Instruction.BitNot());
                    break;
                default:
                    throw new IllegalStateException("unknown UnaryOp: " + u.op());
            }
        } else if (expr instanceof Expr.Call c) {
            compileExpr(c.callee());
            for (Expr arg : c.args()) {
                compileExpr(arg);
            }
            fe.pos = c.pos();
            fe.emit(new Instruction.Call(c.args().size()));
        } else if (expr instanceof Expr.Function fn) {
            compileClosure(fn);
        } else if (expr instanceof Expr.RecordLit r) {
            List<String> names = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            for (Expr.RecordLit.FieldInit f : r.fields()) {
                if (!seen.add(f.name())) {
                    throw new CompileException(r.pos(), "field `" + f.name() + "` appears twice in record literal");
                }
                names.add(f.name());
                compileExpr(f.value());
            }
            fe.pos = r.pos();
            fe.emit(new Instruction.MakeRecord(names));
        } else if (expr instanceof Expr.Field f) {
            compileExpr(f.target());
            fe.pos = f.pos();
            fe.emit(new Instruction.GetField(f.name()));
        } else if (expr instanceof Expr.ArrayLit a) {
            for (Expr item : a.items()) {
                compileExpr(item);
            }
            fe.pos = a.pos();
            fe.emit(new Instruction.MakeArray(a.items().size()));
        } else if (expr instanceof Expr.Index i) {
            compileExpr(i.target());
            compileExpr(i.index());
            fe.pos = i.pos();
            fe.emit(new Instruction.GetIndex());
        } else if (expr instanceof Expr.Borrow b) {
            // Borrowing is a compile-time discipline; at run time it reads the binding.
            load(checked.resolution(b.target()));
        } else {
            throw new IllegalStateException("unknown Expr: " + expr);
        }
    }

    private static Instruction binaryInstruction(Expr.Binary b) {
        switch (b.op()) {
            case ADD:
                return new Instruction.Add();
            case SUB:
                return new Instruction.Sub();
            case MUL:
                return new Instruction.Mul();
            case DIV:
                return new Instruction.Div();
            case MOD:
                return new Instruction.Mod();
            case BIT_AND:
                return new Instruction.BitAnd();
            case BIT_OR:
                return new Instruction.BitOr();
            case BIT_XOR:
                return new Instruction.BitXor();
            case SHL:
                return new Instruction.Shl();
            case SHR:
                return new Instruction.Shr();
            case EQ:
                return new Instruction.Eq();
            case NE:
                return new Instruction.Ne();
            case LT:
                return new Instruction.Lt();
            case LE:
                return new Instruction.Le();
            case GT:
                return new Instruction.Gt();
            case GE:
                return new Instruction.Ge();
            default:
                throw new IllegalStateException("unknown BinaryOp: " + b.op());
        }
    }

    /**
     * {@code a and b}: the right operand runs only if the left is true. Each operand is tested
     * by a conditional jump, which rejects non-booleans, and the result is a fresh boolean.
     */
    private void compileLogical(Expr.Logical l) throws CompileException {
        boolean isAnd = l.op() == LogicalOp.AND;
        JumpKind decide = isAnd ? JumpKind.IF_FALSE : JumpKind.IF_TRUE;

        compileExpr(l.left());
        fe.pos = l.pos();
        int shortLeft = fe.emitJump(decide);
        compileExpr(l.right());
        fe.pos = l.pos();
        int shortRight = fe.emitJump(decide);
        fe.emit(new Instruction.PushBool(isAnd));
        int toEnd = fe.emitJump(JumpKind.ALWAYS);
        fe.patchJump(shortLeft, fe.here());
        fe.patchJump(shortRight, fe.here());
        fe.emit(new Instruction.PushBool(!isAnd));
        fe.patchJump(toEnd, fe.here());
    }

    private void load(Resolved r) {
        if (r instanceof Resolved.Local l) {
            Symbol sym = l.symbol();
            fe.emit(sym.isCaptured() ? new Instruction.LoadCell(sym.index()) : new Instruction.LoadLocal(sym.index()));
        } else if (r instanceof Resolved.Upvalue u) {
            fe.emit(new Instruction.LoadUpvalue(u.index()));
        } else if (r instanceof Resolved.Global g) {
            fe.emit(new Instruction.LoadGlobal(g.symbol().index()));
        } else if (r instanceof Resolved.Host h) {
            fe.emit(new Instruction.LoadHost(h.symbol().index()));
        } else {
            throw new IllegalStateException("unknown Resolved: " + r);
        }
    }

    private void store(Resolved r) {
        if (r instanceof Resolved.Local l) {
            Symbol sym = l.symbol();
            fe.emit(sym.isCaptured() ? new Instruction.StoreCell(sym.index()) : new Instruction.StoreLocal(sym.index()));
        } else if (r instanceof Resolved.Upvalue u) {
            fe.emit(new Instruction.StoreUpvalue(u.index()));
        } else if (r instanceof Resolved.Global g) {
            fe.emit(new Instruction.StoreGlobal(g.symbol().index()));
        } else {
            throw new IllegalStateException("cannot store to " + r);
        }
    }
}
