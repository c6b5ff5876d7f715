package dev.kestrel.vm;

import dev.kestrel.ast.SourcePos;
import dev.kestrel.bytecode.BytecodeUnit;
import dev.kestrel.bytecode.CaptureSource;
import dev.kestrel.bytecode.ConstValue;
import dev.kestrel.bytecode.Function;
import dev.kestrel.bytecode.Instruction;
import dev.kestrel.bytecode.Pattern;
import dev.kestrel.bytecode.UnitVerifier;
import dev.kestrel.bytecode.VerifyException;
import dev.kestrel.gc.GcCycle;
import dev.kestrel.gc.Heap;
import dev.kestrel.gc.HeapExhaustedException;
import dev.kestrel.object.ArrayObj;
import dev.kestrel.object.CellObj;
import dev.kestrel.object.ClosureObj;
import dev.kestrel.object.HeapObject;
import dev.kestrel.object.RecordObj;
import dev.kestrel.object.StrObj;
import dev.kestrel.object.Value;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stack-machine interpreter for a {@link BytecodeUnit}.
 *
 * <p>The host drives execution with {@link #step(Long)}. All frames share one operand stack: a
 * call leaves the callee just below the frame base and the frame's locals occupy
 * {@code [base, base + localCount)}, with its temporaries above them.</p>
 *
 * <p>Garbage is collected only at instruction boundaries, when the heap reports that a
 * collection is due. An instruction whose allocation fails is rewound, a full collection runs,
 * and the instruction is retried once; allocating instructions read their operands before
 * allocating and mutate nothing until the allocation succeeded, so the retry is safe.</p>
 */
public final class Vm {
    private static final Logger LOG = LoggerFactory.getLogger(Vm.class);

    private static final int INITIAL_STACK = 256;

    private final BytecodeUnit unit;
    private final VmConfig config;
    private final RuntimeContext ctx;
    private final Heap heap;

    private final ArrayList<Frame> frames = new ArrayList<>();
    private Value[] stack;
    private int sp;

    private VmState state = new VmState.Running();
    private boolean inHostCall = false;
    // name reported for traps raised outside any frame
    private String activation;

    public Vm(BytecodeUnit unit, HostImportRegistry hostImports) throws VmError {
        this(unit, hostImports, VmConfig.defaults());
    }

    public Vm(BytecodeUnit unit, HostImportRegistry hostImports, VmConfig config) throws VmError {
        this.unit = Objects.requireNonNull(unit, "unit");
        this.config = Objects.requireNonNull(config, "config");
        Objects.requireNonNull(hostImports, "hostImports");

        try {
            UnitVerifier.verify(unit);
        } catch (VerifyException e) {
            throw new VmError.InvalidState("invalid bytecode unit: " + e.getMessage());
        }

        // Host imports preflight: every declared import must be installed.
        HostFn[] hostFns = new HostFn[unit.hostImports().size()];
        for (int i = 0; i < hostFns.length; i++) {
            String name = unit.hostImports().get(i);
            HostFn fn = hostImports.resolve(name);
            if (fn == null) {
                throw new VmError.InvalidState("missing host import implementation: `" + name + "`");
            }
            hostFns[i] = fn;
        }
        this.ctx = new RuntimeContext(config.heap(), unit.globalNames(), unit.hostImports(), hostFns);
        this.heap = ctx.heap();

        Function entryFn =
                unit.function(unit.entry())
                        .orElseThrow(() -> new VmError.InvalidState("invalid entry function id " + unit.entry().index()));
        int needed = 1 + entryFn.localCount();
        if (needed > config.maxStack()) {
            throw new VmError.InvalidState(
                    "entry function needs " + needed + " stack slot(s); limit is " + config.maxStack());
        }
        this.stack = new Value[Math.min(config.maxStack(), Math.max(INITIAL_STACK, needed))];
        // slot 0 stands in for the callee
        Arrays.fill(stack, 0, needed, Value.NIL);
        this.sp = needed;
        this.activation = entryFn.name();
        frames.add(new Frame(entryFn, 1, null));

        LOG.debug(
                "vm ready: {} function(s), {} global(s), {} host import(s)",
                unit.functions().size(),
                unit.globalNames().size(),
                hostFns.length);
    }

    public Heap heap() {
        return heap;
    }

    /** Runs a full collection now; only legal between steps. */
    public GcCycle collectGarbage() {
        if (inHostCall) {
            throw new IllegalStateException("cannot collect during a host call");
        }
        return heap.collect(this::visitRoots);
    }

    private void visitRoots(Consumer<Value> visitor) {
        for (int i = 0; i < sp; i++) {
            visitor.accept(stack[i]);
        }
        ctx.visitGlobals(visitor);
    }

    /**
     * Runs until the current activation returns, halts with a runtime error, or has executed
     * {@code fuel} instructions. {@code null} fuel means no limit.
     */
    public StepResult step(Long fuel) {
        if (inHostCall) {
            throw new IllegalStateException("vm re-entered during host call");
        }
        if (state instanceof VmState.Done d) {
            return new StepResult.Done(d.value());
        }
        if (state instanceof VmState.Trapped t) {
            return new StepResult.Trap(t.error());
        }
        if (fuel != null && fuel < 0) {
            throw new IllegalArgumentException("fuel must be >= 0");
        }

        long remaining = fuel == null ? 0 : fuel;
        while (true) {
            if (frames.isEmpty()) {
                return finish();
            }
            if (fuel != null) {
                if (remaining == 0) {
                    return new StepResult.Yield(0);
                }
                remaining -= 1;
            }

            // safepoint
            if (heap.collectionDue()) {
                collectGarbage();
            }

            Frame frame = frames.get(frames.size() - 1);
            int pc = frame.pc;
            if (pc >= frame.fn.code().size()) {
                throw new IllegalStateException("pc " + pc + " out of range in `" + frame.fn.name() + "`");
            }
            Instruction inst = frame.fn.code().get(pc);
            frame.pc = pc + 1;

            try {
                try {
                    execute(frame, inst);
                } catch (HeapExhaustedException e) {
                    frame.pc = pc;
                    LOG.debug("allocation failed in `{}` at pc {}; collecting before retry", frame.fn.name(), pc);
                    collectGarbage();
                    frame.pc = pc + 1;
                    try {
                        execute(frame, inst);
                    } catch (HeapExhaustedException again) {
                        return trap(RuntimeErrorKind.OUT_OF_MEMORY, "heap exhausted: " + again.getMessage(), frame, pc);
                    }
                }
            } catch (VmTrap t) {
                return trap(t.kind, t.getMessage(), frame, pc);
            }
        }
    }

    /**
     * Calls the global function {@code name} with {@code args}, once the entry function (or a
     * previous invocation) has completed. The result is reported like {@link #step(Long)}'s.
     */
    public StepResult invoke(String name, List<HostValue> args) throws VmError {
        return invoke(name, args, null);
    }

    public StepResult invoke(String name, List<HostValue> args, Long fuel) throws VmError {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(args, "args");
        if (inHostCall) {
            throw new IllegalStateException("vm re-entered during host call");
        }
        if (state instanceof VmState.Running) {
            throw new VmError.InvalidState("vm is still running; step it to completion first");
        }
        if (state instanceof VmState.Trapped) {
            throw new VmError.InvalidState("vm has halted with a runtime error");
        }
        if (!unit.entryPoints().containsKey(name)) {
            throw new VmError.InvalidState("no entry point named `" + name + "`");
        }
        int global =
                unit.globalId(name)
                        .orElseThrow(() -> new VmError.InvalidState("entry point `" + name + "` has no global slot"));
        Value callee = ctx.global(global);
        if (callee == null) {
            throw new VmError.InvalidState("entry point `" + name + "` is not initialized");
        }

        state = new VmState.Running();
        activation = name;
        truncate(0);
        try {
            push(callee);
            pushHostArgs(args);
            call(args.size());
        } catch (VmTrap t) {
            return trap(t.kind, t.getMessage(), null, 0);
        }
        return step(fuel);
    }

    private void pushHostArgs(List<HostValue> args) throws VmTrap {
        for (int attempt = 0; ; attempt++) {
            try {
                for (HostValue arg : args) {
                    push(fromHost(arg));
                }
                return;
            } catch (HeapExhaustedException e) {
                truncate(1);
                if (attempt > 0) {
                    throw new VmTrap(RuntimeErrorKind.OUT_OF_MEMORY, "heap exhausted: " + e.getMessage());
                }
                collectGarbage();
            }
        }
    }

    private StepResult finish() {
        Value result = pop();
        HostValue value;
        try {
            value = toHost(result);
        } catch (VmTrap t) {
            return trap(t.kind, t.getMessage(), null, 0);
        }
        state = new VmState.Done(value);
        LOG.debug("`{}` returned {}", activation, value);
        return new StepResult.Done(value);
    }

    private StepResult trap(RuntimeErrorKind kind, String message, Frame frame, int pc) {
        RuntimeError error =
                frame == null
                        ? new RuntimeError(kind, SourcePos.NONE, message, activation, pc)
                        : new RuntimeError(kind, frame.fn.positionAt(pc), message, frame.fn.name(), pc);
        state = new VmState.Trapped(error);
        frames.clear();
        LOG.debug("vm trapped: {}", error);
        return new StepResult.Trap(error);
    }

    private void execute(Frame frame, Instruction inst) throws VmTrap, HeapExhaustedException {
        if (inst instanceof Instruction.PushConst c) {
            ConstValue value = unit.constants().get(c.index());
            if (value instanceof ConstValue.Str s) {
                Value.Ref ref = heap.allocate(new StrObj(s.value()));
                push(ref);
            } else {
                push(immediate(value));
            }
            return;
        }
        if (inst instanceof Instruction.PushNil) {
            push(Value.NIL);
            return;
        }
        if (inst instanceof Instruction.PushBool b) {
            push(Value.of(b.value()));
            return;
        }
        if (inst instanceof Instruction.Pop) {
            pop();
            return;
        }
        if (inst instanceof Instruction.Dup) {
            push(peek(0));
            return;
        }
        if (inst instanceof Instruction.LoadLocal l) {
            push(stack[frame.base + l.slot()]);
            return;
        }
        if (inst instanceof Instruction.StoreLocal s) {
            stack[frame.base + s.slot()] = pop();
            return;
        }
        if (inst instanceof Instruction.NewCell) {
            Value.Ref cell = heap.allocate(new CellObj(peek(0)));
            stack[sp - 1] = cell;
            return;
        }
        if (inst instanceof Instruction.LoadCell l) {
            push(cellAt(stack[frame.base + l.slot()]).get());
            return;
        }
        if (inst instanceof Instruction.StoreCell s) {
            cellAt(stack[frame.base + s.slot()]).set(pop());
            return;
        }
        if (inst instanceof Instruction.LoadUpvalue u) {
            push(cellAt(upvalue(frame, u.index())).get());
            return;
        }
        if (inst instanceof Instruction.StoreUpvalue u) {
            cellAt(upvalue(frame, u.index())).set(pop());
            return;
        }
        if (inst instanceof Instruction.LoadGlobal g) {
            Value v = ctx.global(g.index());
            if (v == null) {
                throw new VmTrap(
                        RuntimeErrorKind.TYPE_ERROR,
                        "global `" + ctx.globalName(g.index()) + "` used before initialization");
            }
            push(v);
            return;
        }
        if (inst instanceof Instruction.StoreGlobal g) {
            ctx.setGlobal(g.index(), pop());
            return;
        }
        if (inst instanceof Instruction.LoadHost h) {
            push(new Value.Host(h.index()));
            return;
        }
        if (inst instanceof Instruction.Neg) {
            Value v = pop();
            if (v instanceof Value.Int i) {
                push(Value.of(-i.value()));
            } else if (v instanceof Value.Float f) {
                push(Value.of(-f.value()));
            } else {
                throw typeError("cannot negate a " + describe(v));
            }
            return;
        }
        if (inst instanceof Instruction.Not) {
            Value v = pop();
            if (!(v instanceof Value.Bool b)) {
                throw typeError("`!` expects a bool, got " + describe(v));
            }
            push(Value.of(!b.value()));
            return;
        }
        if (inst instanceof Instruction.BitNot) {
            push(Value.of(~expectInt("~", pop())));
            return;
        }
        if (inst instanceof Instruction.Eq) {
            Value b = pop();
            Value a = pop();
            push(Value.of(valuesEqual(a, b)));
            return;
        }
        if (inst instanceof Instruction.Ne) {
            Value b = pop();
            Value a = pop();
            push(Value.of(!valuesEqual(a, b)));
            return;
        }
        if (inst instanceof Instruction.Add
                || inst instanceof Instruction.Sub
                || inst instanceof Instruction.Mul
                || inst instanceof Instruction.Div
                || inst instanceof Instruction.Mod) {
            Value b = pop();
            Value a = pop();
            push(arithmetic(inst, a, b));
            return;
        }
        if (inst instanceof Instruction.BitAnd
                || inst instanceof Instruction.BitOr
                || inst instanceof Instruction.BitXor
                || inst instanceof Instruction.Shl
                || inst instanceof Instruction.Shr) {
            Value b = pop();
            Value a = pop();
            push(bitwise(inst, a, b));
            return;
        }
        if (inst instanceof Instruction.Lt
                || inst instanceof Instruction.Le
                || inst instanceof Instruction.Gt
                || inst instanceof Instruction.Ge) {
            Value b = pop();
            Value a = pop();
            push(Value.of(compare(inst, a, b)));
            return;
        }
        if (inst instanceof Instruction.Jump j) {
            frame.pc = j.targetPc();
            return;
        }
        if (inst instanceof Instruction.JumpIfFalse j) {
            if (!condition(pop())) {
                frame.pc = j.targetPc();
            }
            return;
        }
        if (inst instanceof Instruction.JumpIfTrue j) {
            if (condition(pop())) {
                frame.pc = j.targetPc();
            }
            return;
        }
        if (inst instanceof Instruction.Call c) {
            call(c.argc());
            return;
        }
        if (inst instanceof Instruction.Return) {
            Value result = pop();
            frames.remove(frames.size() - 1);
            truncate(frame.base - 1);
            push(result);
            return;
        }
        if (inst instanceof Instruction.MakeClosure m) {
            makeClosure(frame, m);
            return;
        }
        if (inst instanceof Instruction.MakeRecord m) {
            int n = m.fields().size();
            List<Value> values = new ArrayList<>(Arrays.asList(stack).subList(sp - n, sp));
            Value.Ref ref = heap.allocate(new RecordObj(m.fields(), values));
            truncate(sp - n);
            push(ref);
            return;
        }
        if (inst instanceof Instruction.MakeArray m) {
            int n = m.count();
            List<Value> items = new ArrayList<>(Arrays.asList(stack).subList(sp - n, sp));
            Value.Ref ref = heap.allocate(new ArrayObj(items));
            truncate(sp - n);
            push(ref);
            return;
        }
        if (inst instanceof Instruction.GetField g) {
            Value target = pop();
            RecordObj record = expectRecord(target, g.field());
            push(record.get(fieldIndex(record, g.field())));
            return;
        }
        if (inst instanceof Instruction.SetField s) {
            Value value = pop();
            Value target = pop();
            RecordObj record = expectRecord(target, s.field());
            record.set(fieldIndex(record, s.field()), value);
            return;
        }
        if (inst instanceof Instruction.GetIndex) {
            Value index = pop();
            Value target = pop();
            ArrayObj array = expectArray(target);
            push(array.get(arrayIndex(array, index)));
            return;
        }
        if (inst instanceof Instruction.SetIndex) {
            Value value = pop();
            Value index = pop();
            Value target = pop();
            ArrayObj array = expectArray(target);
            array.set(arrayIndex(array, index), value);
            return;
        }
        if (inst instanceof Instruction.TestPattern t) {
            Pattern pattern = ((ConstValue.MatchPattern) unit.constants().get(t.patternConst())).pattern();
            ArrayList<Value> binds = new ArrayList<>(t.bindSlots().size());
            boolean matched = matchPattern(pattern, stack[frame.base + t.slot()], binds);
            if (matched) {
                for (int i = 0; i < binds.size(); i++) {
                    stack[frame.base + t.bindSlots().get(i)] = binds.get(i);
                }
            }
            push(Value.of(matched));
            return;
        }
        if (inst instanceof Instruction.Trap t) {
            switch (t.kind()) {
                case NO_MATCHING_ARM:
                    throw new VmTrap(RuntimeErrorKind.NO_MATCHING_ARM, t.message());
                case NO_MATCHING_OVERLOAD:
                    throw new VmTrap(RuntimeErrorKind.NO_MATCHING_OVERLOAD, t.message());
                default:
                    throw new IllegalStateException("unknown trap kind " + t.kind());
            }
        }
        throw new IllegalStateException("unhandled instruction " + inst);
    }

    private void call(int argc) throws VmTrap {
        int calleeSlot = sp - argc - 1;
        Value callee = stack[calleeSlot];
        if (callee instanceof Value.Host h) {
            callHost(h.importIndex(), calleeSlot, argc);
            return;
        }
        ClosureObj closure = callee instanceof Value.Ref ref && heap.get(ref) instanceof ClosureObj c ? c : null;
        if (closure == null) {
            throw typeError("cannot call a " + describe(callee));
        }
        Function fn = unit.functions().get(closure.functionIndex());
        if (fn.arity() != argc) {
            throw new VmTrap(
                    RuntimeErrorKind.NO_MATCHING_OVERLOAD,
                    "`" + fn.name() + "` expects " + fn.arity() + " argument(s), got " + argc);
        }
        if (frames.size() >= config.maxFrames()) {
            throw new VmTrap(
                    RuntimeErrorKind.STACK_OVERFLOW, "call depth exceeds " + config.maxFrames() + " frame(s)");
        }
        int base = calleeSlot + 1;
        int top = base + fn.localCount();
        reserve(top);
        Arrays.fill(stack, sp, top, Value.NIL);
        sp = top;
        frames.add(new Frame(fn, base, (Value.Ref) callee));
    }

    private void callHost(int index, int calleeSlot, int argc) throws VmTrap {
        String name = ctx.hostName(index);
        ArrayList<HostValue> args = new ArrayList<>(argc);
        for (int i = 0; i < argc; i++) {
            args.add(toHost(stack[calleeSlot + 1 + i]));
        }

        HostValue result;
        inHostCall = true;
        try {
            result = ctx.hostFn(index).call(Collections.unmodifiableList(args));
        } catch (Exception e) {
            LOG.debug("host call `{}` failed", name, e);
            throw typeError("host call `" + name + "` failed: " + e.getMessage());
        } finally {
            inHostCall = false;
        }
        if (result == null) {
            throw typeError("host call `" + name + "` returned null");
        }

        truncate(calleeSlot);
        push(storeHostResult(name, result));
    }

    /**
     * Converts a host result into heap objects. The host is not called again when the heap is
     * full: the partial objects are unreachable, so one collection and a second conversion follow.
     */
    private Value storeHostResult(String name, HostValue result) throws VmTrap {
        try {
            return fromHost(result);
        } catch (HeapExhaustedException e) {
            LOG.debug("heap full storing the result of host call `{}`; collecting before retry", name);
            collectGarbage();
        }
        try {
            return fromHost(result);
        } catch (HeapExhaustedException e) {
            throw new VmTrap(
                    RuntimeErrorKind.OUT_OF_MEMORY,
                    "heap exhausted storing the result of host call `" + name + "`: " + e.getMessage());
        }
    }

    private void makeClosure(Frame frame, Instruction.MakeClosure m) throws VmTrap, HeapExhaustedException {
        ConstValue.Function template = (ConstValue.Function) unit.constants().get(m.templateConst());
        ArrayList<Value.Ref> cells = new ArrayList<>(m.captures().size());
        for (CaptureSource source : m.captures()) {
            Value cell;
            if (source instanceof CaptureSource.Local l) {
                cell = stack[frame.base + l.slot()];
            } else {
                cell = upvalue(frame, ((CaptureSource.Upvalue) source).index());
            }
            cellAt(cell);
            cells.add((Value.Ref) cell);
        }
        Value.Ref ref = heap.allocate(new ClosureObj(template.value().index(), cells));
        push(ref);
    }

    // ---- pattern matching ----

    private boolean matchPattern(Pattern pattern, Value value, ArrayList<Value> binds) {
        if (pattern instanceof Pattern.Wildcard) {
            return true;
        }
        if (pattern instanceof Pattern.Bind) {
            binds.add(value);
            return true;
        }
        if (pattern instanceof Pattern.Literal l) {
            return literalMatches(l.value(), value);
        }
        if (pattern instanceof Pattern.Destructure d) {
            if (!(value instanceof Value.Ref ref) || !(heap.get(ref) instanceof RecordObj record)) {
                return false;
            }
            for (Pattern.Destructure.Field field : d.fields()) {
                int index = record.fieldIndex(field.name());
                if (index < 0 || !matchPattern(field.pattern(), record.get(index), binds)) {
                    return false;
                }
            }
            return true;
        }
        if (pattern instanceof Pattern.Array a) {
            if (!(value instanceof Value.Ref ref) || !(heap.get(ref) instanceof ArrayObj array)) {
                return false;
            }
            if (array.length() != a.items().size()) {
                return false;
            }
            for (int i = 0; i < array.length(); i++) {
                if (!matchPattern(a.items().get(i), array.get(i), binds)) {
                    return false;
                }
            }
            return true;
        }
        throw new IllegalStateException("unknown pattern " + pattern);
    }

    private boolean literalMatches(ConstValue literal, Value value) {
        if (literal instanceof ConstValue.Str s) {
            return value instanceof Value.Ref ref
                    && heap.get(ref) instanceof StrObj str
                    && str.value().equals(s.value());
        }
        return valuesEqual(immediate(literal), value);
    }

    // ---- operators ----

    private boolean valuesEqual(Value a, Value b) {
        if (a.isNumber() && b.isNumber()) {
            if (a instanceof Value.Int x && b instanceof Value.Int y) {
                return x.value() == y.value();
            }
            return toDouble(a) == toDouble(b);
        }
        if (a instanceof Value.Ref x && b instanceof Value.Ref y) {
            if (x.equals(y)) {
                return true;
            }
            return heap.get(x) instanceof StrObj sx
                    && heap.get(y) instanceof StrObj sy
                    && sx.value().equals(sy.value());
        }
        return a.equals(b);
    }

    private Value arithmetic(Instruction op, Value a, Value b) throws VmTrap {
        if (!a.isNumber() || !b.isNumber()) {
            throw typeError(
                    "operator `" + symbol(op) + "` expects numbers, got " + describe(a) + " and " + describe(b));
        }
        if (a instanceof Value.Int x && b instanceof Value.Int y) {
            long l = x.value();
            long r = y.value();
            if (op instanceof Instruction.Add) {
                return Value.of(l + r);
            }
            if (op instanceof Instruction.Sub) {
                return Value.of(l - r);
            }
            if (op instanceof Instruction.Mul) {
                return Value.of(l * r);
            }
            if (r == 0) {
                throw typeError("division by zero");
            }
            return Value.of(op instanceof Instruction.Div ? l / r : l % r);
        }
        double l = toDouble(a);
        double r = toDouble(b);
        if (op instanceof Instruction.Add) {
            return Value.of(l + r);
        }
        if (op instanceof Instruction.Sub) {
            return Value.of(l - r);
        }
        if (op instanceof Instruction.Mul) {
            return Value.of(l * r);
        }
        if (op instanceof Instruction.Div) {
            return Value.of(l / r);
        }
        return Value.of(l % r);
    }

    private Value bitwise(Instruction op, Value a, Value b) throws VmTrap {
        String sym = symbol(op);
        long l = expectInt(sym, a);
        long r = expectInt(sym, b);
        if (op instanceof Instruction.BitAnd) {
            return Value.of(l & r);
        }
        if (op instanceof Instruction.BitOr) {
            return Value.of(l | r);
        }
        if (op instanceof Instruction.BitXor) {
            return Value.of(l ^ r);
        }
        if (r < 0 || r > 63) {
            throw typeError("shift amount " + r + " out of range 0..63");
        }
        return Value.of(op instanceof Instruction.Shl ? l << r : l >> r);
    }

    private boolean compare(Instruction op, Value a, Value b) throws VmTrap {
        if (!a.isNumber() || !b.isNumber()) {
            throw typeError(
                    "operator `" + symbol(op) + "` expects numbers, got " + describe(a) + " and " + describe(b));
        }
        if (a instanceof Value.Int x && b instanceof Value.Int y) {
            long l = x.value();
            long r = y.value();
            if (op instanceof Instruction.Lt) {
                return l < r;
            }
            if (op instanceof Instruction.Le) {
                return l <= r;
            }
            if (op instanceof Instruction.Gt) {
                return l > r;
            }
            return l >= r;
        }
        double l = toDouble(a);
        double r = toDouble(b);
        if (op instanceof Instruction.Lt) {
            return l < r;
        }
        if (op instanceof Instruction.Le) {
            return l <= r;
        }
        if (op instanceof Instruction.Gt) {
            return l > r;
        }
        return l >= r;
    }

    private static String symbol(Instruction op) {
        if (op instanceof Instruction.Add) {
            return "+";
        }
        if (op instanceof Instruction.Sub) {
            return "-";
        }
        if (op instanceof Instruction.Mul) {
            return "*";
        }
        if (op instanceof Instruction.Div) {
            return "/";
        }
        if (op instanceof Instruction.Mod) {
            return "%";
        }
        if (op instanceof Instruction.BitAnd) {
            return "&";
        }
        if (op instanceof Instruction.BitOr) {
            return "|";
        }
        if (op instanceof Instruction.BitXor) {
            return "^";
        }
        if (op instanceof Instruction.Shl) {
            return "<<";
        }
        if (op instanceof Instruction.Shr) {
            return ">>";
        }
        if (op instanceof Instruction.Lt) {
            return "<";
        }
        if (op instanceof Instruction.Le) {
            return "<=";
        }
        if (op instanceof Instruction.Gt) {
            return ">";
        }
        if (op instanceof Instruction.Ge) {
            return ">=";
        }
        return op.getClass().getSimpleName();
    }

    private boolean condition(Value v) throws VmTrap {
        if (!(v instanceof Value.Bool b)) {
            throw typeError("condition must be a bool, got " + describe(v));
        }
        return b.value();
    }

    private long expectInt(String op, Value v) throws VmTrap {
        if (!(v instanceof Value.Int i)) {
            throw typeError("operator `" + op + "` expects ints, got " + describe(v));
        }
        return i.value();
    }

    private static double toDouble(Value v) {
        return v instanceof Value.Int i ? (double) i.value() : ((Value.Float) v).value();
    }

    private static Value immediate(ConstValue c) {
        if (c instanceof ConstValue.Nil) {
            return Value.NIL;
        }
        if (c instanceof ConstValue.Bool b) {
            return Value.of(b.value());
        }
        if (c instanceof ConstValue.Int i) {
            return Value.of(i.value());
        }
        if (c instanceof ConstValue.Float f) {
            return Value.of(f.value());
        }
        throw new IllegalStateException("not an immediate constant: " + c);
    }

    // ---- objects ----

    private RecordObj expectRecord(Value target, String field) throws VmTrap {
        if (target instanceof Value.Ref ref && heap.get(ref) instanceof RecordObj record) {
            return record;
        }
        throw typeError("cannot access field `" + field + "` of a " + describe(target));
    }

    private static int fieldIndex(RecordObj record, String field) throws VmTrap {
        int index = record.fieldIndex(field);
        if (index < 0) {
            throw new VmTrap(RuntimeErrorKind.TYPE_ERROR, "record has no field `" + field + "`");
        }
        return index;
    }

    private ArrayObj expectArray(Value target) throws VmTrap {
        if (target instanceof Value.Ref ref && heap.get(ref) instanceof ArrayObj array) {
            return array;
        }
        throw typeError("cannot index a " + describe(target));
    }

    private int arrayIndex(ArrayObj array, Value index) throws VmTrap {
        if (!(index instanceof Value.Int i)) {
            throw typeError("array index must be an int, got " + describe(index));
        }
        if (i.value() < 0 || i.value() >= array.length()) {
            throw typeError("index " + i.value() + " out of bounds for array of length " + array.length());
        }
        return (int) i.value();
    }

    private CellObj cellAt(Value v) {
        if (v instanceof Value.Ref ref && heap.get(ref) instanceof CellObj cell) {
            return cell;
        }
        throw new IllegalStateException("expected a cell, found " + v);
    }

    private Value.Ref upvalue(Frame frame, int index) {
        if (frame.closure == null) {
            throw new IllegalStateException("`" + frame.fn.name() + "` has no closure to read upvalues from");
        }
        return ((ClosureObj) heap.get(frame.closure)).cell(index);
    }

    private String describe(Value v) {
        if (v instanceof Value.Ref ref) {
            return heap.isLive(ref) ? heap.get(ref).tag().displayName() : "dangling reference";
        }
        if (v instanceof Value.Host) {
            return "host function";
        }
        return v.kind();
    }

    private VmTrap typeError(String message) {
        return new VmTrap(RuntimeErrorKind.TYPE_ERROR, message);
    }

    // ---- host boundary ----

    private HostValue toHost(Value v) throws VmTrap {
        return toHost(v, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private HostValue toHost(Value v, Set<HeapObject> path) throws VmTrap {
        if (v instanceof Value.Nil) {
            return new HostValue.Nil();
        }
        if (v instanceof Value.Bool b) {
            return new HostValue.Bool(b.value());
        }
        if (v instanceof Value.Int i) {
            return new HostValue.Int(i.value());
        }
        if (v instanceof Value.Float f) {
            return new HostValue.Float(f.value());
        }
        if (v instanceof Value.Host h) {
            return new HostValue.Function(ctx.hostName(h.importIndex()));
        }
        HeapObject obj = heap.get((Value.Ref) v);
        if (obj instanceof StrObj s) {
            return new HostValue.Str(s.value());
        }
        if (obj instanceof ClosureObj c) {
            return new HostValue.Function(unit.functions().get(c.functionIndex()).name());
        }
        if (!path.add(obj)) {
            throw typeError("cyclic " + obj.tag().displayName() + " cannot be passed to the host");
        }
        try {
            if (obj instanceof RecordObj r) {
                LinkedHashMap<String, HostValue> fields = new LinkedHashMap<>();
                for (int i = 0; i < r.fieldNames().size(); i++) {
                    fields.put(r.fieldNames().get(i), toHost(r.get(i), path));
                }
                return new HostValue.Record(fields);
            }
            if (obj instanceof ArrayObj a) {
                ArrayList<HostValue> items = new ArrayList<>(a.length());
                for (int i = 0; i < a.length(); i++) {
                    items.add(toHost(a.get(i), path));
                }
                return new HostValue.Array(items);
            }
            throw new IllegalStateException("a cell escaped into a value position");
        } finally {
            path.remove(obj);
        }
    }

    private Value fromHost(HostValue v) throws VmTrap, HeapExhaustedException {
        if (v instanceof HostValue.Nil) {
            return Value.NIL;
        }
        if (v instanceof HostValue.Bool b) {
            return Value.of(b.value());
        }
        if (v instanceof HostValue.Int i) {
            return Value.of(i.value());
        }
        if (v instanceof HostValue.Float f) {
            return Value.of(f.value());
        }
        if (v instanceof HostValue.Str s) {
            return heap.allocate(new StrObj(s.value()));
        }
        if (v instanceof HostValue.Array a) {
            ArrayList<Value> items = new ArrayList<>(a.items().size());
            for (HostValue item : a.items()) {
                items.add(fromHost(item));
            }
            return heap.allocate(new ArrayObj(items));
        }
        if (v instanceof HostValue.Record r) {
            ArrayList<String> names = new ArrayList<>(r.fields().size());
            ArrayList<Value> values = new ArrayList<>(r.fields().size());
            for (Map.Entry<String, HostValue> e : r.fields().entrySet()) {
                names.add(e.getKey());
                values.add(fromHost(e.getValue()));
            }
            return heap.allocate(new RecordObj(names, values));
        }
        String name = ((HostValue.Function) v).name();
        if (unit.entryPoints().containsKey(name)) {
            Integer global = unit.globalId(name).orElse(null);
            Value fn = global == null ? null : ctx.global(global);
            if (fn != null) {
                return fn;
            }
        }
        Integer host = unit.hostImportId(name).orElse(null);
        if (host != null) {
            return new Value.Host(host);
        }
        throw typeError("unknown function `" + name + "`");
    }

    // ---- operand stack ----

    private void push(Value v) throws VmTrap {
        reserve(sp + 1);
        stack[sp++] = v;
    }

    private Value pop() {
        Value v = stack[--sp];
        stack[sp] = null;
        return v;
    }

    private Value peek(int depth) {
        return stack[sp - 1 - depth];
    }

    private void truncate(int newSp) {
        Arrays.fill(stack, newSp, sp, null);
        sp = newSp;
    }

    private void reserve(int slots) throws VmTrap {
        if (slots <= stack.length) {
            return;
        }
        if (slots > config.maxStack()) {
            throw new VmTrap(
                    RuntimeErrorKind.STACK_OVERFLOW, "operand stack exceeds " + config.maxStack() + " slot(s)");
        }
        int capacity = stack.length;
        while (capacity < slots) {
            capacity = (int) Math.min((long) capacity * 2, config.maxStack());
        }
        stack = Arrays.copyOf(stack, capacity);
    }

    private static final class VmTrap extends Exception {
        private final RuntimeErrorKind kind;

        VmTrap(RuntimeErrorKind kind, String message) {
            super(message, null, false, false);
            this.kind = kind;
        }
    }
}
