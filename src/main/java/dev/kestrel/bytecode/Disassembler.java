package dev.kestrel.bytecode;

import java.util.List;

/** Human-readable listing of a {@link BytecodeUnit}, for debug logs and tests. */
public final class Disassembler {
    private Disassembler() {}

    public static String disassemble(BytecodeUnit unit) {
        StringBuilder out = new StringBuilder();
        out.append("== unit v").append(unit.version()).append(" ==\n");
        out.append("host_imports: ").append(unit.hostImports().size()).append('\n');
        for (int i = 0; i < unit.hostImports().size(); i++) {
            out.append("  [").append(i).append("] ").append(unit.hostImports().get(i)).append('\n');
        }
        out.append("globals: ").append(unit.globalNames().size()).append('\n');
        for (int i = 0; i < unit.globalNames().size(); i++) {
            out.append("  [").append(i).append("] ").append(unit.globalNames().get(i));
            FunctionId fn = unit.entryPoints().get(unit.globalNames().get(i));
            if (fn != null) {
                out.append(" = fn#").append(fn.index());
            }
            out.append('\n');
        }
        out.append("constants: ").append(unit.constants().size()).append('\n');
        for (int i = 0; i < unit.constants().size(); i++) {
            out.append("  [").append(i).append("] ").append(renderConst(unit.constants().get(i))).append('\n');
        }
        for (int i = 0; i < unit.functions().size(); i++) {
            Function fn = unit.functions().get(i);
            if (fn == null) {
                out.append("fn#").append(i).append(" <undefined>\n");
                continue;
            }
            out.append("fn#")
                    .append(i)
                    .append(' ')
                    .append(fn.name())
                    .append(" (arity=")
                    .append(fn.arity())
                    .append(", locals=")
                    .append(fn.localCount())
                    .append(", captures=")
                    .append(fn.captureCount())
                    .append(")\n");
            appendCode(out, unit, fn);
        }
        out.append("entry: fn#").append(unit.entry().index()).append('\n');
        return out.toString();
    }

    private static void appendCode(StringBuilder out, BytecodeUnit unit, Function fn) {
        List<Instruction> code = fn.code();
        for (int pc = 0; pc < code.size(); pc++) {
            out.append(String.format("  %4d  %s", pc, render(unit, code.get(pc))));
            if (fn.positionAt(pc).isKnown()) {
                out.append("  ; ").append(fn.positionAt(pc).line()).append(':').append(fn.positionAt(pc).column());
            }
            out.append('\n');
        }
    }

    public static String render(BytecodeUnit unit, Instruction inst) {
        if (inst instanceof Instruction.PushConst c) {
            String value = unit.constant(c.index()).map(Disassembler::renderConst).orElse("?");
            return "PushConst #" + c.index() + " (" + value + ")";
        }
        if (inst instanceof Instruction.PushBool b) {
            return "PushBool " + b.value();
        }
        if (inst instanceof Instruction.LoadLocal i) {
            return "LoadLocal " + i.slot();
        }
        if (inst instanceof Instruction.StoreLocal i) {
            return "StoreLocal " + i.slot();
        }
        if (inst instanceof Instruction.LoadCell i) {
            return "LoadCell " + i.slot();
        }
        if (inst instanceof Instruction.StoreCell i) {
            return "StoreCell " + i.slot();
        }
        if (inst instanceof Instruction.LoadUpvalue i) {
            return "LoadUpvalue " + i.index();
        }
        if (inst instanceof Instruction.StoreUpvalue i) {
            return "StoreUpvalue " + i.index();
        }
        if (inst instanceof Instruction.LoadGlobal i) {
            return "LoadGlobal " + i.index() + " (" + name(unit.globalNames(), i.index()) + ")";
        }
        if (inst instanceof Instruction.StoreGlobal i) {
            return "StoreGlobal " + i.index() + " (" + name(unit.globalNames(), i.index()) + ")";
        }
        if (inst instanceof Instruction.LoadHost i) {
            return "LoadHost " + i.index() + " (" + name(unit.hostImports(), i.index()) + ")";
        }
        if (inst instanceof Instruction.Jump j) {
            return "Jump -> " + j.targetPc();
        }
        if (inst instanceof Instruction.JumpIfFalse j) {
            return "JumpIfFalse -> " + j.targetPc();
        }
        if (inst instanceof Instruction.JumpIfTrue j) {
            return "JumpIfTrue -> " + j.targetPc();
        }
        if (inst instanceof Instruction.Call c) {
            return "Call " + c.argc();
        }
        if (inst instanceof Instruction.MakeClosure c) {
            return "MakeClosure #" + c.templateConst() + " " + c.captures();
        }
        if (inst instanceof Instruction.MakeRecord r) {
            return "MakeRecord " + r.fields();
        }
        if (inst instanceof Instruction.GetField f) {
            return "GetField ." + f.field();
        }
        if (inst instanceof Instruction.SetField f) {
            return "SetField ." + f.field();
        }
        if (inst instanceof Instruction.MakeArray a) {
            return "MakeArray " + a.count();
        }
        if (inst instanceof Instruction.TestPattern t) {
            return "TestPattern " + t.slot() + " #" + t.patternConst() + " -> " + t.bindSlots();
        }
        if (inst instanceof Instruction.Trap t) {
            return "Trap " + t.kind() + " \"" + t.message() + "\"";
        }
        // Operand-free instructions.
        return inst.getClass().getSimpleName();
    }

    private static String name(List<String> table, int index) {
        return index >= 0 && index < table.size() ? table.get(index) : "?";
    }

    private static String renderConst(ConstValue c) {
        if (c instanceof ConstValue.Nil) {
            return "nil";
        }
        if (c instanceof ConstValue.Bool b) {
            return Boolean.toString(b.value());
        }
        if (c instanceof ConstValue.Int i) {
            return Long.toString(i.value());
        }
        if (c instanceof ConstValue.Float f) {
            return Double.toString(f.value());
        }
        if (c instanceof ConstValue.Str s) {
            return "\"" + s.value() + "\"";
        }
        if (c instanceof ConstValue.Function f) {
            return "fn#" + f.value().index();
        }
        if (c instanceof ConstValue.MatchPattern p) {
            return "pattern " + renderPattern(p.pattern());
        }
        throw new IllegalStateException("unknown ConstValue: " + c);
    }

    private static String renderPattern(Pattern p) {
        if (p instanceof Pattern.Wildcard) {
            return "_";
        }
        if (p instanceof Pattern.Bind) {
            return "$";
        }
        if (p instanceof Pattern.Literal l) {
            return renderConst(l.value());
        }
        if (p instanceof Pattern.Destructure d) {
            StringBuilder sb = new StringBuilder("{");
            for (int i = 0; i < d.fields().size(); i++) {
                if (i != 0) {
                    sb.append(", ");
                }
                sb.append(d.fields().get(i).name()).append(": ").append(renderPattern(d.fields().get(i).pattern()));
            }
            return sb.append('}').toString();
        }
        if (p instanceof Pattern.Array a) {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < a.items().size(); i++) {
                if (i != 0) {
                    sb.append(", ");
                }
                sb.append(renderPattern(a.items().get(i)));
            }
            return sb.append(']').toString();
        }
        throw new IllegalStateException("unknown Pattern: " + p);
    }
}
