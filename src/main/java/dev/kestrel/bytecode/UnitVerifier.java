package dev.kestrel.bytecode;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Structural checks on a {@link BytecodeUnit}: table consistency and index ranges.
 *
 * <p>This does not simulate the operand stack; stack balance is the compiler's job and
 * underflow is caught by the VM as an internal error.</p>
 */
public final class UnitVerifier {
    private UnitVerifier() {}

    public static void verify(BytecodeUnit unit) throws VerifyException {
        if (unit.version() != BytecodeUnit.FORMAT_VERSION) {
            throw new VerifyException(
                    "unsupported unit version " + unit.version() + " (expected " + BytecodeUnit.FORMAT_VERSION + ")");
        }

        List<Function> functions = unit.functions();
        if (functions.isEmpty()) {
            throw new VerifyException("unit has no functions");
        }
        for (int i = 0; i < functions.size(); i++) {
            if (functions.get(i) == null) {
                throw new VerifyException("function #" + i + " was reserved but never defined");
            }
        }

        // Entry validity.
        int entry = unit.entry().index();
        if (entry >= functions.size()) {
            throw new VerifyException(
                    "entry function id " + entry + " out of range (functions=" + functions.size() + ")");
        }
        Function entryFn = functions.get(entry);
        if (entryFn.arity() != 0 || entryFn.captureCount() != 0) {
            throw new VerifyException("entry function `" + entryFn.name() + "` must take no arguments and no captures");
        }

        // Recompute name -> id maps and ensure they match the stored ones.
        Map<String, Integer> expectedGlobalIds = new TreeMap<>();
        for (int i = 0; i < unit.globalNames().size(); i++) {
            if (expectedGlobalIds.put(unit.globalNames().get(i), i) != null) {
                throw new VerifyException("duplicate global name `" + unit.globalNames().get(i) + "`");
            }
        }
        if (!expectedGlobalIds.equals(unit.globalIds())) {
            throw new VerifyException("global ids map does not match global names table");
        }

        Map<String, Integer> expectedHostIds = new TreeMap<>();
        for (int i = 0; i < unit.hostImports().size(); i++) {
            if (expectedHostIds.put(unit.hostImports().get(i), i) != null) {
                throw new VerifyException("duplicate host import name `" + unit.hostImports().get(i) + "`");
            }
        }
        if (!expectedHostIds.equals(unit.hostImportIds())) {
            throw new VerifyException("host import ids map does not match host imports table");
        }

        for (Map.Entry<String, FunctionId> e : unit.entryPoints().entrySet()) {
            if (unit.globalId(e.getKey()).isEmpty()) {
                throw new VerifyException("entry point `" + e.getKey() + "` has no global slot");
            }
            if (e.getValue().index() >= functions.size()) {
                throw new VerifyException(
                        "entry point `" + e.getKey() + "` points to invalid function id " + e.getValue().index());
            }
            if (functions.get(e.getValue().index()).captureCount() != 0) {
                throw new VerifyException("entry point `" + e.getKey() + "` must not capture variables");
            }
        }

        // Constant pool.
        for (int i = 0; i < unit.constants().size(); i++) {
            ConstValue c = unit.constants().get(i);
            if (c instanceof ConstValue.Function f && f.value().index() >= functions.size()) {
                throw new VerifyException("constant #" + i + " references invalid function id " + f.value().index());
            }
        }

        for (Function func : functions) {
            verifyFunction(unit, func);
        }
    }

    private static void verifyFunction(BytecodeUnit unit, Function func) throws VerifyException {
        int codeLen = func.code().size();
        if (codeLen == 0) {
            throw new VerifyException("function `" + func.name() + "` has no code");
        }
        Instruction last = func.code().get(codeLen - 1);
        if (!(last instanceof Instruction.Return
                || last instanceof Instruction.Jump
                || last instanceof Instruction.Trap)) {
            throw new VerifyException("function `" + func.name() + "` may run past its last instruction");
        }
        for (int pc = 0; pc < codeLen; pc++) {
            verifyInstruction(unit, func, pc, func.code().get(pc));
        }
    }

    private static void verifySlot(Function func, int slot, String context) throws VerifyException {
        if (slot < 0 || slot >= func.localCount()) {
            throw new VerifyException(
                    context + ": slot " + slot + " out of range (local_count=" + func.localCount() + ")");
        }
    }

    private static void verifyPc(int codeLen, int pc, String context) throws VerifyException {
        if (pc < 0 || pc >= codeLen) {
            throw new VerifyException(context + ": pc " + pc + " out of range (code_len=" + codeLen + ")");
        }
    }

    private static void verifyIndex(int index, int size, String what, String context) throws VerifyException {
        if (index < 0 || index >= size) {
            throw new VerifyException(context + ": " + what + " " + index + " out of range (" + size + ")");
        }
    }

    private static ConstValue constant(BytecodeUnit unit, int index, String context) throws VerifyException {
        verifyIndex(index, unit.constants().size(), "constant", context);
        return unit.constants().get(index);
    }

    private static void verifyInstruction(BytecodeUnit unit, Function func, int pc, Instruction inst)
            throws VerifyException {
        String here = "function `" + func.name() + "` pc " + pc;
        int codeLen = func.code().size();

        if (inst instanceof Instruction.PushConst i) {
            ConstValue c = constant(unit, i.index(), here);
            if (!ConstValue.isLiteral(c)) {
                throw new VerifyException(here + ": PushConst of non-literal constant " + c);
            }
        } else if (inst instanceof Instruction.LoadLocal i) {
            verifySlot(func, i.slot(), here);
        } else if (inst instanceof Instruction.StoreLocal i) {
            verifySlot(func, i.slot(), here);
        } else if (inst instanceof Instruction.LoadCell i) {
            verifySlot(func, i.slot(), here);
        } else if (inst instanceof Instruction.StoreCell i) {
            verifySlot(func, i.slot(), here);
        } else if (inst instanceof Instruction.LoadUpvalue i) {
            verifyIndex(i.index(), func.captureCount(), "upvalue", here);
        } else if (inst instanceof Instruction.StoreUpvalue i) {
            verifyIndex(i.index(), func.captureCount(), "upvalue", here);
        } else if (inst instanceof Instruction.LoadGlobal i) {
            verifyIndex(i.index(), unit.globalNames().size(), "global", here);
        } else if (inst instanceof Instruction.StoreGlobal i) {
            verifyIndex(i.index(), unit.globalNames().size(), "global", here);
        } else if (inst instanceof Instruction.LoadHost i) {
            verifyIndex(i.index(), unit.hostImports().size(), "host import", here);
        } else if (inst instanceof Instruction.Jump i) {
            verifyPc(codeLen, i.targetPc(), here + ": jump target");
        } else if (inst instanceof Instruction.JumpIfFalse i) {
            verifyPc(codeLen, i.targetPc(), here + ": jump target");
        } else if (inst instanceof Instruction.JumpIfTrue i) {
            verifyPc(codeLen, i.targetPc(), here + ": jump target");
        } else if (inst instanceof Instruction.Call i) {
            if (i.argc() < 0) {
                throw new VerifyException(here + ": negative argument count " + i.argc());
            }
        } else if (inst instanceof Instruction.MakeArray i) {
            if (i.count() < 0) {
                throw new VerifyException(here + ": negative array length " + i.count());
            }
        } else if (inst instanceof Instruction.MakeClosure i) {
            ConstValue c = constant(unit, i.templateConst(), here);
            if (!(c instanceof ConstValue.Function template)) {
                throw new VerifyException(here + ": MakeClosure needs a function constant, got " + c);
            }
            Function target = unit.functions().get(template.value().index());
            if (target.captureCount() != i.captures().size()) {
                throw new VerifyException(
                        here
                                + ": closure over `"
                                + target.name()
                                + "` supplies "
                                + i.captures().size()
                                + " capture(s), template expects "
                                + target.captureCount());
            }
            for (CaptureSource src : i.captures()) {
                if (src instanceof CaptureSource.Local l) {
                    verifySlot(func, l.slot(), here + ": capture");
                } else if (src instanceof CaptureSource.Upvalue u) {
                    verifyIndex(u.index(), func.captureCount(), "capture upvalue", here);
                }
            }
        } else if (inst instanceof Instruction.TestPattern i) {
            verifySlot(func, i.slot(), here + ": scrutinee");
            ConstValue c = constant(unit, i.patternConst(), here);
            if (!(c instanceof ConstValue.MatchPattern mp)) {
                throw new VerifyException(here + ": TestPattern needs a pattern constant, got " + c);
            }
            int binds = Pattern.countBinds(mp.pattern());
            if (binds != i.bindSlots().size()) {
                throw new VerifyException(
                        here + ": pattern binds " + binds + " value(s) but " + i.bindSlots().size() + " slot(s) given");
            }
            for (int slot : i.bindSlots()) {
                verifySlot(func, slot, here + ": bind");
            }
        }
    }
}
