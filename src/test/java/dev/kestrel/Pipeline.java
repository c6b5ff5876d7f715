package dev.kestrel;

import dev.kestrel.analysis.AnalysisException;
import dev.kestrel.analysis.StaticAnalyzer;
import dev.kestrel.ast.Program;
import dev.kestrel.bytecode.BytecodeUnit;
import dev.kestrel.compiler.BytecodeCompiler;
import dev.kestrel.compiler.CompileException;
import dev.kestrel.vm.HostImportRegistry;
import dev.kestrel.vm.StepResult;
import dev.kestrel.vm.Vm;
import dev.kestrel.vm.VmConfig;
import dev.kestrel.vm.VmError;

/** Analyze, compile and run in one call. */
public final class Pipeline {
    private Pipeline() {}

    public static BytecodeUnit compile(Program program) throws AnalysisException, CompileException {
        return BytecodeCompiler.compile(StaticAnalyzer.analyze(program));
    }

    public static Vm load(Program program, HostImportRegistry hosts, VmConfig config)
            throws AnalysisException, CompileException, VmError {
        return new Vm(compile(program), hosts, config);
    }

    public static StepResult run(Program program) throws AnalysisException, CompileException, VmError {
        return run(program, new HostImportRegistry(), VmConfig.defaults());
    }

    public static StepResult run(Program program, HostImportRegistry hosts)
            throws AnalysisException, CompileException, VmError {
        return run(program, hosts, VmConfig.defaults());
    }

    public static StepResult run(Program program, HostImportRegistry hosts, VmConfig config)
            throws AnalysisException, CompileException, VmError {
        return load(program, hosts, config).step(null);
    }
}
