package dev.kestrel.bytecode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Compiler output and VM input: function templates, constant pool, global and host tables,
 * and the entry points.
 *
 * <p>The unit keeps derived name -&gt; index maps next to its tables; build it through the
 * {@code add*} methods so the two stay consistent. {@link UnitVerifier} checks that every index
 * used by the code resolves.</p>
 */
public final class BytecodeUnit {
    public static final int FORMAT_VERSION = 1;

    private final int version;

    private final List<Function> functions = new ArrayList<>();
    private final List<ConstValue> constants = new ArrayList<>();
    private final Map<ConstValue, Integer> literalIds = new HashMap<>();

    private final List<String> globalNames = new ArrayList<>();
    private final NavigableMap<String, Integer> globalIds = new TreeMap<>();

    private final List<String> hostImports = new ArrayList<>();
    private final NavigableMap<String, Integer> hostImportIds = new TreeMap<>();

    // Global functions: name -> template. The closure itself lives in the global slot of the same name.
    private final NavigableMap<String, FunctionId> entryPoints = new TreeMap<>();

    private FunctionId entry = new FunctionId(0);

    public BytecodeUnit() {
        this(FORMAT_VERSION);
    }

    public BytecodeUnit(int version) {
        this.version = version;
    }

    public int version() {
        return version;
    }

    public List<Function> functions() {
        return Collections.unmodifiableList(functions);
    }

    public List<ConstValue> constants() {
        return Collections.unmodifiableList(constants);
    }

    public List<String> globalNames() {
        return Collections.unmodifiableList(globalNames);
    }

    public NavigableMap<String, Integer> globalIds() {
        return Collections.unmodifiableNavigableMap(globalIds);
    }

    public List<String> hostImports() {
        return Collections.unmodifiableList(hostImports);
    }

    public NavigableMap<String, Integer> hostImportIds() {
        return Collections.unmodifiableNavigableMap(hostImportIds);
    }

    public NavigableMap<String, FunctionId> entryPoints() {
        return Collections.unmodifiableNavigableMap(entryPoints);
    }

    public FunctionId entry() {
        return entry;
    }

    public void setEntry(FunctionId entry) {
        this.entry = Objects.requireNonNull(entry, "entry");
    }

    public Optional<Function> function(FunctionId id) {
        int idx = id.index();
        if (idx >= functions.size()) {
            return Optional.empty();
        }
        return Optional.of(functions.get(idx));
    }

    public Optional<ConstValue> constant(int index) {
        if (index < 0 || index >= constants.size()) {
            return Optional.empty();
        }
        return Optional.of(constants.get(index));
    }

    public Optional<Integer> globalId(String name) {
        return Optional.ofNullable(globalIds.get(name));
    }

    public Optional<Integer> hostImportId(String name) {
        return Optional.ofNullable(hostImportIds.get(name));
    }

    /** Reserves a function id; the body is supplied later through {@link #defineFunction}. */
    public FunctionId reserveFunction(String name) {
        Objects.requireNonNull(name, "name");
        FunctionId id = new FunctionId(functions.size());
        functions.add(null);
        return id;
    }

    public void defineFunction(FunctionId id, Function function) {
        Objects.requireNonNull(function, "function");
        if (functions.get(id.index()) != null) {
            throw new IllegalStateException("function #" + id.index() + " already defined");
        }
        functions.set(id.index(), function);
    }

    public FunctionId addFunction(Function function) {
        FunctionId id = reserveFunction(function.name());
        defineFunction(id, function);
        return id;
    }

    /** Literal constants are interned; patterns and templates always get a fresh entry. */
    public int addConstant(ConstValue value) {
        Objects.requireNonNull(value, "value");
        if (ConstValue.isLiteral(value)) {
            Integer existing = literalIds.get(value);
            if (existing != null) {
                return existing;
            }
        }
        int id = constants.size();
        constants.add(value);
        if (ConstValue.isLiteral(value)) {
            literalIds.put(value, id);
        }
        return id;
    }

    public int addGlobal(String name) {
        Objects.requireNonNull(name, "name");
        if (globalIds.containsKey(name)) {
            throw new IllegalArgumentException("duplicate global `" + name + "`");
        }
        int id = globalNames.size();
        globalNames.add(name);
        globalIds.put(name, id);
        return id;
    }

    public int addHostImport(String name) {
        Objects.requireNonNull(name, "name");
        if (hostImportIds.containsKey(name)) {
            throw new IllegalArgumentException("duplicate host import `" + name + "`");
        }
        int id = hostImports.size();
        hostImports.add(name);
        hostImportIds.put(name, id);
        return id;
    }

    public void addEntryPoint(String name, FunctionId function) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(function, "function");
        if (entryPoints.putIfAbsent(name, function) != null) {
            throw new IllegalArgumentException("duplicate entry point `" + name + "`");
        }
    }
}
