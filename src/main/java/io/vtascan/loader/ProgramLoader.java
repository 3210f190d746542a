package io.vtascan.loader;

import io.vtascan.ir.Builtin;
import io.vtascan.ir.CallCommon;
import io.vtascan.ir.Const;
import io.vtascan.ir.FunctionBuilder;
import io.vtascan.ir.Global;
import io.vtascan.ir.Phi;
import io.vtascan.ir.Program;
import io.vtascan.ir.ProgramBuilder;
import io.vtascan.ir.Select;
import io.vtascan.ir.UnOp;
import io.vtascan.ir.Value;
import io.vtascan.types.ChanDir;
import io.vtascan.types.ChanType;
import io.vtascan.types.NamedType;
import io.vtascan.types.PointerType;
import io.vtascan.types.Signature;
import io.vtascan.types.StructType;
import io.vtascan.types.Type;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads YAML program descriptions.
 * <p>
 * A description names the package and lists its named types, globals and functions:
 *
 * <pre>
 * package: P
 * types:
 *   C: int
 *   I: interface{f()}
 * functions:
 *   - name: f
 *     receiver: C
 *     body:
 *       - {op: return}
 *   - name: g
 *     body:
 *       - {op: make_interface, name: t0, type: I, x: "0:C"}
 *       - {op: invoke, recv: t0, method: f}
 *       - {op: return}
 * want:
 *   - "Constant(P.C) -> Local(t0)"
 * </pre>
 *
 * Functions declare {@code signature} (default {@code func()}), optional {@code receiver}
 * ({@code C} or {@code *C}), {@code typeArgs}, {@code params} names, {@code freeVars},
 * {@code synthetic} and nested {@code closures} (named {@code parent$1}, {@code parent$2}, ...).
 * Operands name a parameter, free variable or register of the function, a global or a function;
 * {@code literal:type} denotes a constant. Phi edges may name registers defined later.
 */
public class ProgramLoader {

    private static final Logger logger = LogManager.getLogger(ProgramLoader.class);

    /**
     * Load a program description from a file.
     */
    public LoadedProgram load(Path path) throws ProgramLoadException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return load(reader, path.toString());
        } catch (IOException e) {
            throw new ProgramLoadException("Cannot read program description " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Load a program description held in a string.
     */
    public LoadedProgram parse(String yaml) throws ProgramLoadException {
        return load(new StringReader(yaml), "<inline>");
    }

    @SuppressWarnings("unchecked")
    public LoadedProgram load(Reader reader, String source) throws ProgramLoadException {
        Object data;
        try {
            data = new Yaml().load(reader);
        } catch (YAMLException e) {
            throw new ProgramLoadException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
        if (!(data instanceof Map)) {
            throw new ProgramLoadException("Empty or invalid program description: " + source);
        }
        LoadedProgram loaded = new Session(source, (Map<String, Object>) data).load();
        logger.debug("Loaded {} from {}", loaded.program(), source);
        return loaded;
    }

    private record Declaration(FunctionBuilder builder, Map<String, Object> entry) {}

    /**
     * State of loading one description.
     */
    private static final class Session {

        private final String source;
        private final Map<String, Object> data;
        private final List<Declaration> declarations = new ArrayList<>();
        private ProgramBuilder program;
        private String context;

        Session(String source, Map<String, Object> data) {
            this.source = source;
            this.data = data;
        }

        LoadedProgram load() throws ProgramLoadException {
            try {
                context = "package";
                program = new ProgramBuilder(string(data, "package", null));
                loadTypes();
                loadGlobals();
                context = "functions";
                for (Map<String, Object> entry : maps(data, "functions")) {
                    declare(entry, null);
                }
                for (Declaration declaration : declarations) {
                    loadBody(declaration);
                }
                context = "want";
                List<String> want = new ArrayList<>();
                for (Object line : list(data, "want")) {
                    want.add(String.valueOf(line));
                }
                context = "program";
                return new LoadedProgram(program.build(), want);
            } catch (IllegalArgumentException | IllegalStateException | ClassCastException e) {
                throw new ProgramLoadException(source + ": " + context + ": " + e.getMessage(), e);
            }
        }

        private void loadTypes() {
            Map<String, Object> types = map(data, "types");
            // declare all names first so definitions can refer to each other
            Map<String, NamedType> declared = new LinkedHashMap<>();
            for (String key : types.keySet()) {
                if (!key.contains("[")) {
                    context = "type " + key;
                    declared.put(key, program.declareType(key));
                }
            }
            for (String key : types.keySet()) {
                int bracket = key.indexOf('[');
                if (bracket >= 0) {
                    context = "type " + key;
                    if (!key.endsWith("]")) {
                        throw new IllegalArgumentException("malformed instantiation " + key);
                    }
                    List<Type> args = new ArrayList<>();
                    for (String arg : splitTypeArgs(key.substring(bracket + 1, key.length() - 1))) {
                        args.add(program.types().parse(arg));
                    }
                    declared.put(key, program.declareType(key.substring(0, bracket), args));
                }
            }
            for (Map.Entry<String, Object> entry : types.entrySet()) {
                context = "type " + entry.getKey();
                declared.get(entry.getKey()).setUnderlying(program.types().parse(String.valueOf(entry.getValue())));
            }
        }

        private void loadGlobals() {
            for (Map.Entry<String, Object> entry : map(data, "globals").entrySet()) {
                context = "global " + entry.getKey();
                program.global(entry.getKey(), program.types().parse(String.valueOf(entry.getValue())));
            }
        }

        private void declare(Map<String, Object> entry, FunctionBuilder parent) {
            Signature signature = program.types().parseSignature(string(entry, "signature", "func()"));
            FunctionBuilder fb;
            if (parent != null) {
                fb = parent.closure(signature);
            } else {
                String name = string(entry, "name", null);
                context = "function " + name;
                String receiver = string(entry, "receiver", "");
                List<Object> typeArgs = list(entry, "typeArgs");
                if (!receiver.isEmpty()) {
                    boolean pointer = receiver.startsWith("*");
                    NamedType recvType = program.namedType(pointer ? receiver.substring(1).trim() : receiver);
                    fb = program.method(recvType, pointer, name, signature, optionalString(entry, "synthetic"));
                } else if (!typeArgs.isEmpty()) {
                    List<Type> args = new ArrayList<>();
                    for (Object arg : typeArgs) {
                        args.add(program.types().parse(String.valueOf(arg)));
                    }
                    fb = program.instantiation(name, args, signature);
                } else {
                    fb = program.function(name, signature);
                }
            }
            context = "function " + fb.function().name();

            List<Object> names = list(entry, "params");
            List<Type> paramTypes = signature.params();
            if (!names.isEmpty() && names.size() != paramTypes.size()) {
                throw new IllegalArgumentException(names.size() + " parameter names for " + paramTypes.size()
                        + " parameters");
            }
            for (int i = 0; i < paramTypes.size(); i++) {
                fb.param(names.isEmpty() ? "p" + i : String.valueOf(names.get(i)), paramTypes.get(i));
            }
            Map<String, Object> freeVars = map(entry, "freeVars");
            if (!freeVars.isEmpty() && parent == null) {
                throw new IllegalArgumentException("only closures have free variables");
            }
            for (Map.Entry<String, Object> fv : freeVars.entrySet()) {
                fb.freeVar(fv.getKey(), program.types().parse(String.valueOf(fv.getValue())));
            }

            declarations.add(new Declaration(fb, entry));
            for (Map<String, Object> closure : maps(entry, "closures")) {
                declare(closure, fb);
            }
        }

        private void loadBody(Declaration declaration) {
            FunctionBuilder fb = declaration.builder();
            Map<Phi, List<Object>> phiEdges = new LinkedHashMap<>();
            List<Map<String, Object>> body = maps(declaration.entry(), "body");
            for (int i = 0; i < body.size(); i++) {
                Map<String, Object> instr = body.get(i);
                context = fb.function().name() + ": instruction " + i + " (" + instr.get("op") + ")";
                emit(fb, instr, phiEdges);
            }
            for (Map.Entry<Phi, List<Object>> entry : phiEdges.entrySet()) {
                context = fb.function().name() + ": phi " + entry.getKey().name();
                for (Object edge : entry.getValue()) {
                    entry.getKey().addEdge(ref(fb, edge));
                }
            }
        }

        private void emit(FunctionBuilder fb, Map<String, Object> m, Map<Phi, List<Object>> phiEdges) {
            String op = string(m, "op", null).toLowerCase(Locale.ROOT);
            if (m.containsKey("name")) {
                fb.named(string(m, "name", null));
            }
            switch (op) {
                case "block" -> fb.block();
                case "alloc" -> fb.alloc(type(m, "type"), Boolean.TRUE.equals(m.get("heap")));
                case "binop" -> fb.binOp(string(m, "operator", null), ref(fb, m, "x"), ref(fb, m, "y"));
                case "unop" -> {
                    UnOp.Op unOp = UnOp.Op.valueOf(string(m, "operator", null).toUpperCase(Locale.ROOT));
                    if (unOp == UnOp.Op.RECV && Boolean.TRUE.equals(m.get("commaOk"))) {
                        fb.recvOk(ref(fb, m, "x"));
                    } else {
                        fb.unOp(unOp, ref(fb, m, "x"));
                    }
                }
                case "call", "invoke" -> {
                    if (m.containsKey("builtin")) {
                        Type type = m.containsKey("type") ? type(m, "type") : null;
                        fb.callBuiltin(string(m, "builtin", null), type, args(fb, m, "args"));
                    } else if (m.containsKey("recv")) {
                        fb.invoke(ref(fb, m, "recv"), string(m, "method", null), args(fb, m, "args"));
                    } else {
                        fb.call(ref(fb, m, "fn"), args(fb, m, "args"));
                    }
                }
                case "go" -> fb.go(common(fb, m));
                case "defer" -> fb.defer(common(fb, m));
                case "change_interface" -> fb.changeInterface(type(m, "type"), ref(fb, m, "x"));
                case "change_type" -> fb.changeType(type(m, "type"), ref(fb, m, "x"));
                case "convert" -> fb.convert(type(m, "type"), ref(fb, m, "x"));
                case "slice_to_array_pointer" -> fb.sliceToArrayPointer(type(m, "type"), ref(fb, m, "x"));
                case "make_interface" -> fb.makeInterface(type(m, "type"), ref(fb, m, "x"));
                case "make_closure" -> {
                    Value fn = ref(fb, m, "fn");
                    if (!(fn instanceof io.vtascan.ir.Function closure)) {
                        throw new IllegalArgumentException(fn.name() + " is not a function");
                    }
                    fb.makeClosure(closure, args(fb, m, "bindings"));
                }
                case "make_chan" -> {
                    if (!(type(m, "type").underlying() instanceof ChanType chan)) {
                        throw new IllegalArgumentException("make_chan needs a channel type");
                    }
                    fb.makeChan(chan, ref(fb, m, "size"));
                }
                case "make_map" -> fb.makeMap(type(m, "type"), optionalRef(fb, m, "reserve"));
                case "make_slice" -> fb.makeSlice(type(m, "type"), ref(fb, m, "len"), ref(fb, m, "cap"));
                case "slice" -> fb.slice(ref(fb, m, "x"), optionalRef(fb, m, "low"), optionalRef(fb, m, "high"),
                        optionalRef(fb, m, "max"));
                case "range" -> fb.range(ref(fb, m, "x"));
                case "next" -> fb.next(ref(fb, m, "iter"));
                case "extract" -> fb.extract(ref(fb, m, "tuple"), integer(m, "index"));
                case "field" -> {
                    Value x = ref(fb, m, "x");
                    fb.field(x, fieldIndex(x.type(), m.get("index")));
                }
                case "field_addr" -> {
                    Value x = ref(fb, m, "x");
                    if (!(x.type().underlying() instanceof PointerType ptr)) {
                        throw new IllegalArgumentException(x.name() + " is not a pointer");
                    }
                    fb.fieldAddr(x, fieldIndex(ptr.elem(), m.get("index")));
                }
                case "index" -> fb.index(ref(fb, m, "x"), ref(fb, m, "index"));
                case "index_addr" -> fb.indexAddr(ref(fb, m, "x"), ref(fb, m, "index"));
                case "lookup" -> fb.lookup(ref(fb, m, "x"), ref(fb, m, "key"), Boolean.TRUE.equals(m.get("commaOk")));
                case "map_update" -> fb.mapUpdate(ref(fb, m, "map"), ref(fb, m, "key"), ref(fb, m, "value"));
                case "send" -> fb.send(ref(fb, m, "chan"), ref(fb, m, "x"));
                case "select" -> {
                    List<Select.SelectState> states = new ArrayList<>();
                    for (Map<String, Object> state : maps(m, "states")) {
                        if (state.containsKey("send")) {
                            states.add(new Select.SelectState(ChanDir.SEND_ONLY, ref(fb, state, "send"),
                                    ref(fb, state, "x")));
                        } else {
                            states.add(new Select.SelectState(ChanDir.RECV_ONLY, ref(fb, state, "recv"), null));
                        }
                    }
                    fb.select(states, !Boolean.FALSE.equals(m.get("blocking")));
                }
                case "type_assert" -> fb.typeAssert(ref(fb, m, "x"), type(m, "type"),
                        Boolean.TRUE.equals(m.get("commaOk")));
                case "phi" -> phiEdges.put(fb.phi(type(m, "type")), list(m, "edges"));
                case "store" -> fb.store(ref(fb, m, "addr"), ref(fb, m, "val"));
                case "panic" -> fb.panic(ref(fb, m, "x"));
                case "return" -> fb.ret(args(fb, m, "results"));
                case "jump" -> fb.jump(integer(m, "target"));
                case "if" -> fb.ifThen(ref(fb, m, "cond"), integer(m, "then"), integer(m, "else"));
                case "run_defers" -> fb.runDefers();
                default -> throw new IllegalArgumentException("unknown instruction '" + op + "'");
            }
        }

        private CallCommon common(FunctionBuilder fb, Map<String, Object> m) {
            if (m.containsKey("builtin")) {
                return new CallCommon(Builtin.of(string(m, "builtin", null)), null, List.of(args(fb, m, "args")));
            }
            if (m.containsKey("recv")) {
                return fb.invokeCommon(ref(fb, m, "recv"), string(m, "method", null), args(fb, m, "args"));
            }
            return fb.callCommon(ref(fb, m, "fn"), args(fb, m, "args"));
        }

        private int fieldIndex(Type structType, Object index) {
            if (index instanceof Integer i) {
                return i;
            }
            if (!(structType.underlying() instanceof StructType struct)) {
                throw new IllegalArgumentException(structType + " is not a struct");
            }
            for (int i = 0; i < struct.size(); i++) {
                if (struct.field(i).name().equals(String.valueOf(index))) {
                    return i;
                }
            }
            throw new IllegalArgumentException(structType + " has no field " + index);
        }

        private Value[] args(FunctionBuilder fb, Map<String, Object> m, String key) {
            List<Object> names = list(m, key);
            Value[] values = new Value[names.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = ref(fb, names.get(i));
            }
            return values;
        }

        private Value ref(FunctionBuilder fb, Map<String, Object> m, String key) {
            if (!m.containsKey(key)) {
                throw new IllegalArgumentException("missing operand '" + key + "'");
            }
            return ref(fb, m.get(key));
        }

        private Value optionalRef(FunctionBuilder fb, Map<String, Object> m, String key) {
            return m.get(key) == null ? null : ref(fb, m.get(key));
        }

        /**
         * Resolves an operand: a local value, a {@code literal:type} constant, a global or a function.
         */
        private Value ref(FunctionBuilder fb, Object token) {
            String name = String.valueOf(token).trim();
            Value local = fb.value(name);
            if (local != null) {
                return local;
            }
            int colon = name.indexOf(':');
            if (colon > 0) {
                return new Const(name.substring(0, colon), program.types().parse(name.substring(colon + 1)));
            }
            Global global = program.findGlobal(name);
            if (global != null) {
                return global;
            }
            if (program.hasFunction(name)) {
                return program.functionBuilder(name).function();
            }
            throw new IllegalArgumentException("unknown value '" + name + "'");
        }

        private Type type(Map<String, Object> m, String key) {
            return program.types().parse(string(m, key, null));
        }

        private static String string(Map<String, Object> m, String key, String defaultValue) {
            Object value = m.get(key);
            if (value == null) {
                if (defaultValue == null) {
                    throw new IllegalArgumentException("missing '" + key + "'");
                }
                return defaultValue;
            }
            return String.valueOf(value).trim();
        }

        private static String optionalString(Map<String, Object> m, String key) {
            Object value = m.get(key);
            return value == null ? null : String.valueOf(value).trim();
        }

        private static int integer(Map<String, Object> m, String key) {
            Object value = m.get(key);
            if (!(value instanceof Integer i)) {
                throw new IllegalArgumentException("'" + key + "' must be an integer, got " + value);
            }
            return i;
        }

        @SuppressWarnings("unchecked")
        private static Map<String, Object> map(Map<String, Object> m, String key) {
            Object value = m.get(key);
            return value == null ? Map.of() : (Map<String, Object>) value;
        }

        @SuppressWarnings("unchecked")
        private static List<Object> list(Map<String, Object> m, String key) {
            Object value = m.get(key);
            return value == null ? List.of() : (List<Object>) value;
        }

        @SuppressWarnings("unchecked")
        private static List<Map<String, Object>> maps(Map<String, Object> m, String key) {
            List<Map<String, Object>> result = new ArrayList<>();
            for (Object item : list(m, key)) {
                if (!(item instanceof Map)) {
                    throw new IllegalArgumentException("'" + key + "' entries must be mappings, got " + item);
                }
                result.add((Map<String, Object>) item);
            }
            return result;
        }

        /**
         * Splits {@code A, map[K]V, B} at top-level commas.
         */
        private static List<String> splitTypeArgs(String text) {
            List<String> parts = new ArrayList<>();
            int depth = 0;
            int start = 0;
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == '[' || c == '(' || c == '{') {
                    depth++;
                } else if (c == ']' || c == ')' || c == '}') {
                    depth--;
                } else if (c == ',' && depth == 0) {
                    parts.add(text.substring(start, i).trim());
                    start = i + 1;
                }
            }
            parts.add(text.substring(start).trim());
            return parts;
        }
    }
}
