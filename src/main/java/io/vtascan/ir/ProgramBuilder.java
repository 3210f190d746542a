package io.vtascan.ir;

import io.vtascan.types.NamedType;
import io.vtascan.types.Signature;
import io.vtascan.types.Type;
import io.vtascan.types.TypeParser;
import io.vtascan.types.Types;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link Program}. Named types, globals and functions are declared first; function
 * bodies are then filled in through the returned {@link FunctionBuilder}s, in any order, so that
 * bodies can reference functions declared after them.
 *
 * <pre>{@code
 * ProgramBuilder pb = new ProgramBuilder("P");
 * NamedType c = pb.namedType("C", BasicType.INT);
 * NamedType i = pb.namedType("I", pb.types().parse("interface{f()}"));
 * pb.method(c, false, "f", Signature.NO_ARGS).ret();
 * FunctionBuilder g = pb.function("g", Signature.NO_ARGS);
 * g.invoke(g.makeInterface(i, new Const("0", c)), "f");
 * g.ret();
 * Program program = pb.build();
 * }</pre>
 */
public class ProgramBuilder {

    private final String pkg;
    private final Map<String, NamedType> namedTypes = new LinkedHashMap<>();
    private final Map<String, Global> globals = new LinkedHashMap<>();
    private final List<FunctionBuilder> functions = new ArrayList<>();
    private final Map<String, FunctionBuilder> functionsByName = new LinkedHashMap<>();
    private final TypeParser typeParser;
    private boolean built;

    public ProgramBuilder(String pkg) {
        if (pkg == null || pkg.isBlank()) {
            throw new IllegalArgumentException("Package name cannot be null or blank");
        }
        this.pkg = pkg;
        this.typeParser = new TypeParser(pkg, namedTypes);
    }

    public String pkg() {
        return pkg;
    }

    /**
     * Returns a parser resolving names against the named types declared so far.
     */
    public TypeParser types() {
        return typeParser;
    }

    /**
     * Declares a named type whose underlying type is set later, for recursive definitions.
     */
    public NamedType declareType(String name) {
        return register(new NamedType(pkg, name));
    }

    /**
     * Declares a named type with the given underlying type.
     */
    public NamedType namedType(String name, Type underlying) {
        NamedType named = declareType(name);
        named.setUnderlying(underlying);
        return named;
    }

    /**
     * Declares an instantiation of a generic named type, e.g. {@code Box[A]}, whose underlying type
     * is set later.
     */
    public NamedType declareType(String name, List<Type> typeArgs) {
        return register(new NamedType(pkg, name, typeArgs));
    }

    /**
     * Declares an instantiation of a generic named type with the given underlying type.
     */
    public NamedType instantiatedType(String name, List<Type> typeArgs, Type underlying) {
        NamedType named = declareType(name, typeArgs);
        named.setUnderlying(underlying);
        return named;
    }

    private NamedType register(NamedType named) {
        checkOpen();
        if (namedTypes.putIfAbsent(named.toString(), named) != null) {
            throw new IllegalArgumentException("Duplicate type " + named);
        }
        return named;
    }

    /**
     * Returns a declared named type by rendering, with or without the package, e.g. {@code C},
     * {@code P.C} or {@code Box[P.A]}.
     */
    public NamedType namedType(String name) {
        NamedType named = namedTypes.getOrDefault(name, namedTypes.get(pkg + "." + name));
        if (named == null) {
            throw new IllegalArgumentException("Unknown type " + name);
        }
        return named;
    }

    public Global global(String name, Type type) {
        checkOpen();
        Global global = new Global(pkg, name, type);
        if (globals.putIfAbsent(name, global) != null) {
            throw new IllegalArgumentException("Duplicate global " + name);
        }
        return global;
    }

    /**
     * Returns the global with the given name, or null.
     */
    public Global findGlobal(String name) {
        return globals.get(name);
    }

    public FunctionBuilder function(String name, Signature signature) {
        return add(new Function(pkg, name, signature, null, false, null, List.of(), null));
    }

    /**
     * Declares a method; the builder adds the receiver parameter {@code recv} first.
     */
    public FunctionBuilder method(NamedType receiver, boolean pointerReceiver, String name, Signature signature) {
        return method(receiver, pointerReceiver, name, signature, null);
    }

    /**
     * Declares a synthetic method such as the {@code (*T).f} wrapper of a value method.
     */
    public FunctionBuilder method(NamedType receiver, boolean pointerReceiver, String name, Signature signature,
                                  String synthetic) {
        if (receiver.hasUnderlying() && Types.isInterface(receiver)) {
            throw new IllegalArgumentException("Interface type " + receiver + " cannot declare method " + name);
        }
        FunctionBuilder fb = add(new Function(pkg, name, signature, receiver, pointerReceiver, null, List.of(),
                synthetic));
        fb.param("recv", fb.function().receiverParamType());
        return fb;
    }

    /**
     * Declares one instantiation of a generic function, e.g. {@code instantiated[A]}. Each
     * instantiation is a separate function with its own body.
     */
    public FunctionBuilder instantiation(String name, List<Type> typeArgs, Signature signature) {
        if (typeArgs.isEmpty()) {
            throw new IllegalArgumentException("Instantiation of " + name + " needs type arguments");
        }
        return add(new Function(pkg, name, signature, null, false, null, typeArgs, "instance"));
    }

    FunctionBuilder closure(Function parent, Signature signature) {
        return add(new Function(pkg, parent.nextClosureName(), signature, null, false, parent, List.of(), null));
    }

    private FunctionBuilder add(Function fn) {
        checkOpen();
        FunctionBuilder fb = new FunctionBuilder(this, fn);
        if (functionsByName.putIfAbsent(fn.name(), fb) != null) {
            throw new IllegalArgumentException("Duplicate function " + fn.name());
        }
        functions.add(fb);
        return fb;
    }

    /**
     * Returns the builder of a declared function by relative name ({@code g}, {@code (*C).f}).
     */
    public FunctionBuilder functionBuilder(String name) {
        FunctionBuilder fb = functionsByName.get(name);
        if (fb == null) {
            throw new IllegalArgumentException("Unknown function " + name);
        }
        return fb;
    }

    public boolean hasFunction(String name) {
        return functionsByName.containsKey(name);
    }

    /**
     * Builds the program. Afterwards neither this builder nor its function builders accept changes.
     *
     * @throws IllegalArgumentException if a named type was declared but never defined
     */
    public Program build() {
        checkOpen();
        for (NamedType named : namedTypes.values()) {
            if (!named.hasUnderlying()) {
                throw new IllegalArgumentException("Type " + named + " was declared but never defined");
            }
        }
        built = true;
        List<Function> fns = functions.stream().map(FunctionBuilder::function).toList();
        return new Program(pkg, fns, new ArrayList<>(globals.values()), namedTypes);
    }

    private void checkOpen() {
        if (built) {
            throw new IllegalStateException("Program of package " + pkg + " is already built");
        }
    }
}
