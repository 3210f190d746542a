package io.vtascan.ir;

import io.vtascan.types.InterfaceType;
import io.vtascan.types.NamedType;
import io.vtascan.types.PointerType;
import io.vtascan.types.Type;
import io.vtascan.types.Types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A whole program: its functions (including closures, wrappers and generic instantiations),
 * globals and named types. Programs are immutable once built by {@link ProgramBuilder}.
 */
public final class Program {

    private record Implements(Type type, InterfaceType iface) {}

    private final String pkg;
    private final List<Function> functions;
    private final Map<String, Function> functionsByName;
    private final List<Global> globals;
    private final Map<String, NamedType> namedTypes;
    private final Map<NamedType, List<Function>> methods;
    private final Map<Implements, Boolean> implementsCache = new ConcurrentHashMap<>();

    Program(String pkg, List<Function> functions, List<Global> globals, Map<String, NamedType> namedTypes) {
        this.pkg = pkg;
        this.functions = List.copyOf(functions);
        this.globals = List.copyOf(globals);
        this.namedTypes = Collections.unmodifiableMap(new LinkedHashMap<>(namedTypes));

        Map<String, Function> byName = new LinkedHashMap<>();
        Map<NamedType, List<Function>> byReceiver = new LinkedHashMap<>();
        for (Function fn : this.functions) {
            fn.seal();
            byName.put(fn.qualifiedName(), fn);
            if (fn.isMethod()) {
                byReceiver.computeIfAbsent(fn.receiverType(), k -> new ArrayList<>()).add(fn);
            }
        }
        this.functionsByName = Collections.unmodifiableMap(byName);
        this.methods = Collections.unmodifiableMap(byReceiver);
    }

    /**
     * Returns the name of the main package.
     */
    public String pkg() {
        return pkg;
    }

    public List<Function> functions() {
        return functions;
    }

    public List<Global> globals() {
        return globals;
    }

    /**
     * Returns all named types keyed by their rendering, e.g. {@code P.C} or {@code P.Box[P.A]}.
     */
    public Map<String, NamedType> namedTypes() {
        return namedTypes;
    }

    /**
     * Finds a function by its qualified name ({@code P.g}, {@code (*P.C).f}) or, for functions of
     * the main package, by its relative name ({@code g}, {@code (*C).f}).
     */
    public Optional<Function> function(String name) {
        Function fn = functionsByName.get(name);
        if (fn == null) {
            fn = functions.stream()
                    .filter(f -> f.pkg().equals(pkg) && f.name().equals(name))
                    .findFirst()
                    .orElse(null);
        }
        return Optional.ofNullable(fn);
    }

    /**
     * Returns the methods declared on the named type, with value and pointer receivers.
     */
    public List<Function> declaredMethods(NamedType type) {
        return methods.getOrDefault(type, List.of());
    }

    /**
     * Looks up method {@code name} in the method set of {@code type}. For {@code *T} a method with
     * a pointer receiver wins over one with a value receiver; for {@code T} only value receivers
     * count.
     *
     * @return the method, or null if the type's method set has no such method
     */
    public Function lookupMethod(Type type, String name) {
        if (type instanceof PointerType ptr && ptr.elem() instanceof NamedType named) {
            Function valueMethod = null;
            for (Function m : declaredMethods(named)) {
                if (m.simpleName().equals(name)) {
                    if (m.hasPointerReceiver()) {
                        return m;
                    }
                    valueMethod = m;
                }
            }
            return valueMethod;
        }
        if (type instanceof NamedType named && !Types.isInterface(named)) {
            for (Function m : declaredMethods(named)) {
                if (m.simpleName().equals(name) && !m.hasPointerReceiver()) {
                    return m;
                }
            }
        }
        return null;
    }

    /**
     * Reports whether {@code type} implements {@code iface}: every interface method is in the
     * type's method set with an identical signature. Interface types implement {@code iface} when
     * their own method set is a superset.
     */
    public boolean implementsInterface(Type type, InterfaceType iface) {
        if (iface.isEmpty()) {
            return true;
        }
        return implementsCache.computeIfAbsent(new Implements(type, iface), k -> computeImplements(type, iface));
    }

    private boolean computeImplements(Type type, InterfaceType iface) {
        if (type.underlying() instanceof InterfaceType own) {
            for (InterfaceType.Method m : iface.methods()) {
                Optional<InterfaceType.Method> found = own.method(m.name());
                if (found.isEmpty() || !found.get().signature().equals(m.signature())) {
                    return false;
                }
            }
            return true;
        }
        for (InterfaceType.Method m : iface.methods()) {
            Function fn = lookupMethod(type, m.name());
            if (fn == null || !fn.signature().equals(m.signature())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns every type that can be the dynamic type behind an interface carrying methods: each
     * named non-interface type and the pointer to it.
     */
    public List<Type> concreteTypes() {
        List<Type> result = new ArrayList<>();
        for (NamedType named : namedTypes.values()) {
            if (named.hasUnderlying() && !Types.isInterface(named)) {
                result.add(named);
                result.add(new PointerType(named));
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "Program[" + pkg + ", " + functions.size() + " functions, " + namedTypes.size() + " named types]";
    }
}
