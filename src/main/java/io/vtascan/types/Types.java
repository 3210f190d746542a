package io.vtascan.types;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Static helpers for classifying types.
 */
public final class Types {

    /** The predeclared {@code error} interface. */
    public static final NamedType ERROR = NamedType.of("", "error", new InterfaceType(List.of(
            new InterfaceType.Method("Error", new Signature(List.of(), List.of(BasicType.STRING))))));

    private Types() {
    }

    /**
     * Returns true if the type is an interface type (named or literal).
     */
    public static boolean isInterface(Type t) {
        return t != null && t.underlying() instanceof InterfaceType;
    }

    /**
     * Returns true if the type is a function type (named or literal).
     */
    public static boolean isFunction(Type t) {
        return t != null && t.underlying() instanceof Signature;
    }

    /**
     * Returns true if the type is neither an interface type nor absent, i.e. it can be the
     * dynamic type of a runtime value.
     */
    public static boolean isConcrete(Type t) {
        return t != null && !isInterface(t);
    }

    /**
     * Returns the interface type reached by following one or more pointer indirections from
     * {@code t}, e.g. {@code I} for {@code **I}, or null if there is none.
     */
    public static Type interfaceUnderPtr(Type t) {
        return underPtr(t, true, new HashSet<>());
    }

    /**
     * Returns the function type reached by following one or more pointer indirections from
     * {@code t}, or null if there is none.
     */
    public static Type functionUnderPtr(Type t) {
        return underPtr(t, false, new HashSet<>());
    }

    private static Type underPtr(Type t, boolean wantInterface, Set<Type> seen) {
        // type P *P
        if (t == null || !seen.add(t)) {
            return null;
        }
        if (!(t.underlying() instanceof PointerType p)) {
            return null;
        }
        Type elem = p.elem();
        if (wantInterface ? isInterface(elem) : isFunction(elem)) {
            return elem;
        }
        return underPtr(elem, wantInterface, seen);
    }

    /**
     * Returns true if values of the type may have methods, so that the value can be
     * interesting as an interface receiver after a panic/recover round trip.
     */
    public static boolean canHaveMethods(Type t) {
        if (t instanceof NamedType) {
            return true;
        }
        Type u = t.underlying();
        if (u instanceof InterfaceType || u instanceof Signature || u instanceof StructType) {
            return true;
        }
        if (u instanceof PointerType p) {
            return canHaveMethods(p.elem());
        }
        return false;
    }

    /**
     * Returns the element type of a slice, array or pointer-to-array type, or null for any other type.
     */
    public static Type sliceArrayElem(Type t) {
        Type u = t.underlying();
        if (u instanceof SliceType s) {
            return s.elem();
        }
        if (u instanceof ArrayType a) {
            return a.elem();
        }
        if (u instanceof PointerType p && p.elem().underlying() instanceof ArrayType a) {
            return a.elem();
        }
        return null;
    }
}
