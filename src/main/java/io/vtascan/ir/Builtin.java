package io.vtascan.ir;

import io.vtascan.types.InterfaceType;
import io.vtascan.types.Signature;
import io.vtascan.types.SliceType;
import io.vtascan.types.Type;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A builtin function such as {@code recover} or {@code len}. Builtins are never call graph nodes.
 */
public final class Builtin implements Value {

    public static final Builtin RECOVER = new Builtin("recover",
            new Signature(List.of(), List.of(InterfaceType.EMPTY)));

    private static final Signature ANY_ARGS = new Signature(
            List.of(new SliceType(InterfaceType.EMPTY)), List.of(), true);

    private static final Map<String, Builtin> KNOWN = Map.of("recover", RECOVER);

    private final String name;
    private final Signature signature;

    public Builtin(String name, Signature signature) {
        this.name = Objects.requireNonNull(name, "name");
        this.signature = Objects.requireNonNull(signature, "signature");
    }

    /**
     * Returns the builtin with the given name. Builtins other than {@code recover} are given a
     * permissive variadic signature; their result type is supplied at the call.
     */
    public static Builtin of(String name) {
        return KNOWN.getOrDefault(name, new Builtin(name, ANY_ARGS));
    }

    public Signature signature() {
        return signature;
    }

    public boolean isRecover() {
        return name.equals("recover");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Type type() {
        return signature;
    }

    @Override
    public String toString() {
        return name;
    }
}
