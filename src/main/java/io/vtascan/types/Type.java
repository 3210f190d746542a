package io.vtascan.types;

/**
 * A static type of the analyzed program.
 * <p>
 * Types have value semantics: two structurally identical types are {@code equals} and hash
 * identically, so a type doubles as its own canonical representative. Named types are the
 * exception to structural identity: they are identified by package, name and type arguments.
 * <p>
 * {@link #toString()} renders the type in Go syntax, e.g. {@code *int}, {@code map[string]pkg.T}.
 */
public sealed interface Type
        permits BasicType, NamedType, PointerType, SliceType, ArrayType, MapType, ChanType,
                StructType, InterfaceType, Signature, TupleType {

    /**
     * Returns the underlying type. Only named types have an underlying type different from themselves.
     */
    default Type underlying() {
        return this;
    }
}
