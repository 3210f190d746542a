package io.vtascan.types;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A defined (named) type, possibly an instantiation of a generic type.
 * <p>
 * Identity is the package, the name and the type arguments. The underlying type is set once after
 * construction, which allows recursive definitions such as {@code type L struct{next *L}}.
 */
public final class NamedType implements Type {

    private final String pkg;
    private final String name;
    private final List<Type> typeArgs;
    private volatile Type underlying;

    public NamedType(String pkg, String name) {
        this(pkg, name, List.of());
    }

    public NamedType(String pkg, String name, List<Type> typeArgs) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Named type name cannot be null or blank");
        }
        this.pkg = pkg == null ? "" : pkg;
        this.name = name;
        this.typeArgs = List.copyOf(typeArgs);
    }

    /**
     * Creates a named type with its underlying type already set.
     */
    public static NamedType of(String pkg, String name, Type underlying) {
        NamedType named = new NamedType(pkg, name);
        named.setUnderlying(underlying);
        return named;
    }

    public String pkg() {
        return pkg;
    }

    public String name() {
        return name;
    }

    public List<Type> typeArgs() {
        return typeArgs;
    }

    /**
     * Sets the underlying type. May only be called once.
     */
    public void setUnderlying(Type type) {
        Objects.requireNonNull(type, "underlying");
        if (underlying != null) {
            throw new IllegalStateException("Underlying type of " + this + " is already set");
        }
        underlying = type;
    }

    public boolean hasUnderlying() {
        return underlying != null;
    }

    @Override
    public Type underlying() {
        Type u = underlying;
        if (u == null) {
            throw new IllegalStateException("Underlying type of " + this + " is not set");
        }
        // type D C: D shares C's underlying type
        return u instanceof NamedType named ? named.underlying() : u;
    }

    /**
     * Returns the package-qualified name without type arguments, e.g. {@code pkg.Box}.
     */
    public String qualifiedName() {
        return pkg.isEmpty() ? name : pkg + "." + name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NamedType other)) return false;
        return pkg.equals(other.pkg) && name.equals(other.name) && typeArgs.equals(other.typeArgs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pkg, name, typeArgs);
    }

    @Override
    public String toString() {
        if (typeArgs.isEmpty()) {
            return qualifiedName();
        }
        return qualifiedName() + typeArgs.stream()
                .map(Type::toString)
                .collect(Collectors.joining(",", "[", "]"));
    }
}
