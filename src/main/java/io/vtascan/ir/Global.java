package io.vtascan.ir;

import io.vtascan.types.PointerType;
import io.vtascan.types.Type;

import java.util.Objects;

/**
 * A package-level variable. As an operand it denotes the variable's address, so its type is a
 * pointer to the declared type.
 */
public final class Global implements Value {

    private final String pkg;
    private final String name;
    private final Type declaredType;
    private final PointerType type;

    public Global(String pkg, String name, Type declaredType) {
        this.pkg = pkg == null ? "" : pkg;
        this.name = Objects.requireNonNull(name, "name");
        this.declaredType = Objects.requireNonNull(declaredType, "declaredType");
        this.type = new PointerType(declaredType);
    }

    public String pkg() {
        return pkg;
    }

    public Type declaredType() {
        return declaredType;
    }

    public String qualifiedName() {
        return pkg.isEmpty() ? name : pkg + "." + name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public PointerType type() {
        return type;
    }

    @Override
    public String toString() {
        return name;
    }
}
