package io.vtascan.analysis;

import io.vtascan.ir.Function;
import io.vtascan.types.Type;

import java.util.Objects;

/**
 * A concrete type propagated through the flow graph. Types that stem from a function value also
 * carry the function, so calls through the value can be resolved to it.
 *
 * @param type     The concrete type
 * @param function The function behind a function value, or null
 */
public record PropType(Type type, Function function) {

    public PropType {
        Objects.requireNonNull(type, "type");
    }

    public static PropType of(Type type) {
        return new PropType(type, null);
    }

    @Override
    public String toString() {
        return function == null ? type.toString() : function.name();
    }
}
