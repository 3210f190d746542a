package io.vtascan.ir;

import io.vtascan.types.Type;

/**
 * A value of the program: a constant, global, function, parameter, free variable, builtin or the
 * register defined by an instruction.
 * <p>
 * Values have identity semantics. Two registers are different values even when they render the same.
 */
public interface Value {

    /**
     * Returns the name of the value, e.g. {@code t0} for a register or {@code 0:int} for a constant.
     */
    String name();

    /**
     * Returns the static type of the value.
     */
    Type type();
}
