package io.vtascan.ir;

import io.vtascan.types.InterfaceType;
import io.vtascan.types.Signature;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The callee and arguments shared by {@link Call}, {@link Go} and {@link Defer}.
 * <p>
 * In "call" mode {@code value} is the function value called (a function, closure, builtin or any
 * function-typed value). In "invoke" mode {@code method} is non-null and {@code value} is the
 * interface value whose dynamic type supplies the method.
 *
 * @param value  Callee value or interface receiver
 * @param method Invoked interface method, null in call mode
 * @param args   Arguments, excluding the receiver in invoke mode
 */
public record CallCommon(Value value, InterfaceType.Method method, List<Value> args) {

    public CallCommon {
        Objects.requireNonNull(value, "value");
        args = List.copyOf(args);
    }

    public boolean isInvoke() {
        return method != null;
    }

    /**
     * Returns the callee if it is known without analysis, i.e. a function or the function of a
     * closure creation; null otherwise.
     */
    public Function staticCallee() {
        if (method != null) {
            return null;
        }
        if (value instanceof Function f) {
            return f;
        }
        if (value instanceof MakeClosure c) {
            return c.fn();
        }
        return null;
    }

    /**
     * Returns the signature of the called function: the method signature in invoke mode.
     */
    public Signature signature() {
        if (method != null) {
            return method.signature();
        }
        if (value.type().underlying() instanceof Signature sig) {
            return sig;
        }
        throw new IllegalStateException("Callee " + value.name() + " is not a function: " + value.type());
    }

    @Override
    public String toString() {
        String renderedArgs = args.stream().map(Value::name).collect(Collectors.joining(", "));
        if (method != null) {
            return "invoke " + value.name() + "." + method.name() + "(" + renderedArgs + ")";
        }
        return value.name() + "(" + renderedArgs + ")";
    }
}
