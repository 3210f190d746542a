package io.vtascan.ir;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Creates a closure of an anonymous function, binding its free variables to the given values.
 */
public final class MakeClosure extends Register {

    private final Function fn;
    private final List<Value> bindings;

    public MakeClosure(String name, Function fn, List<Value> bindings) {
        super(name, fn.signature());
        this.fn = Objects.requireNonNull(fn, "fn");
        this.bindings = List.copyOf(bindings);
        if (this.bindings.size() != fn.freeVars().size()) {
            throw new IllegalArgumentException("Closure " + fn.name() + " has " + fn.freeVars().size()
                    + " free variables but " + this.bindings.size() + " bindings were given");
        }
    }

    public Function fn() {
        return fn;
    }

    /**
     * Returns the values bound to the free variables, in free variable order.
     */
    public List<Value> bindings() {
        return bindings;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitMakeClosure(this);
    }

    @Override
    protected String describe() {
        return "make closure " + fn.name()
                + bindings.stream().map(Value::name).collect(Collectors.joining(", ", " [", "]"));
    }
}
