package io.vtascan.ir;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Returns from the function; {@code results} matches the signature's result list.
 */
public final class Return extends Instruction {

    private final List<Value> results;

    public Return(List<Value> results) {
        this.results = List.copyOf(results);
    }

    public List<Value> results() {
        return results;
    }

    @Override
    public void accept(InstructionVisitor visitor) {
        visitor.visitReturn(this);
    }

    @Override
    public String toString() {
        return results.isEmpty() ? "return"
                : results.stream().map(Value::name).collect(Collectors.joining(", ", "return ", ""));
    }
}
