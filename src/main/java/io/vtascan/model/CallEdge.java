package io.vtascan.model;

import io.vtascan.ir.CallInstruction;
import io.vtascan.ir.Function;

import java.util.Objects;

/**
 * An edge in the call graph from caller to callee.
 *
 * @param caller The calling function
 * @param site   The call, go or defer instruction
 * @param callee The function that may be called
 */
public record CallEdge(Function caller, CallInstruction site, Function callee) {

    public CallEdge {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(site, "site");
        Objects.requireNonNull(callee, "callee");
    }

    /**
     * Check if the callee was dispatched through an interface.
     */
    public boolean isInvoke() {
        return site.common().isInvoke();
    }

    /**
     * Check if the callee is known without analysis.
     */
    public boolean isStatic() {
        return site.common().staticCallee() == callee;
    }

    /**
     * Renders the edge as {@code caller -> callee} using relative function names.
     */
    public String describe() {
        return caller.name() + " -> " + callee.name();
    }

    @Override
    public String toString() {
        return describe() + " @ " + site.location();
    }
}
