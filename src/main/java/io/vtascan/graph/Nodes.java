package io.vtascan.graph;

import io.vtascan.ir.Const;
import io.vtascan.ir.FreeVar;
import io.vtascan.ir.Instruction;
import io.vtascan.ir.MalformedProgramException;
import io.vtascan.ir.Parameter;
import io.vtascan.ir.Register;
import io.vtascan.ir.Value;
import io.vtascan.types.PointerType;
import io.vtascan.types.Type;
import io.vtascan.types.Types;

/**
 * Maps program values to flow graph nodes.
 */
public final class Nodes {

    private Nodes() {
    }

    /**
     * Returns the node standing for {@code value} as an operand of {@code at}.
     * <p>
     * A pointer whose element is not itself an interface or function becomes a nested pointer node
     * when an interface or function lies further down the pointer chain, and a {@link Node.Pointer}
     * otherwise. Everything else is classified by the kind of value.
     *
     * @throws MalformedProgramException if the value cannot be classified
     */
    public static Node of(Value value, Instruction at) {
        if (value == null || value.type() == null) {
            throw new MalformedProgramException(at, "operand without a type");
        }
        Type type = value.type();
        if (type instanceof PointerType ptr && !Types.isInterface(ptr.elem()) && !Types.isFunction(ptr.elem())) {
            Type iface = Types.interfaceUnderPtr(ptr.elem());
            if (iface != null) {
                return new Node.NestedPtrInterface(iface);
            }
            Type fn = Types.functionUnderPtr(ptr.elem());
            if (fn != null) {
                return new Node.NestedPtrFunction(fn);
            }
            return new Node.Pointer(ptr);
        }
        if (value instanceof Const) {
            return new Node.Constant(type);
        }
        if (value instanceof io.vtascan.ir.Global g) {
            return new Node.Global(g);
        }
        if (value instanceof io.vtascan.ir.Function f) {
            return new Node.Function(f);
        }
        if (value instanceof Parameter || value instanceof FreeVar || value instanceof Register) {
            return new Node.Local(value);
        }
        throw new MalformedProgramException(at, "cannot classify operand " + value.name()
                + " (" + value.getClass().getSimpleName() + ")");
    }

    /**
     * Reports whether edges into the node can carry interesting types: the node is a sentinel, or
     * its type is an interface, a function, or a pointer chain ending in either.
     */
    public static boolean hasInFlow(Node node) {
        if (node.isSentinel()) {
            return true;
        }
        Type t = node.type();
        if (Types.interfaceUnderPtr(t) != null || Types.functionUnderPtr(t) != null) {
            return true;
        }
        return Types.isInterface(t) || Types.isFunction(t);
    }

    /**
     * Reports whether both nodes denote shared storage, so that writes through one are visible
     * through the other.
     */
    public static boolean canAlias(Node a, Node b) {
        return a.isReference() && b.isReference();
    }
}
