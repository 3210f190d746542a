package io.vtascan.graph;

import io.vtascan.ir.Value;
import io.vtascan.types.PointerType;
import io.vtascan.types.StructType;
import io.vtascan.types.Type;

import java.util.Objects;

/**
 * A vertex of the type flow graph.
 * <p>
 * Nodes are values: two nodes built from the same variant and identity fields are equal, so every
 * occurrence of one abstract location collapses to a single vertex. Type-keyed variants rely on
 * the structural equality of {@link Type}; value-keyed variants on the identity of program values.
 */
public sealed interface Node {

    /**
     * Returns the static type of the node, or null for the panic and recover sentinels.
     */
    Type type();

    /**
     * A constant of the given type. All constants of one type share a node.
     */
    record Constant(Type type) implements Node {
        public Constant {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public String toString() {
            return "Constant(" + type + ")";
        }
    }

    /**
     * A pointer value whose element is neither an interface nor a function reached through pointers.
     */
    record Pointer(PointerType type) implements Node {
        public Pointer {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public String toString() {
            return "Pointer(" + type + ")";
        }
    }

    /**
     * The key slot of all maps with key type {@code type}.
     */
    record MapKey(Type type) implements Node {
        public MapKey {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public String toString() {
            return "MapKey(" + type + ")";
        }
    }

    /**
     * The value slot of all maps with value type {@code type}.
     */
    record MapValue(Type type) implements Node {
        public MapValue {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public String toString() {
            return "MapValue(" + type + ")";
        }
    }

    /**
     * The element slot of all slices and arrays with element type {@code type}.
     */
    record SliceElem(Type type) implements Node {
        public SliceElem {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public String toString() {
            return "Slice([]" + type + ")";
        }
    }

    /**
     * The element slot of all channels with element type {@code type}.
     */
    record ChannelElem(Type type) implements Node {
        public ChannelElem {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public String toString() {
            return "Channel(chan " + type + ")";
        }
    }

    /**
     * Field {@code index} of struct type {@code structType}, shared by every value of that type.
     */
    record Field(Type structType, int index) implements Node {
        public Field {
            Objects.requireNonNull(structType, "structType");
            if (!(structType.underlying() instanceof StructType s) || index < 0 || index >= s.size()) {
                throw new IllegalArgumentException("No field #" + index + " in " + structType);
            }
        }

        public StructType.Field field() {
            return ((StructType) structType.underlying()).field(index);
        }

        @Override
        public Type type() {
            return field().type();
        }

        @Override
        public String toString() {
            return "Field(" + structType + ":" + field().name() + ")";
        }
    }

    /**
     * A package-level variable; typed by its address type, like the variable as an operand.
     */
    record Global(io.vtascan.ir.Global global) implements Node {
        public Global {
            Objects.requireNonNull(global, "global");
        }

        @Override
        public Type type() {
            return global.type();
        }

        @Override
        public String toString() {
            return "Global(" + global.name() + ")";
        }
    }

    /**
     * A register, parameter or free variable of one function.
     */
    record Local(Value value) implements Node {
        public Local {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Type type() {
            return value.type();
        }

        @Override
        public String toString() {
            return "Local(" + value.name() + ")";
        }
    }

    /**
     * Component {@code index} of a tuple-valued local, e.g. one result of a multi-value call.
     */
    record IndexedLocal(Value value, Type type, int index) implements Node {
        public IndexedLocal {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(type, "type");
        }

        @Override
        public String toString() {
            return "Local(" + value.name() + "[" + index + "])";
        }
    }

    /**
     * A function or method used as a value.
     */
    record Function(io.vtascan.ir.Function function) implements Node {
        public Function {
            Objects.requireNonNull(function, "function");
        }

        @Override
        public Type type() {
            return function.signature();
        }

        @Override
        public String toString() {
            return "Function(" + function.name() + ")";
        }
    }

    /**
     * The {@code index}-th result of a function, shared by all its return instructions and call sites.
     */
    record Return(io.vtascan.ir.Function function, int index) implements Node {
        public Return {
            Objects.requireNonNull(function, "function");
            if (index < 0 || index >= function.signature().results().size()) {
                throw new IllegalArgumentException(function.name() + " has no result #" + index);
            }
        }

        @Override
        public Type type() {
            return function.signature().results().get(index);
        }

        @Override
        public String toString() {
            return "Return(" + function.name() + "[" + index + "])";
        }
    }

    /**
     * What a pointer chain ending in an interface points to, e.g. the interface behind {@code **I}.
     * Keyed by the interface type.
     */
    record NestedPtrInterface(Type type) implements Node {
        public NestedPtrInterface {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public String toString() {
            return "PtrInterface(" + type + ")";
        }
    }

    /**
     * What a pointer chain ending in a function type points to. Keyed by the function type.
     */
    record NestedPtrFunction(Type type) implements Node {
        public NestedPtrFunction {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public String toString() {
            return "PtrFunction(" + type + ")";
        }
    }

    /**
     * Receives the argument of every panic in the program.
     */
    record PanicArg() implements Node {
        @Override
        public Type type() {
            return null;
        }

        @Override
        public String toString() {
            return "Panic";
        }
    }

    /**
     * Supplies the result of every recover call in the program.
     */
    record RecoverReturn() implements Node {
        @Override
        public Type type() {
            return null;
        }

        @Override
        public String toString() {
            return "Recover";
        }
    }

    Node PANIC_ARG = new PanicArg();

    Node RECOVER_RETURN = new RecoverReturn();

    default boolean isSentinel() {
        return this instanceof PanicArg || this instanceof RecoverReturn;
    }

    /**
     * True for nodes denoting storage shared by reads and writes: pointers and nested pointers.
     */
    default boolean isReference() {
        if (this instanceof NestedPtrInterface || this instanceof NestedPtrFunction) {
            return true;
        }
        return type() instanceof PointerType;
    }
}
