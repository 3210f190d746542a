package io.vtascan.ir;

import io.vtascan.types.NamedType;
import io.vtascan.types.PointerType;
import io.vtascan.types.Signature;
import io.vtascan.types.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A function, method, closure body or generic instantiation, with its parameters, free variables
 * and basic blocks.
 * <p>
 * Functions are created by {@link ProgramBuilder} and sealed when the program is built; after that
 * no instruction may be added.
 */
public final class Function implements Value {

    private final String pkg;
    private final String name;
    private final Signature signature;
    private final NamedType receiverType;
    private final boolean pointerReceiver;
    private final Function parent;
    private final List<Type> typeArgs;
    private final String synthetic;

    private final List<Parameter> params = new ArrayList<>();
    private final List<FreeVar> freeVars = new ArrayList<>();
    private final List<BasicBlock> blocks = new ArrayList<>();
    private int closureCount;
    private boolean sealed;

    Function(String pkg, String name, Signature signature, NamedType receiverType, boolean pointerReceiver,
             Function parent, List<Type> typeArgs, String synthetic) {
        this.pkg = pkg == null ? "" : pkg;
        this.name = Objects.requireNonNull(name, "name");
        this.signature = Objects.requireNonNull(signature, "signature");
        this.receiverType = receiverType;
        this.pointerReceiver = pointerReceiver;
        this.parent = parent;
        this.typeArgs = List.copyOf(typeArgs);
        this.synthetic = synthetic;
    }

    public String pkg() {
        return pkg;
    }

    /**
     * Returns the declared name without receiver or type arguments, e.g. {@code f}.
     */
    public String simpleName() {
        return name;
    }

    public Signature signature() {
        return signature;
    }

    public boolean isMethod() {
        return receiverType != null;
    }

    /**
     * Returns the named type this method is declared on, or null for plain functions.
     */
    public NamedType receiverType() {
        return receiverType;
    }

    public boolean hasPointerReceiver() {
        return pointerReceiver;
    }

    /**
     * Returns the type of the receiver parameter, {@code *T} for pointer receivers.
     */
    public Type receiverParamType() {
        if (receiverType == null) {
            return null;
        }
        return pointerReceiver ? new PointerType(receiverType) : receiverType;
    }

    /**
     * Returns the enclosing function of a closure, or null.
     */
    public Function parent() {
        return parent;
    }

    public List<Type> typeArgs() {
        return typeArgs;
    }

    /**
     * Returns a description of why the function was synthesized (e.g. {@code wrapper}), or null
     * for functions declared in source.
     */
    public String synthetic() {
        return synthetic;
    }

    /**
     * Returns the parameters; for methods the receiver comes first.
     */
    public List<Parameter> params() {
        return Collections.unmodifiableList(params);
    }

    public List<FreeVar> freeVars() {
        return Collections.unmodifiableList(freeVars);
    }

    public List<BasicBlock> blocks() {
        return Collections.unmodifiableList(blocks);
    }

    /**
     * Streams all instructions of all blocks in block order.
     */
    public Stream<Instruction> instructions() {
        return blocks.stream().flatMap(b -> b.instructions().stream());
    }

    /**
     * Returns the call, go and defer instructions of the function body.
     */
    public List<CallInstruction> callInstructions() {
        return instructions()
                .filter(CallInstruction.class::isInstance)
                .map(CallInstruction.class::cast)
                .toList();
    }

    /**
     * Returns the name relative to the function's package: {@code g}, {@code (C).f},
     * {@code (*C).f}, {@code f$1} or {@code instantiated[P.A]}.
     */
    @Override
    public String name() {
        String base = name;
        if (receiverType != null) {
            base = "(" + (pointerReceiver ? "*" : "") + receiverType.name() + ")." + name;
        }
        if (!typeArgs.isEmpty()) {
            base += typeArgs.stream().map(Type::toString).collect(Collectors.joining(",", "[", "]"));
        }
        return base;
    }

    /**
     * Returns the package-qualified name, e.g. {@code P.g} or {@code (*P.C).f}.
     */
    public String qualifiedName() {
        if (receiverType != null) {
            return "(" + (pointerReceiver ? "*" : "") + receiverType.qualifiedName() + ")." + name;
        }
        return pkg.isEmpty() ? name() : pkg + "." + name();
    }

    @Override
    public Signature type() {
        return signature;
    }

    @Override
    public String toString() {
        return name();
    }

    Parameter addParam(String paramName, Type type) {
        checkOpen();
        Parameter p = new Parameter(paramName, type, this);
        params.add(p);
        return p;
    }

    FreeVar addFreeVar(String varName, Type type) {
        checkOpen();
        FreeVar fv = new FreeVar(varName, type, this);
        freeVars.add(fv);
        return fv;
    }

    BasicBlock addBlock() {
        checkOpen();
        BasicBlock block = new BasicBlock(this, blocks.size());
        blocks.add(block);
        return block;
    }

    String nextClosureName() {
        return name() + "$" + (++closureCount);
    }

    void seal() {
        sealed = true;
    }

    void checkOpen() {
        if (sealed) {
            throw new IllegalStateException("Function " + qualifiedName() + " belongs to a built program");
        }
    }
}
