package io.vtascan.ir;

import io.vtascan.types.ArrayType;
import io.vtascan.types.BasicType;
import io.vtascan.types.ChanDir;
import io.vtascan.types.ChanType;
import io.vtascan.types.InterfaceType;
import io.vtascan.types.MapType;
import io.vtascan.types.PointerType;
import io.vtascan.types.Signature;
import io.vtascan.types.SliceType;
import io.vtascan.types.StructType;
import io.vtascan.types.TupleType;
import io.vtascan.types.Type;
import io.vtascan.types.Types;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fills in the body of one function. Register types are inferred from the operands the way SSA
 * construction would; registers are named {@code t0}, {@code t1}, ... unless {@link #named(String)}
 * chooses the name of the next one.
 * <p>
 * Instructions go to the current block, block 0 until {@link #block()} opens another one.
 */
public class FunctionBuilder {

    private static final Set<String> COMPARISONS = Set.of("==", "!=", "<", "<=", ">", ">=");

    private final ProgramBuilder program;
    private final Function function;
    private final Map<String, Value> values = new HashMap<>();
    private BasicBlock current;
    private int registerCount;
    private String pendingName;

    FunctionBuilder(ProgramBuilder program, Function function) {
        this.program = program;
        this.function = function;
    }

    public Function function() {
        return function;
    }

    public Parameter param(String name, Type type) {
        return define(function.addParam(name, type));
    }

    public FreeVar freeVar(String name, Type type) {
        return define(function.addFreeVar(name, type));
    }

    /**
     * Opens a new block and makes it current.
     *
     * @return the index of the new block
     */
    public int block() {
        current = function.addBlock();
        return current.index();
    }

    /**
     * Names the register created by the next instruction.
     */
    public FunctionBuilder named(String name) {
        this.pendingName = name;
        return this;
    }

    /**
     * Returns the parameter, free variable or register with the given name, or null.
     */
    public Value value(String name) {
        return values.get(name);
    }

    /**
     * Declares an anonymous function nested in this one, named {@code parent$N}.
     */
    public FunctionBuilder closure(Signature signature) {
        return program.closure(function, signature);
    }

    /**
     * Appends an already constructed instruction to the current block.
     */
    public <T extends Instruction> T add(T instruction) {
        if (current == null) {
            block();
        }
        if (instruction instanceof Register r) {
            define(r);
        }
        return current.add(instruction);
    }

    public Alloc alloc(Type type, boolean heap) {
        return add(new Alloc(nextName(), type, heap));
    }

    public BinOp binOp(String op, Value x, Value y) {
        Type type = COMPARISONS.contains(op) ? BasicType.BOOL : x.type();
        return add(new BinOp(nextName(), op, x, y, type));
    }

    public UnOp unOp(UnOp.Op op, Value x) {
        Type type = switch (op) {
            case DEREF -> pointerElem(x);
            case RECV -> chanElem(x);
            default -> x.type();
        };
        return add(new UnOp(nextName(), op, x, false, type));
    }

    /**
     * Receives from a channel, yielding {@code (value, ok bool)}.
     */
    public UnOp recvOk(Value chan) {
        return add(new UnOp(nextName(), UnOp.Op.RECV, chan, true, TupleType.of(chanElem(chan), BasicType.BOOL)));
    }

    public Call call(Value callee, Value... args) {
        CallCommon common = new CallCommon(callee, null, Arrays.asList(args));
        return add(new Call(nextName(), common, callType(common)));
    }

    /**
     * Calls a builtin; except for {@code recover} the result type must be given.
     */
    public Call callBuiltin(String name, Type resultType, Value... args) {
        Builtin builtin = Builtin.of(name);
        Type type = builtin.isRecover() ? InterfaceType.EMPTY : resultType;
        return add(new Call(nextName(), new CallCommon(builtin, null, Arrays.asList(args)), type));
    }

    public Call invoke(Value receiver, String method, Value... args) {
        CallCommon common = invokeCommon(receiver, method, args);
        return add(new Call(nextName(), common, callType(common)));
    }

    public Go go(CallCommon common) {
        return add(new Go(common));
    }

    public Defer defer(CallCommon common) {
        return add(new Defer(common));
    }

    public CallCommon callCommon(Value callee, Value... args) {
        return new CallCommon(callee, null, Arrays.asList(args));
    }

    public CallCommon invokeCommon(Value receiver, String method, Value... args) {
        if (!(receiver.type().underlying() instanceof InterfaceType iface)) {
            throw new IllegalArgumentException("Cannot invoke " + method + " on non-interface " + receiver.name()
                    + " of type " + receiver.type());
        }
        InterfaceType.Method m = iface.method(method).orElseThrow(() -> new IllegalArgumentException(
                "Interface " + receiver.type() + " has no method " + method));
        return new CallCommon(receiver, m, Arrays.asList(args));
    }

    public ChangeInterface changeInterface(Type type, Value x) {
        return add(new ChangeInterface(nextName(), x, type));
    }

    public ChangeType changeType(Type type, Value x) {
        return add(new ChangeType(nextName(), x, type));
    }

    public Convert convert(Type type, Value x) {
        return add(new Convert(nextName(), x, type));
    }

    public SliceToArrayPointer sliceToArrayPointer(Type type, Value x) {
        return add(new SliceToArrayPointer(nextName(), x, type));
    }

    public MakeInterface makeInterface(Type iface, Value x) {
        if (!Types.isInterface(iface)) {
            throw new IllegalArgumentException("make interface needs an interface type, got " + iface);
        }
        return add(new MakeInterface(nextName(), x, iface));
    }

    public MakeClosure makeClosure(Function fn, Value... bindings) {
        return add(new MakeClosure(nextName(), fn, Arrays.asList(bindings)));
    }

    public MakeChan makeChan(ChanType type, Value size) {
        return add(new MakeChan(nextName(), type, size));
    }

    public MakeMap makeMap(Type type, Value reserve) {
        requireUnderlying(type, MapType.class, "make map");
        return add(new MakeMap(nextName(), type, reserve));
    }

    public MakeSlice makeSlice(Type type, Value len, Value cap) {
        requireUnderlying(type, SliceType.class, "make slice");
        return add(new MakeSlice(nextName(), type, len, cap));
    }

    public Slice slice(Value x, Value low, Value high, Value max) {
        Type type = x.type();
        if (x.type().underlying() instanceof PointerType p && p.elem().underlying() instanceof ArrayType a) {
            type = new SliceType(a.elem());
        } else if (x.type().underlying() instanceof ArrayType a) {
            type = new SliceType(a.elem());
        }
        return add(new Slice(nextName(), x, low, high, max, type));
    }

    public Range range(Value x) {
        return add(new Range(nextName(), x));
    }

    /**
     * Advances a range iterator over a map or string.
     */
    public Next next(Value iter) {
        if (!(iter instanceof Range range)) {
            throw new IllegalArgumentException("next needs a range iterator, got " + iter.name());
        }
        Type ranged = range.x().type().underlying();
        if (ranged instanceof MapType map) {
            return add(new Next(nextName(), iter, false, TupleType.of(BasicType.BOOL, map.key(), map.value())));
        }
        if (ranged.equals(BasicType.STRING)) {
            return add(new Next(nextName(), iter, true, TupleType.of(BasicType.BOOL, BasicType.INT, BasicType.RUNE)));
        }
        throw new IllegalArgumentException("Cannot range over " + range.x().type());
    }

    public Extract extract(Value tuple, int index) {
        if (!(tuple.type() instanceof TupleType t) || index < 0 || index >= t.size()) {
            throw new IllegalArgumentException("Cannot extract #" + index + " from " + tuple.name()
                    + " of type " + tuple.type());
        }
        return add(new Extract(nextName(), tuple, index, t.at(index)));
    }

    public Field field(Value x, int index) {
        StructType struct = requireUnderlying(x.type(), StructType.class, "field");
        return add(new Field(nextName(), x, index, fieldOf(struct, index).type()));
    }

    public FieldAddr fieldAddr(Value x, int index) {
        StructType struct = requireUnderlying(pointerElem(x), StructType.class, "field address");
        return add(new FieldAddr(nextName(), x, index, new PointerType(fieldOf(struct, index).type())));
    }

    public Index index(Value x, Value idx) {
        ArrayType array = requireUnderlying(x.type(), ArrayType.class, "index");
        return add(new Index(nextName(), x, idx, array.elem()));
    }

    public IndexAddr indexAddr(Value x, Value idx) {
        Type elem = Types.sliceArrayElem(x.type());
        if (elem == null || x.type().underlying() instanceof ArrayType) {
            throw new IllegalArgumentException("index address needs a slice or array pointer, got " + x.type());
        }
        return add(new IndexAddr(nextName(), x, idx, new PointerType(elem)));
    }

    public Lookup lookup(Value x, Value key, boolean commaOk) {
        Type elem;
        if (x.type().underlying() instanceof MapType map) {
            elem = map.value();
        } else if (x.type().underlying().equals(BasicType.STRING)) {
            elem = BasicType.BYTE;
        } else {
            throw new IllegalArgumentException("lookup needs a map or string, got " + x.type());
        }
        Type type = commaOk ? TupleType.of(elem, BasicType.BOOL) : elem;
        return add(new Lookup(nextName(), x, key, commaOk, type));
    }

    public MapUpdate mapUpdate(Value map, Value key, Value value) {
        requireUnderlying(map.type(), MapType.class, "map update");
        return add(new MapUpdate(map, key, value));
    }

    public Send send(Value chan, Value x) {
        chanElem(chan);
        return add(new Send(chan, x));
    }

    public Select select(List<Select.SelectState> states, boolean blocking) {
        List<Type> components = new ArrayList<>(List.of(BasicType.INT, BasicType.BOOL));
        for (Select.SelectState state : states) {
            if (state.dir() == ChanDir.RECV_ONLY) {
                components.add(chanElem(state.chan()));
            }
        }
        return add(new Select(nextName(), states, blocking, new TupleType(components)));
    }

    public TypeAssert typeAssert(Value x, Type asserted, boolean commaOk) {
        if (!Types.isInterface(x.type())) {
            throw new IllegalArgumentException("type assertion needs an interface operand, got " + x.type());
        }
        Type type = commaOk ? TupleType.of(asserted, BasicType.BOOL) : asserted;
        return add(new TypeAssert(nextName(), x, asserted, commaOk, type));
    }

    /**
     * Creates a phi; edges that refer to later registers can be added with {@link Phi#addEdge}.
     */
    public Phi phi(Type type, Value... edges) {
        Phi phi = add(new Phi(nextName(), type));
        for (Value edge : edges) {
            phi.addEdge(edge);
        }
        return phi;
    }

    public Store store(Value addr, Value val) {
        pointerElem(addr);
        return add(new Store(addr, val));
    }

    public Panic panic(Value x) {
        return add(new Panic(x));
    }

    public Return ret(Value... results) {
        int expected = function.signature().results().size();
        if (results.length != expected) {
            throw new IllegalArgumentException(function.name() + " returns " + expected + " values, got "
                    + results.length);
        }
        return add(new Return(Arrays.asList(results)));
    }

    public Jump jump(int target) {
        return add(new Jump(target));
    }

    public If ifThen(Value cond, int thenBlock, int elseBlock) {
        return add(new If(cond, thenBlock, elseBlock));
    }

    public RunDefers runDefers() {
        return add(new RunDefers());
    }

    private static Type callType(CallCommon common) {
        return common.signature().resultType();
    }

    private <V extends Value> V define(V value) {
        if (values.putIfAbsent(value.name(), value) != null) {
            throw new IllegalArgumentException("Duplicate value " + value.name() + " in " + function.name());
        }
        return value;
    }

    private String nextName() {
        if (pendingName != null) {
            String name = pendingName;
            pendingName = null;
            return name;
        }
        String name;
        do {
            name = "t" + registerCount++;
        } while (values.containsKey(name));
        return name;
    }

    private static Type pointerElem(Value x) {
        if (!(x.type().underlying() instanceof PointerType p)) {
            throw new IllegalArgumentException(x.name() + " is not a pointer: " + x.type());
        }
        return p.elem();
    }

    private static Type chanElem(Value x) {
        if (!(x.type().underlying() instanceof ChanType c)) {
            throw new IllegalArgumentException(x.name() + " is not a channel: " + x.type());
        }
        return c.elem();
    }

    private static StructType.Field fieldOf(StructType struct, int index) {
        if (index < 0 || index >= struct.size()) {
            throw new IllegalArgumentException("Struct " + struct + " has no field #" + index);
        }
        return struct.field(index);
    }

    private static <T extends Type> T requireUnderlying(Type type, Class<T> kind, String what) {
        if (!kind.isInstance(type.underlying())) {
            throw new IllegalArgumentException(what + " cannot be applied to type " + type);
        }
        return kind.cast(type.underlying());
    }
}
