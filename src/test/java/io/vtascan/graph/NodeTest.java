package io.vtascan.graph;

import io.vtascan.ir.FunctionBuilder;
import io.vtascan.ir.MakeInterface;
import io.vtascan.ir.ProgramBuilder;
import io.vtascan.types.BasicType;
import io.vtascan.types.InterfaceType;
import io.vtascan.types.MapType;
import io.vtascan.types.NamedType;
import io.vtascan.types.PointerType;
import io.vtascan.types.Signature;
import io.vtascan.types.StructType;
import io.vtascan.types.TupleType;
import io.vtascan.types.TypeParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeTest {

    private static final PointerType PTR_INT = new PointerType(BasicType.INT);

    private NamedType x;
    private io.vtascan.ir.Global global;
    private io.vtascan.ir.Function main;
    private io.vtascan.ir.Function f;
    private MakeInterface t0;

    @BeforeEach
    void setUp() {
        ProgramBuilder pb = new ProgramBuilder("testdata");
        x = pb.namedType("X", TypeParser.parseBuiltin("struct{a int; b int}"));
        global = pb.global("gl", BasicType.INT);
        FunctionBuilder mainBuilder = pb.function("main", Signature.NO_ARGS);
        main = mainBuilder.function();
        t0 = mainBuilder.makeInterface(InterfaceType.EMPTY, new io.vtascan.ir.Const("1", BasicType.INT));
        f = pb.function("f", new Signature(List.of(), List.of(InterfaceType.EMPTY))).function();
    }

    @Test
    void toString_rendersEachVariant() {
        assertThat(new Node.Constant(BasicType.INT)).hasToString("Constant(int)");
        assertThat(new Node.Pointer(PTR_INT)).hasToString("Pointer(*int)");
        assertThat(new Node.MapKey(BasicType.INT)).hasToString("MapKey(int)");
        assertThat(new Node.MapValue(PTR_INT)).hasToString("MapValue(*int)");
        assertThat(new Node.SliceElem(BasicType.INT)).hasToString("Slice([]int)");
        assertThat(new Node.ChannelElem(PTR_INT)).hasToString("Channel(chan *int)");
        assertThat(new Node.Field(x, 0)).hasToString("Field(testdata.X:a)");
        assertThat(new Node.Global(global)).hasToString("Global(gl)");
        assertThat(new Node.Local(t0)).hasToString("Local(t0)");
        assertThat(new Node.IndexedLocal(t0, BasicType.INT, 0)).hasToString("Local(t0[0])");
        assertThat(new Node.Function(main)).hasToString("Function(main)");
        assertThat(new Node.Return(f, 0)).hasToString("Return(f[0])");
        assertThat(new Node.NestedPtrInterface(InterfaceType.EMPTY)).hasToString("PtrInterface(interface{})");
        assertThat(new Node.NestedPtrFunction(Signature.NO_ARGS)).hasToString("PtrFunction(func())");
        assertThat(Node.PANIC_ARG).hasToString("Panic");
        assertThat(Node.RECOVER_RETURN).hasToString("Recover");
    }

    @Test
    void type_isTheStaticType() {
        assertThat(new Node.Field(x, 1).type()).isEqualTo(BasicType.INT);
        assertThat(new Node.Global(global).type()).isEqualTo(PTR_INT);
        assertThat(new Node.Local(t0).type()).isEqualTo(InterfaceType.EMPTY);
        assertThat(new Node.Function(main).type()).isEqualTo(Signature.NO_ARGS);
        assertThat(new Node.Return(f, 0).type()).isEqualTo(InterfaceType.EMPTY);
        assertThat(Node.PANIC_ARG.type()).isNull();
        assertThat(Node.RECOVER_RETURN.type()).isNull();
    }

    @Test
    void equality_dependsOnlyOnCarriedFields() {
        MapType m = new MapType(BasicType.STRING, PTR_INT);

        assertThat(new Node.Constant(BasicType.INT)).isEqualTo(new Node.Constant(BasicType.INT));
        assertThat(new Node.Constant(BasicType.INT).hashCode())
                .isEqualTo(new Node.Constant(BasicType.INT).hashCode());
        assertThat(new Node.MapValue(m.value())).isEqualTo(new Node.MapValue(new PointerType(BasicType.INT)));
        assertThat(new Node.Field(x, 0)).isEqualTo(new Node.Field(x, 0));
        assertThat(new Node.Field(x, 0)).isNotEqualTo(new Node.Field(x, 1));
        assertThat(new Node.Local(t0)).isEqualTo(new Node.Local(t0));
        assertThat(new Node.IndexedLocal(t0, BasicType.INT, 0)).isNotEqualTo(new Node.IndexedLocal(t0, BasicType.INT, 1));
        assertThat(new Node.PanicArg()).isEqualTo(Node.PANIC_ARG);
    }

    @Test
    void equality_ofValueNodesIsIdentityOfTheValue() {
        ProgramBuilder pb = new ProgramBuilder("other");
        FunctionBuilder fb = pb.function("main", Signature.NO_ARGS);
        MakeInterface sameName = fb.makeInterface(InterfaceType.EMPTY, new io.vtascan.ir.Const("1", BasicType.INT));

        assertThat(sameName.name()).isEqualTo(t0.name());
        assertThat(new Node.Local(sameName)).isNotEqualTo(new Node.Local(t0));
    }

    @Test
    void equality_distinguishesVariantsOfTheSameType() {
        assertThat(new Node.MapKey(BasicType.INT)).isNotEqualTo(new Node.MapValue(BasicType.INT));
        assertThat(new Node.SliceElem(BasicType.INT)).isNotEqualTo(new Node.ChannelElem(BasicType.INT));
    }

    @Test
    void field_rejectsMissingFieldOrNonStruct() {
        assertThatThrownBy(() -> new Node.Field(x, 2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Node.Field(BasicType.INT, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Node.Return(main, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void indexedLocal_carriesComponentType() {
        Node node = new Node.IndexedLocal(t0, TupleType.of(BasicType.INT).at(0), 0);

        assertThat(node.type()).isEqualTo(BasicType.INT);
    }

    @Test
    void sentinelsAndReferences() {
        assertThat(Node.PANIC_ARG.isSentinel()).isTrue();
        assertThat(Node.RECOVER_RETURN.isSentinel()).isTrue();
        assertThat(new Node.Local(t0).isSentinel()).isFalse();

        assertThat(new Node.Pointer(PTR_INT).isReference()).isTrue();
        assertThat(new Node.Global(global).isReference()).isTrue();
        assertThat(new Node.NestedPtrInterface(InterfaceType.EMPTY).isReference()).isTrue();
        assertThat(new Node.Local(t0).isReference()).isFalse();
        assertThat(Node.PANIC_ARG.isReference()).isFalse();
        assertThat(new Node.Field(NamedType.of("P", "S", new StructType(List.of(
                new StructType.Field("p", PTR_INT)))), 0).isReference()).isTrue();
    }
}
