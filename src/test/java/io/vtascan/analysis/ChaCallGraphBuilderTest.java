package io.vtascan.analysis;

import io.vtascan.ir.Call;
import io.vtascan.ir.FunctionBuilder;
import io.vtascan.ir.Program;
import io.vtascan.ir.ProgramBuilder;
import io.vtascan.loader.ProgramFixtures;
import io.vtascan.model.CallGraph;
import io.vtascan.types.BasicType;
import io.vtascan.types.NamedType;
import io.vtascan.types.Signature;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChaCallGraphBuilderTest {

    @Test
    void build_dispatchesInvocationsToEveryImplementation() {
        CallGraph cha = new ChaCallGraphBuilder(ProgramFixtures.program("static")).build();

        assertThat(cha.edgeStrings()).contains("g -> (C).f", "g -> (*C).f");
    }

    @Test
    void build_matchesFunctionValuesBySignature() {
        CallGraph cha = new ChaCallGraphBuilder(ProgramFixtures.program("static")).build();

        assertThat(cha.edgeStrings())
                .contains("f -> f", "f -> h", "f -> f$1")
                .doesNotContain("f -> (*C).f");
    }

    @Test
    void build_doesNotSeparateInstantiations() {
        CallGraph cha = new ChaCallGraphBuilder(ProgramFixtures.program("generics")).build();

        assertThat(cha.edgeStrings()).contains(
                "instantiated[P.A] -> (A).F",
                "instantiated[P.A] -> (B).F",
                "instantiated[P.B] -> (A).F",
                "instantiated[P.B] -> (B).F");
    }

    @Test
    void build_keepsStaticCallees() {
        Program program = ProgramFixtures.program("static");

        CallGraph cha = new ChaCallGraphBuilder(program).build();

        assertThat(cha.containsAll(new StaticCallGraphBuilder(program).build())).isTrue();
    }

    @Test
    void build_ignoresBuiltins() {
        Program program = ProgramFixtures.program("panics");

        CallGraph cha = new ChaCallGraphBuilder(program).build();

        assertThat(cha.edgeStrings()).containsExactly("catcher -> (A).f");
        assertThat(cha.callees(ProgramFixtures.function(program, "thrower"))).isEmpty();
    }

    @Test
    void build_skipsTypesWithoutTheMethod() {
        ProgramBuilder pb = new ProgramBuilder("P");
        NamedType i = pb.namedType("I", pb.types().parse("interface{f()}"));
        NamedType c = pb.namedType("C", BasicType.INT);
        pb.namedType("D", BasicType.INT);
        pb.method(c, true, "f", Signature.NO_ARGS).ret();
        FunctionBuilder g = pb.function("g", new Signature(List.of(i), List.of()));
        Call site = g.invoke(g.param("x", i), "f");
        g.ret();
        Program program = pb.build();

        CallGraph cha = new ChaCallGraphBuilder(program).build();

        // only *C has f in its method set
        assertThat(cha.calleesAt(site)).extracting(fn -> fn.name()).containsExactly("(*C).f");
        assertThat(cha.functions()).hasSize(2);
    }
}
