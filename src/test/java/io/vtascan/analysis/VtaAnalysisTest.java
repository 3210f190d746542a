package io.vtascan.analysis;

import io.vtascan.graph.Node;
import io.vtascan.ir.Function;
import io.vtascan.ir.Program;
import io.vtascan.loader.ProgramFixtures;
import io.vtascan.model.CallGraph;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class VtaAnalysisTest {

    static List<String> fixtures() {
        return ProgramFixtures.ALL;
    }

    private static VtaResult analyze(String fixture) {
        return new VtaAnalysis(ProgramFixtures.program(fixture)).analyze();
    }

    private static Set<String> typesAt(VtaResult result, String node) {
        return result.types().nodes().stream()
                .filter(n -> n.toString().equals(node))
                .flatMap(n -> result.types().get(n).stream())
                .map(PropType::toString)
                .collect(Collectors.toSet());
    }

    @ParameterizedTest
    @MethodSource("fixtures")
    void analyze_extendsTheBaseline(String fixture) {
        VtaResult result = analyze(fixture);

        assertThat(result.callGraph().containsAll(result.baseline())).isTrue();
        assertThat(result.callGraph().containsAll(result.resolved())).isTrue();
        assertThat(result.addedEdgeCount()).isGreaterThanOrEqualTo(0);
    }

    @ParameterizedTest
    @MethodSource("fixtures")
    void analyze_resolvesNoMoreThanClassHierarchyAnalysis(String fixture) {
        VtaResult result = analyze(fixture);

        assertThat(result.baseline().edgeStrings()).containsAll(result.resolved().edgeStrings());
    }

    @Test
    void analyze_resolvesStaticCallsAndFunctionValues() {
        VtaResult result = analyze("static");

        assertThat(result.resolved().edgeStrings()).containsExactly(
                "(*C).f -> (C).f",
                "f -> (C).f",
                "f -> f$1",
                "f -> g",
                "f -> h",
                "g -> (C).f");
        assertThat(typesAt(result, "Local(t4)")).contains("f$1", "h").doesNotContain("g");
    }

    @Test
    void analyze_isMorePreciseThanClassHierarchyAnalysis() {
        VtaResult result = analyze("static");

        assertThat(result.baseline().edgeStrings()).contains("f -> f", "g -> (*C).f");
        assertThat(result.resolved().edgeStrings()).doesNotContain("f -> f", "g -> (*C).f");
    }

    @Test
    void analyze_resolvesInterfaceInvocations() {
        assertThat(analyze("interfaces").resolved().edgeStrings()).contains("g -> (C).f");
    }

    @Test
    void analyze_keepsInstantiationsApart() {
        VtaResult result = analyze("generics");

        assertThat(result.resolved().edgeStrings())
                .contains("instantiated[P.A] -> (A).F", "instantiated[P.B] -> (B).F")
                .doesNotContain("instantiated[P.A] -> (B).F", "instantiated[P.B] -> (A).F");
        assertThat(result.baseline().edgeStrings()).contains("instantiated[P.A] -> (B).F");
    }

    @Test
    void analyze_followsStoresThroughPointers() {
        assertThat(analyze("stores").resolved().edgeStrings()).contains("store -> (A).f");
    }

    @Test
    void analyze_followsClosureBindings() {
        assertThat(analyze("closures").resolved().edgeStrings()).contains("main -> main$1", "main$1 -> (C).f");
    }

    @Test
    void analyze_followsChannels() {
        VtaResult result = analyze("channels");

        assertThat(result.resolved().edgeStrings()).contains("consume -> (A).f");
        assertThat(typesAt(result, "Channel(chan P.I)")).containsExactly("P.A");
    }

    @Test
    void analyze_followsMapsFieldsAndSlices() {
        assertThat(analyze("maps").resolved().edgeStrings()).contains("fill -> (A).f");
        assertThat(analyze("fields").resolved().edgeStrings()).contains("set -> (A).f");
        assertThat(analyze("slices").resolved().edgeStrings()).contains("slices -> (A).f");
    }

    @Test
    void analyze_followsPanicsIntoRecover() {
        VtaResult result = analyze("panics");

        assertThat(result.resolved().edgeStrings()).contains("catcher -> (A).f");
        assertThat(result.types().get(Node.RECOVER_RETURN)).extracting(PropType::toString).contains("P.A");
    }

    @Test
    void analyze_followsConversions() {
        assertThat(analyze("conversions").resolved().edgeStrings())
                .contains("conv -> h", "conv -> (A).f", "main -> conv")
                .doesNotContain("conv -> main");
    }

    @Test
    void analyze_keepsFunctionsBehindNamedFunctionTypes() {
        VtaResult result = analyze("functypes");

        assertThat(result.resolved().edgeStrings())
                .contains("main -> (F).m", "(F).m -> h")
                .doesNotContain("(F).m -> main");
        assertThat(result.baseline().edgeStrings()).contains("(F).m -> main");
        assertThat(typesAt(result, "Local(t1)")).containsExactlyInAnyOrder("P.F", "h");
        assertThat(typesAt(result, "Local(recv)")).contains("h");
    }

    @Test
    void analyze_followsNestedPointers() {
        VtaResult result = analyze("pointers");

        assertThat(result.resolved().edgeStrings()).contains("store -> (A).f", "install -> h");
        assertThat(typesAt(result, "PtrInterface(P.I)")).containsExactly("P.A");
        assertThat(typesAt(result, "Local(s3)")).containsExactly("P.A");
        assertThat(typesAt(result, "Local(i2)")).contains("h");
    }

    @Test
    void analyze_followsResultsAndTypeAssertions() {
        VtaResult result = analyze("results");

        assertThat(result.resolved().edgeStrings())
                .contains("main -> use", "use -> build", "use -> (A).f", "use -> (B).f");
        assertThat(typesAt(result, "Local(u0)")).containsExactly("P.B");
        assertThat(typesAt(result, "Local(u2)")).containsExactly("P.A");
    }

    @Test
    void analyze_mergesTypesFromSharedFieldsAndMaps() {
        VtaResult result = analyze("shared");

        assertThat(result.resolved().edgeStrings()).contains("r -> (A).f", "r -> (B).f");
        assertThat(typesAt(result, "Local(r0)")).containsExactlyInAnyOrder("P.A", "P.B");
        assertThat(typesAt(result, "Local(r2)")).containsExactlyInAnyOrder("P.A", "P.B");
    }

    @Test
    void analyze_leavesSitesWithoutTypesToTheBaseline() {
        Program program = ProgramFixtures.program("interfaces");
        Function g = ProgramFixtures.function(program, "g");
        CallGraph cha = new ChaCallGraphBuilder(program).build();

        VtaResult result = new CallResolverHarness(program).resolveWithoutTypes(List.of(g), cha);

        assertThat(result.resolved().edgeCount()).isZero();
        assertThat(result.callGraph().edgeStrings()).isEqualTo(cha.edgeStrings());
    }

    @Test
    void analyze_reportsEachRound() {
        List<Integer> rounds = new ArrayList<>();
        Program program = ProgramFixtures.program("static");

        new VtaAnalysis(program, 2, (round, snapshot) -> rounds.add(round)).analyze();

        assertThat(rounds).isNotEmpty();
        assertThat(rounds.get(0)).isEqualTo(1);
    }

    /**
     * Combines a baseline with what the resolver derives from empty type sets.
     */
    private static final class CallResolverHarness {

        private final Program program;

        CallResolverHarness(Program program) {
            this.program = program;
        }

        VtaResult resolveWithoutTypes(List<Function> functions, CallGraph baseline) {
            CallGraph resolved = new CallResolver(program).resolve(functions, TypeSets.empty());
            CallGraph callGraph = new CallGraph.Builder().addAll(baseline).addAll(resolved).build();
            return new VtaResult(null, TypeSets.empty(), baseline, resolved, callGraph);
        }
    }
}
