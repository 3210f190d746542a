package io.vtascan.loader;

import io.vtascan.graph.FlowGraph;
import io.vtascan.ir.Function;
import io.vtascan.ir.Program;

import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads the program descriptions under {@code src/test/resources/programs}.
 */
public final class ProgramFixtures {

    public static final List<String> ALL = List.of(
            "static", "interfaces", "generics", "stores", "closures", "channels",
            "maps", "fields", "slices", "panics", "conversions", "functypes", "pointers",
            "results", "shared");

    private ProgramFixtures() {
    }

    public static LoadedProgram load(String name) {
        String resource = "/programs/" + name + ".yaml";
        InputStream in = ProgramFixtures.class.getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("No fixture " + resource);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return new ProgramLoader().load(reader, resource);
        } catch (Exception e) {
            throw new IllegalStateException("Cannot load fixture " + resource, e);
        }
    }

    public static Program program(String name) {
        return load(name).program();
    }

    public static Function function(Program program, String name) {
        return program.function(name)
                .orElseThrow(() -> new IllegalArgumentException("No function " + name + " in " + program));
    }

    /**
     * Expands {@code src -> dst_1, ..., dst_n} lines into one {@code src -> dst} string per edge.
     * Targets are split at commas outside parentheses and brackets.
     */
    public static Set<String> expandEdges(List<String> lines) {
        Set<String> edges = new LinkedHashSet<>();
        for (String line : lines) {
            int arrow = line.indexOf(" -> ");
            if (arrow < 0) {
                throw new IllegalArgumentException("Not an edge line: " + line);
            }
            String from = line.substring(0, arrow).trim();
            for (String to : splitTopLevel(line.substring(arrow + 4))) {
                edges.add(from + " -> " + to);
            }
        }
        return edges;
    }

    /**
     * Returns every edge of the graph as a {@code src -> dst} string.
     */
    public static Set<String> edges(FlowGraph graph) {
        Set<String> edges = new LinkedHashSet<>();
        graph.forEachEdge((from, to) -> edges.add(from + " -> " + to));
        return edges;
    }

    private static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(text.substring(start, i).trim());
                start = i + 1;
            }
        }
        parts.add(text.substring(start).trim());
        return parts;
    }
}
