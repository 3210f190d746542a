package io.vtascan.loader;

import io.vtascan.ir.Program;

import java.util.List;

/**
 * A program read from a description, with the flow graph lines the description expects.
 *
 * @param program The program
 * @param want    Expected {@code node -> succ, ...} lines, empty if the description lists none
 */
public record LoadedProgram(Program program, List<String> want) {

    public LoadedProgram {
        want = List.copyOf(want);
    }
}
