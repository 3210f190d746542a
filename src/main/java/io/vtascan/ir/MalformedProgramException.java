package io.vtascan.ir;

/**
 * Thrown when an instruction references a value or type that cannot be classified. This is a
 * contract violation by whoever constructed the program, so it is never recovered from.
 */
public class MalformedProgramException extends RuntimeException {

    private final String location;

    public MalformedProgramException(Instruction instruction, String message) {
        this(instruction.location(), message + ": " + instruction);
    }

    public MalformedProgramException(String location, String message) {
        super(location + ": " + message);
        this.location = location;
    }

    /**
     * Returns the location of the offending instruction, e.g. {@code P.main: block 0, instruction 3}.
     */
    public String location() {
        return location;
    }
}
