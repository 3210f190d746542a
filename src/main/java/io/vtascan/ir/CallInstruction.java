package io.vtascan.ir;

/**
 * An instruction that performs a call: {@link Call}, {@link Go} or {@link Defer}.
 */
public interface CallInstruction {

    CallCommon common();

    Function parent();

    String location();
}
