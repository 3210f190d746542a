package io.vtascan.ir;

/**
 * Visits the instructions of a function body, one method per instruction class.
 * <p>
 * There are deliberately no default methods: every implementation states what it does for each
 * instruction, so adding an instruction class breaks every visitor until it is handled.
 */
public interface InstructionVisitor {

    void visitAlloc(Alloc instr);

    void visitBinOp(BinOp instr);

    void visitUnOp(UnOp instr);

    void visitCall(Call instr);

    void visitGo(Go instr);

    void visitDefer(Defer instr);

    void visitChangeInterface(ChangeInterface instr);

    void visitChangeType(ChangeType instr);

    void visitConvert(Convert instr);

    void visitSliceToArrayPointer(SliceToArrayPointer instr);

    void visitMakeInterface(MakeInterface instr);

    void visitMakeClosure(MakeClosure instr);

    void visitMakeChan(MakeChan instr);

    void visitMakeMap(MakeMap instr);

    void visitMakeSlice(MakeSlice instr);

    void visitSlice(Slice instr);

    void visitRange(Range instr);

    void visitNext(Next instr);

    void visitExtract(Extract instr);

    void visitField(Field instr);

    void visitFieldAddr(FieldAddr instr);

    void visitIndex(Index instr);

    void visitIndexAddr(IndexAddr instr);

    void visitLookup(Lookup instr);

    void visitMapUpdate(MapUpdate instr);

    void visitSend(Send instr);

    void visitSelect(Select instr);

    void visitTypeAssert(TypeAssert instr);

    void visitPhi(Phi instr);

    void visitStore(Store instr);

    void visitPanic(Panic instr);

    void visitReturn(Return instr);

    void visitJump(Jump instr);

    void visitIf(If instr);

    void visitRunDefers(RunDefers instr);
}
