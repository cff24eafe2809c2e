package ir.value.instructions;

import ir.type.VoidType;
import ir.value.Opcode;

public class UnreachableInst extends Instruction {

    public UnreachableInst() {
        super(Opcode.UNREACHABLE, VoidType.getVoid(), null);
    }

    @Override
    public String toIR() {
        return "unreachable";
    }
}
