package ir.value.instructions;

import ir.type.VoidType;
import ir.value.Opcode;
import ir.value.Value;

import org.jetbrains.annotations.Nullable;

public class ReturnInst extends Instruction {

    /** {@code ret void} */
    public ReturnInst() {
        super(Opcode.RET, VoidType.getVoid(), null);
    }

    public ReturnInst(Value returnValue) {
        super(Opcode.RET, VoidType.getVoid(), null, returnValue);
    }

    public boolean hasReturnValue() {
        return getNumOperands() > 0;
    }

    public @Nullable Value getReturnValue() {
        return hasReturnValue() ? getOperand(0) : null;
    }

    @Override
    public String toIR() {
        if (hasReturnValue()) {
            return "ret " + getOperand(0).getTypedReference();
        } else {
            return "ret void";
        }
    }
}
