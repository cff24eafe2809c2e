package ir.value.instructions;

import ir.value.Opcode;
import ir.value.Value;

public class SelectInst extends Instruction {

    public SelectInst(Value cond, Value trueVal, Value falseVal, String name) {
        super(Opcode.SELECT, checkOperand(trueVal, "true value").getType(), name, cond, trueVal, falseVal);
    }

    public Value getCondition() {
        return getOperand(0);
    }

    public Value getTrueValue() {
        return getOperand(1);
    }

    public Value getFalseValue() {
        return getOperand(2);
    }

    @Override
    public String toIR() {
        // %res = select i1 %cond, T %t, T %f
        return resultPrefix() + "select i1 " + getCondition().getReference() + ", "
                + getTrueValue().getTypedReference() + ", "
                + getFalseValue().getTypedReference();
    }
}
