package ir.value.instructions;

import ir.type.IntegerType;
import ir.value.Opcode;
import ir.value.Value;

public class FCmpInst extends Instruction {
    private final FCmpPredicate predicate;

    public FCmpInst(FCmpPredicate predicate, Value lhs, Value rhs, String name) {
        super(Opcode.FCMP, IntegerType.getI1(), name, lhs, rhs);
        this.predicate = predicate;
    }

    public FCmpPredicate getPredicate() {
        return predicate;
    }

    @Override
    public String toIR() {
        Value lhs = getOperand(0);
        Value rhs = getOperand(1);
        return resultPrefix() + "fcmp " + predicate.getKeyword()
                + " " + lhs.getTypedReference() + ", " + rhs.getReference();
    }
}
