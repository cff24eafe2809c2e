package ir.value.instructions;

import ir.type.IntegerType;
import ir.value.Opcode;
import ir.value.Value;

public class ICmpInst extends Instruction {
    private final ICmpPredicate predicate;

    public ICmpInst(ICmpPredicate predicate, Value lhs, Value rhs, String name) {
        super(Opcode.ICMP, IntegerType.getI1(), name, lhs, rhs);
        this.predicate = predicate;
    }

    public ICmpPredicate getPredicate() {
        return predicate;
    }

    @Override
    public String toIR() {
        Value lhs = getOperand(0);
        Value rhs = getOperand(1);
        return resultPrefix() + "icmp " + predicate.getKeyword()
                + " " + lhs.getTypedReference() + ", " + rhs.getReference();
    }
}
