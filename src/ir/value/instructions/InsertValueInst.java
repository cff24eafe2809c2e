package ir.value.instructions;

import java.util.List;

import ir.value.Opcode;
import ir.value.Value;

public class InsertValueInst extends Instruction {
    private final List<Integer> indices;

    public InsertValueInst(Value aggregate, Value value, List<Integer> indices, String name) {
        super(Opcode.INSERTVALUE, checkOperand(aggregate, "aggregate").getType(), name, aggregate, value);
        this.indices = List.copyOf(indices);
    }

    public Value getAggregate() {
        return getOperand(0);
    }

    public Value getInsertedValue() {
        return getOperand(1);
    }

    public List<Integer> getIndices() {
        return indices;
    }

    @Override
    public String toIR() {
        return resultPrefix() + "insertvalue " + getAggregate().getTypedReference()
                + ", " + getInsertedValue().getTypedReference()
                + ", " + joinIndices(indices);
    }
}
