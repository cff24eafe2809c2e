package ir.value.instructions;

import java.util.List;

import ir.value.Opcode;
import ir.value.Value;

/** Reads a member of an aggregate. The result carries the aggregate's type. */
public class ExtractValueInst extends Instruction {
    private final List<Integer> indices;

    public ExtractValueInst(Value aggregate, List<Integer> indices, String name) {
        super(Opcode.EXTRACTVALUE, checkOperand(aggregate, "aggregate").getType(), name, aggregate);
        this.indices = List.copyOf(indices);
    }

    public Value getAggregate() {
        return getOperand(0);
    }

    public List<Integer> getIndices() {
        return indices;
    }

    @Override
    public String toIR() {
        return resultPrefix() + "extractvalue " + getAggregate().getTypedReference()
                + ", " + joinIndices(indices);
    }
}
