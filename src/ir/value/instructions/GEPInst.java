package ir.value.instructions;

import java.util.List;

import ir.type.PointerType;
import ir.type.Type;
import ir.value.Opcode;
import ir.value.Value;

/**
 * Address computation from a base pointer and an index path. The result is
 * always a pointer to the source element type, whatever the indices are.
 */
public class GEPInst extends Instruction {
    private final Type sourceElementType;
    private final boolean inBounds;

    public GEPInst(Type sourceElementType, Value pointer, List<Value> indices,
                   boolean inBounds, String name) {
        super(Opcode.GETELEMENTPTR, PointerType.get(sourceElementType), name,
              operandsOf(pointer, indices));
        this.sourceElementType = sourceElementType;
        this.inBounds = inBounds;
    }

    private static Value[] operandsOf(Value pointer, List<Value> indices) {
        Value[] operands = new Value[indices.size() + 1];
        operands[0] = pointer;
        for (int i = 0; i < indices.size(); i++) {
            operands[i + 1] = indices.get(i);
        }
        return operands;
    }

    public Type getSourceElementType() {
        return sourceElementType;
    }

    public boolean isInBounds() {
        return inBounds;
    }

    public Value getPointer() {
        return getOperand(0);
    }

    public List<Value> getIndices() {
        return getOperands().subList(1, getNumOperands());
    }

    public int getNumIndices() {
        return getNumOperands() - 1;
    }

    @Override
    public String toIR() {
        StringBuilder sb = new StringBuilder();
        sb.append(resultPrefix()).append("getelementptr ");
        if (inBounds) {
            sb.append("inbounds ");
        }
        sb.append(sourceElementType.toIR()).append(", ")
          .append(getPointer().getTypedReference());
        List<Value> indices = getIndices();
        if (!indices.isEmpty()) {
            sb.append(", ").append(joinTyped(indices));
        }
        return sb.toString();
    }
}
