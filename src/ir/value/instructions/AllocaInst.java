package ir.value.instructions;

import ir.type.PointerType;
import ir.type.Type;
import ir.value.Opcode;
import ir.value.Value;

import org.jetbrains.annotations.Nullable;

/**
 * Stack slot. The result is a pointer to the allocated type; without an
 * explicit element count a single element is allocated.
 */
public class AllocaInst extends Instruction {
    private final Type allocatedType;
    private int alignment;

    public AllocaInst(Type allocatedType, String name) {
        super(Opcode.ALLOCA, PointerType.get(allocatedType), name);
        this.allocatedType = allocatedType;
    }

    public AllocaInst(Type allocatedType, Value numElements, String name) {
        super(Opcode.ALLOCA, PointerType.get(allocatedType), name, numElements);
        this.allocatedType = allocatedType;
    }

    public Type getAllocatedType() {
        return allocatedType;
    }

    public @Nullable Value getNumElements() {
        return getNumOperands() > 0 ? getOperand(0) : null;
    }

    public int getAlignment() {
        return alignment;
    }

    public void setAlignment(int alignment) {
        this.alignment = alignment;
    }

    @Override
    public String toIR() {
        StringBuilder sb = new StringBuilder();
        sb.append(resultPrefix()).append("alloca ").append(allocatedType.toIR());
        Value count = getNumElements();
        if (count != null) {
            sb.append(", ").append(count.getTypedReference());
        }
        if (alignment > 0) {
            sb.append(", align ").append(alignment);
        }
        return sb.toString();
    }
}
