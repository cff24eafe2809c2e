package ir.value.instructions;

import ir.type.Type;
import ir.value.Opcode;
import ir.value.Value;

public class LoadInst extends Instruction {
    private boolean isVolatile;
    private int alignment;

    public LoadInst(Type type, Value pointer, String name) {
        super(Opcode.LOAD, type, name, pointer);
    }

    public Value getPointer() {
        return getOperand(0);
    }

    public boolean isVolatile() {
        return isVolatile;
    }

    public void setVolatile(boolean isVolatile) {
        this.isVolatile = isVolatile;
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
        sb.append(resultPrefix()).append("load ");
        if (isVolatile) {
            sb.append("volatile ");
        }
        sb.append(getType().toIR()).append(", ").append(getPointer().getTypedReference());
        if (alignment > 0) {
            sb.append(", align ").append(alignment);
        }
        return sb.toString();
    }
}
