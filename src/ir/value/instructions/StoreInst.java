package ir.value.instructions;

import ir.type.VoidType;
import ir.value.Opcode;
import ir.value.Value;

public class StoreInst extends Instruction {
    private boolean isVolatile;
    private int alignment;

    // 操作数顺序: [value, pointer]
    public StoreInst(Value value, Value pointer) {
        super(Opcode.STORE, VoidType.getVoid(), null, value, pointer);
    }

    public Value getValue() {
        return getOperand(0);
    }

    public Value getPointer() {
        return getOperand(1);
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
        StringBuilder sb = new StringBuilder("store ");
        if (isVolatile) {
            sb.append("volatile ");
        }
        sb.append(getValue().getTypedReference())
          .append(", ").append(getPointer().getTypedReference());
        if (alignment > 0) {
            sb.append(", align ").append(alignment);
        }
        return sb.toString();
    }
}
