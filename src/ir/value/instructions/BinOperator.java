package ir.value.instructions;

import exception.IRException;
import ir.value.Opcode;
import ir.value.Value;

/**
 * Two-operand arithmetic or bitwise instruction. The result has the type of
 * the left operand.
 */
public class BinOperator extends Instruction {
    private boolean noUnsignedWrap;
    private boolean noSignedWrap;
    private boolean exact;

    public BinOperator(String name, Opcode opcode, Value lhs, Value rhs) {
        super(requireBinary(opcode), checkOperand(lhs, "lhs").getType(), name, lhs, rhs);
    }

    private static Opcode requireBinary(Opcode opcode) {
        if (!opcode.isBinary()) {
            throw IRException.unSupported(opcode + " is not a binary operator");
        }
        return opcode;
    }

    public Value getLHS() {
        return getOperand(0);
    }

    public Value getRHS() {
        return getOperand(1);
    }

    public boolean isCommutative() {
        switch (this.opCode()) {
            case ADD:
            case FADD:
            case MUL:
            case FMUL:
            case AND:
            case OR:
            case XOR:
                return true;
            default:
                return false;
        }
    }

    /* flags */
    public boolean hasNoUnsignedWrap() { return noUnsignedWrap; }
    public boolean hasNoSignedWrap() { return noSignedWrap; }
    public boolean isExact() { return exact; }

    public void setNoUnsignedWrap(boolean noUnsignedWrap) { this.noUnsignedWrap = noUnsignedWrap; }
    public void setNoSignedWrap(boolean noSignedWrap) { this.noSignedWrap = noSignedWrap; }
    public void setExact(boolean exact) { this.exact = exact; }

    @Override
    public String toIR() {
        StringBuilder sb = new StringBuilder();
        sb.append(resultPrefix()).append(opCode().getMnemonic());
        if (noUnsignedWrap) {
            sb.append(" nuw");
        }
        if (noSignedWrap) {
            sb.append(" nsw");
        }
        if (exact) {
            sb.append(" exact");
        }
        Value lhs = getLHS();
        Value rhs = getRHS();
        sb.append(" ").append(lhs.getType().toIR())
          .append(" ").append(lhs.getReference())
          .append(", ").append(rhs.getReference());
        return sb.toString();
    }
}
