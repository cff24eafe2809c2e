package ir.value.instructions;

import exception.IRException;
import ir.type.Type;
import ir.value.Opcode;
import ir.value.Value;

public class CastInst extends Instruction {

    public CastInst(Opcode op, Value value, Type destType, String name) {
        super(requireCast(op), destType, name, value);
    }

    private static Opcode requireCast(Opcode op) {
        if (!op.isCast()) {
            throw IRException.unSupported(op + " is not a cast");
        }
        return op;
    }

    public Value getValue() {
        return getOperand(0);
    }

    public Type getDestType() {
        return getType();
    }

    @Override
    public String toIR() {
        return resultPrefix() + opCode().getMnemonic() + " "
                + getValue().getTypedReference() + " to " + getDestType().toIR();
    }
}
