package ir.value.constants;

import ir.type.PointerType;

public class ConstantNull extends Constant {
    public ConstantNull(PointerType type) {
        super(type);
    }

    @Override
    public String getLiteral() {
        return "null";
    }
}
