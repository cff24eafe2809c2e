package ir.value.constants;

import ir.type.Type;

public class ConstantUndef extends Constant {
    public ConstantUndef(Type type) {
        super(type);
    }

    @Override
    public String getLiteral() {
        return "undef";
    }
}
