package ir.value.constants;

import ir.type.IntegerType;

public class ConstantInt extends Constant {
    private final long value;

    public ConstantInt(IntegerType type, long value) {
        super(type);
        this.value = value;
    }

    public long getValue() { return value; }

    @Override
    public IntegerType getType() {
        return (IntegerType) super.getType();
    }

    @Override
    public String getLiteral() {
        return Long.toString(value);
    }
}
