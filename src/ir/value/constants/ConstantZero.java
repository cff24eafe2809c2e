package ir.value.constants;

import ir.type.Type;

/** Zero value of any type, without materializing its elements. */
public class ConstantZero extends Constant {
    public ConstantZero(Type type) {
        super(type);
    }

    @Override
    public String getLiteral() {
        return "zeroinitializer";
    }
}
