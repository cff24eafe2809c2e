package ir.value.constants;

import ir.type.StructType;

import java.util.List;
import java.util.stream.Collectors;

public class ConstantStruct extends Constant {
    public ConstantStruct(StructType type, List<Constant> fields) {
        super(type, fields.toArray(new Constant[0]));
    }

    public List<Constant> getFields() {
        return this.getOperands()
            .stream()
            .map(operand -> (Constant) operand)
            .collect(Collectors.toList());
    }

    public Constant getField(int index) {
        return (Constant) getOperand(index);
    }

    @Override
    public String getLiteral() {
        String fieldList = getFields().stream()
            .map(Constant::toIR)
            .collect(Collectors.joining(", "));
        return "{ " + fieldList + " }";
    }
}
