package ir.value.constants;

import ir.type.ArrayType;

import java.util.List;
import java.util.stream.Collectors;

public class ConstantArray extends Constant {
    public ConstantArray(ArrayType type, List<Constant> elements) {
        super(type, elements.toArray(new Constant[0]));
    }

    public List<Constant> getElements() {
        return this.getOperands()
            .stream()
            .map(operand -> (Constant) operand)
            .collect(Collectors.toList());
    }

    public Constant getElement(int index) {
        return (Constant) getOperand(index);
    }

    @Override
    public String getLiteral() {
        String elementList = getElements().stream()
            .map(Constant::toIR)
            .collect(Collectors.joining(", "));
        return "[" + elementList + "]";
    }
}
