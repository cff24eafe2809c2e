package ir.value;

import ir.type.Type;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exception.IRException;

/**
 * A value that refers to other values. The operand count is fixed when the
 * user is created; operands are non-owning references.
 */
public abstract class User extends Value {

    private final Value[] operands;

    protected User(Type type, String name, Value... operands) {
        super(type, name);
        this.operands = new Value[operands.length];
        for (int i = 0; i < operands.length; i++) {
            this.operands[i] = requireOperand(operands[i], i);
        }
    }

    /* getter */
    public int getNumOperands() { return operands.length; }

    public Value getOperand(int index) {
        checkIndex(index);
        return operands[index];
    }

    // to assure the consistency, you can only get a read only list
    public List<Value> getOperands() {
        return Collections.unmodifiableList(Arrays.asList(operands));
    }

    /* updater */
    public void setOperand(int index, Value value) {
        checkIndex(index);
        operands[index] = requireOperand(value, index);
    }

    /* check field */
    // 检查是否使用了指定的值
    public boolean usesValue(Value value) {
        return getOperandIndex(value) >= 0;
    }

    // 获取指定值在操作数中的索引
    public int getOperandIndex(Value value) {
        for (int i = 0; i < operands.length; i++) {
            if (operands[i] == value) {
                return i;
            }
        }
        return -1;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= operands.length) {
            throw IRException.illegalOperand(
                "index " + index + " out of range for " + operands.length + " operands");
        }
    }

    private static Value requireOperand(Value value, int index) {
        if (value == null) {
            throw IRException.illegalOperand("operand " + index + " is null");
        }
        return value;
    }
}
