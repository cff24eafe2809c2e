package ir.value.constants;

import ir.type.Type;
import ir.value.User;
import ir.value.Value;

import exception.IRException;

/**
 * Immutable, freestanding value. Constants are never owned by a container
 * and are referenced inline by their literal.
 */
public abstract class Constant extends User {
    protected Constant(Type type, Constant... elements) {
        super(type, "", elements);
    }

    @Override public boolean isConstant() { return true; }

    /** The value part only, e.g. {@code 42} or {@code [i32 1, i32 2]}. */
    public abstract String getLiteral();

    @Override
    public String getReference() {
        return getLiteral();
    }

    @Override
    public void setOperand(int index, Value value) {
        throw IRException.unSupported("constants are immutable");
    }

    @Override
    public String toIR() {
        return getType().toIR() + " " + getLiteral();
    }
}
