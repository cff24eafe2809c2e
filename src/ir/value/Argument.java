package ir.value;

import ir.type.Type;

public class Argument extends Value {
    private final int index; // Argument index in the function
    private final Function parent; // The function this argument belongs to

    Argument(Type type, int index, Function parent) {
        super(type, null);
        this.index = index;
        this.parent = parent;
    }

    public int getIndex() { return index; }
    public Function getParent() { return parent; }

    // unnamed arguments are referenced positionally
    @Override
    public String getReference() {
        if (hasName()) {
            return "%" + getName();
        }
        return "%" + index;
    }

    @Override
    public String toIR() {
        return getTypedReference();
    }
}
