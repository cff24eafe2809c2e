package ir.type;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class ArrayType extends Type {
    private final Type elementType;
    private final long length;

    private ArrayType(Type elementType, long length) {
        super(TypeKind.ARRAY);
        this.elementType = Objects.requireNonNull(elementType, "elementType");
        this.length = length;
    }

    public static ArrayType get(Type elementType, long length) {
        return new ArrayType(elementType, length);
    }

    public Type getElementType() {
        return elementType;
    }

    public long getLength() {
        return length;
    }

    /**
     * get the dims of the array, eg:
     *  [4 x i32] → [4]
     *  [3 x [4 x i32]] → [3, 4]
     */
    public List<Long> getDims() {
        List<Long> dims = new ArrayList<>();
        Type current = this;
        while (current instanceof ArrayType array) {
            dims.add(array.getLength());
            current = array.getElementType();
        }
        return dims;
    }

    @Override
    public String toIR() {
        return "[" + length + " x " + elementType.toIR() + "]";
    }

    @Override
    public long getBitSize() {
        return elementType.getBitSize() * length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrayType other)) return false;
        return length == other.length && elementType.equals(other.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), elementType, length);
    }
}
