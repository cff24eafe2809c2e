package ir.type;

import java.util.Objects;

public final class VectorType extends Type {
    private final Type elementType;
    private final int numElements;
    // SVE-style: numElements is a minimum, scaled by an unknown runtime factor
    private final boolean scalable;

    private VectorType(Type elementType, int numElements, boolean scalable) {
        super(TypeKind.VECTOR);
        this.elementType = Objects.requireNonNull(elementType, "elementType");
        this.numElements = numElements;
        this.scalable = scalable;
    }

    public static VectorType get(Type elementType, int numElements) {
        return new VectorType(elementType, numElements, false);
    }

    public static VectorType getScalable(Type elementType, int minElements) {
        return new VectorType(elementType, minElements, true);
    }

    public Type getElementType() {
        return elementType;
    }

    public int getNumElements() {
        return numElements;
    }

    public boolean isScalable() {
        return scalable;
    }

    @Override
    public String toIR() {
        StringBuilder sb = new StringBuilder();
        sb.append("<");
        if (scalable) {
            sb.append("vscale x ");
        }
        sb.append(numElements).append(" x ").append(elementType.toIR()).append(">");
        return sb.toString();
    }

    @Override
    public long getBitSize() {
        if (scalable) {
            return UNSIZED;
        }
        return elementType.getBitSize() * numElements;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof VectorType other))
            return false;
        return this.numElements == other.numElements
            && this.scalable == other.scalable
            && this.elementType.equals(other.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), elementType, numElements, scalable);
    }
}
