package ir.type;

import java.util.Objects;

public final class PointerType extends Type {
    /** Logical pointer width, independent of any target. */
    public static final long POINTER_BITS = 64;

    private final Type elementType;
    private final int addressSpace;

    private PointerType(Type elementType, int addressSpace) {
        super(TypeKind.POINTER);
        this.elementType = Objects.requireNonNull(elementType, "elementType");
        this.addressSpace = addressSpace;
    }

    public static PointerType get(Type elementType) {
        return new PointerType(elementType, 0);
    }

    public static PointerType get(Type elementType, int addressSpace) {
        return new PointerType(elementType, addressSpace);
    }

    public Type getElementType() {
        return elementType;
    }

    public int getAddressSpace() {
        return addressSpace;
    }

    @Override
    public String toIR() {
        if (addressSpace != 0) {
            return "ptr<" + elementType.toIR() + ", " + addressSpace + ">";
        }
        return "ptr<" + elementType.toIR() + ">";
    }

    @Override
    public long getBitSize() {
        return POINTER_BITS;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PointerType other)) return false;
        return addressSpace == other.addressSpace
            && elementType.equals(other.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), elementType, addressSpace);
    }
}
