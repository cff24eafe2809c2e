package ir.type;

import java.util.Objects;

public final class FloatType extends Type {
    private final int bitWidth;

    public static final FloatType F16 = new FloatType(16);
    public static final FloatType F32 = new FloatType(32);
    public static final FloatType F64 = new FloatType(64);
    public static final FloatType F128 = new FloatType(128);

    private FloatType(int bitWidth) {
        super(TypeKind.FLOAT);
        this.bitWidth = bitWidth;
    }

    public static FloatType get(int bitWidth) {
        return new FloatType(bitWidth);
    }

    public static FloatType getFloat() {
        return F32;
    }

    public static FloatType getDouble() {
        return F64;
    }

    public int getBitWidth() {
        return bitWidth;
    }

    @Override
    public String toIR() {
        return "f" + bitWidth;
    }

    @Override
    public long getBitSize() {
        return bitWidth;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FloatType other)) return false;
        return bitWidth == other.bitWidth;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), bitWidth);
    }
}
