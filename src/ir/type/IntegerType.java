package ir.type;

import java.util.Objects;

public final class IntegerType extends Type {
    private final int bitWidth;
    private final boolean signed;

    public static final IntegerType I1 = new IntegerType(1, true);
    public static final IntegerType I8 = new IntegerType(8, true);
    public static final IntegerType I16 = new IntegerType(16, true);
    public static final IntegerType I32 = new IntegerType(32, true);
    public static final IntegerType I64 = new IntegerType(64, true);
    public static final IntegerType I128 = new IntegerType(128, true);

    public static final IntegerType U8 = new IntegerType(8, false);
    public static final IntegerType U16 = new IntegerType(16, false);
    public static final IntegerType U32 = new IntegerType(32, false);
    public static final IntegerType U64 = new IntegerType(64, false);

    private IntegerType(int bitWidth, boolean signed) {
        super(TypeKind.INTEGER);
        this.bitWidth = bitWidth;
        this.signed = signed;
    }

    public static IntegerType get(int bitWidth, boolean signed) {
        return new IntegerType(bitWidth, signed);
    }

    public static IntegerType getI1() { return I1; }
    public static IntegerType getI8() { return I8; }
    public static IntegerType getI32() { return I32; }
    public static IntegerType getI64() { return I64; }

    public int getBitWidth() {
        return bitWidth;
    }

    public boolean isSigned() {
        return signed;
    }

    @Override
    public String toIR() {
        return (signed ? "i" : "u") + bitWidth;
    }

    @Override
    public long getBitSize() {
        return bitWidth;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntegerType other)) return false;
        return bitWidth == other.bitWidth && signed == other.signed;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), bitWidth, signed);
    }
}
