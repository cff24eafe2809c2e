package ir.type;

/**
 * Shape of a value. Types are immutable and never own runtime values.
 *
 * Equality is structural for every variant except named structs, which
 * compare by name alone (see {@link StructType#equals(Object)}).
 */
public abstract class Type {
    /** Reported by {@link #getBitSize()} for types without a static size. */
    public static final long UNSIZED = 0;

    private final TypeKind kind;

    protected Type(TypeKind kind) {
        this.kind = kind;
    }

    public TypeKind getKind() {
        return this.kind;
    }

    /** Canonical type syntax, shared with the textual printer. */
    public abstract String toIR();

    /**
     * Size in bits, computed structurally. Pointers have a fixed logical
     * width; function, label, void and scalable vector types are
     * {@link #UNSIZED}.
     */
    public abstract long getBitSize();

    /* classification helpers */
    public boolean is(TypeKind k) { return kind == k; }
    public boolean isVoid() { return is(TypeKind.VOID); }
    public boolean isInteger() { return is(TypeKind.INTEGER); }
    public boolean isFloat() { return is(TypeKind.FLOAT); }
    public boolean isPointer() { return is(TypeKind.POINTER); }
    public boolean isArray() { return is(TypeKind.ARRAY); }
    public boolean isStruct() { return is(TypeKind.STRUCT); }
    public boolean isFunc() { return is(TypeKind.FUNC); }
    public boolean isVector() { return is(TypeKind.VECTOR); }
    public boolean isLabel() { return is(TypeKind.LABEL); }

    public boolean isAggregate() {
        return isStruct() || isArray();
    }

    public boolean isSized() {
        return getBitSize() != UNSIZED;
    }

    @Override public String toString() { return toIR(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Type other = (Type) o;
        return kind == other.kind;
    }

    @Override
    public int hashCode() {
        return kind.hashCode();
    }
}
