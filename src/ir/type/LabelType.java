package ir.type;

import java.util.Objects;

/** Type of a basic block when it is referenced as a branch target. */
public final class LabelType extends Type {

    private static final LabelType INSTANCE = new LabelType();

    private LabelType() {
        super(TypeKind.LABEL);
    }

    public static LabelType getLabel() {
        return INSTANCE;
    }

    @Override
    public String toIR() {
        return "label";
    }

    @Override
    public long getBitSize() {
        return UNSIZED;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof LabelType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode());
    }
}
