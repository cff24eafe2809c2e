package ir.value.instructions;

public enum ICmpPredicate {
    EQ("eq"),
    NE("ne"),
    UGT("ugt"),
    UGE("uge"),
    ULT("ult"),
    ULE("ule"),
    SGT("sgt"),
    SGE("sge"),
    SLT("slt"),
    SLE("sle");

    private final String keyword;

    ICmpPredicate(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    public boolean isSigned() {
        return this == SGT || this == SGE || this == SLT || this == SLE;
    }

    @Override
    public String toString() {
        return keyword;
    }
}
