package ir.value.instructions;

/** Ordered predicates are false when either operand is NaN; unordered ones are true. */
public enum FCmpPredicate {
    FALSE("false"),
    OEQ("oeq"),
    OGT("ogt"),
    OGE("oge"),
    OLT("olt"),
    OLE("ole"),
    ONE("one"),
    ORD("ord"),
    UNO("uno"),
    UEQ("ueq"),
    UGT("ugt"),
    UGE("uge"),
    ULT("ult"),
    ULE("ule"),
    UNE("une"),
    TRUE("true");

    private final String keyword;

    FCmpPredicate(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    @Override
    public String toString() {
        return keyword;
    }
}
