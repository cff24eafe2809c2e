package ir.value;

public enum FunctionAttribute {
    NO_RETURN("noreturn"),
    NO_UNWIND("nounwind"),
    READ_ONLY("readonly"),
    READ_NONE("readnone"),
    ALWAYS_INLINE("alwaysinline"),
    NO_INLINE("noinline");

    private final String keyword;

    FunctionAttribute(String keyword) {
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
