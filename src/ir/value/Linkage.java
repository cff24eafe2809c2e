package ir.value;

/** Visibility and merging policy of a function or global across compilation units. */
public enum Linkage {
    EXTERNAL("external"),
    INTERNAL("internal"),
    PRIVATE("private"),
    LINKONCE_ODR("linkonce_odr"),
    WEAK_ODR("weak_odr"),
    COMMON("common");

    private final String keyword;

    Linkage(String keyword) {
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
