package ir.value;

public enum Opcode {
    // 终结指令
    RET("ret", 0, 1),
    BR("br", 1, 1),
    COND_BR("br", 3, 3),
    SWITCH("switch", 2, 2),
    UNREACHABLE("unreachable", 0, 0),

    // 二元运算指令
    ADD("add", 2, 2),
    SUB("sub", 2, 2),
    MUL("mul", 2, 2),
    UDIV("udiv", 2, 2),
    SDIV("sdiv", 2, 2),
    UREM("urem", 2, 2),
    SREM("srem", 2, 2),
    FADD("fadd", 2, 2),
    FSUB("fsub", 2, 2),
    FMUL("fmul", 2, 2),
    FDIV("fdiv", 2, 2),
    FREM("frem", 2, 2),

    // 位运算
    SHL("shl", 2, 2),
    LSHR("lshr", 2, 2),
    ASHR("ashr", 2, 2),
    AND("and", 2, 2),
    OR("or", 2, 2),
    XOR("xor", 2, 2),

    // 内存操作指令
    ALLOCA("alloca", 0, 1),
    LOAD("load", 1, 1),
    STORE("store", 2, 2),
    GETELEMENTPTR("getelementptr", 1, Opcode.VARIADIC),

    // 类型转换指令
    TRUNC("trunc", 1, 1),
    ZEXT("zext", 1, 1),
    SEXT("sext", 1, 1),
    FPTRUNC("fptrunc", 1, 1),
    FPEXT("fpext", 1, 1),
    FPTOUI("fptoui", 1, 1),
    FPTOSI("fptosi", 1, 1),
    UITOFP("uitofp", 1, 1),
    SITOFP("sitofp", 1, 1),
    PTRTOINT("ptrtoint", 1, 1),
    INTTOPTR("inttoptr", 1, 1),
    BITCAST("bitcast", 1, 1),

    // 其他指令
    ICMP("icmp", 2, 2),
    FCMP("fcmp", 2, 2),
    PHI("phi", 0, 0), // incoming pairs are kept outside the operand list
    SELECT("select", 3, 3),
    CALL("call", 0, Opcode.VARIADIC),
    EXTRACTVALUE("extractvalue", 1, 1),
    INSERTVALUE("insertvalue", 2, 2),
    ;

    public static final int VARIADIC = Integer.MAX_VALUE;

    private final String mnemonic;
    private final int minOperands;
    private final int maxOperands;

    Opcode(String mnemonic, int minOperands, int maxOperands) {
        this.mnemonic = mnemonic;
        this.minOperands = minOperands;
        this.maxOperands = maxOperands;
    }

    public String getMnemonic() {
        return mnemonic;
    }

    public boolean acceptsOperandCount(int count) {
        return count >= minOperands && count <= maxOperands;
    }

    public String describeArity() {
        if (minOperands == maxOperands) {
            return String.valueOf(minOperands);
        }
        if (maxOperands == VARIADIC) {
            return "at least " + minOperands;
        }
        return minOperands + ".." + maxOperands;
    }

    /**
     * 判断操作码是否为终结指令
     *
     * @return 如果是终结指令返回 true
     */
    public boolean isTerminator() {
        return this == RET || this == BR || this == COND_BR
            || this == SWITCH || this == UNREACHABLE;
    }

    public boolean isBinary() {
        return ordinal() >= ADD.ordinal() && ordinal() <= XOR.ordinal();
    }

    public boolean isCast() {
        return ordinal() >= TRUNC.ordinal() && ordinal() <= BITCAST.ordinal();
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
