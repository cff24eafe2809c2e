package ir.value;

import ir.type.Type;
import java.util.Objects;

public abstract class Value {
    private final Type type;
    private String name;

    protected Value(Type type, String name) {
        this.type = Objects.requireNonNull(type, "type");
        this.name = name;
    }

    /** Full textual form of this value as it appears on its own line or as an initializer. */
    public abstract String toIR();

    /* getter setter */
    public String getName() { return this.name; }
    public Type getType() { return this.type; }
    public boolean isConstant() { return false; }
    public boolean hasName() { return name != null && !name.isEmpty(); }

    public void setName(String name) { this.name = name; }

    /**
     * 获取在指令中引用此值时的字符串表示
     * 常量：字面值（如 "42"）
     * 其他值：名字引用（如 "%ptr"）
     */
    public String getReference() {
        if (!hasName()) {
            return "%<unnamed>";
        }
        return "%" + getName();
    }

    /** {@code <type> <reference>}, the usual way an operand is spelled. */
    public String getTypedReference() {
        return type.toIR() + " " + getReference();
    }

    @Override
    public String toString() {
        return toIR();
    }
}
