package ir.value;

import ir.IRModule;
import ir.type.PointerType;
import ir.type.Type;
import ir.value.constants.Constant;

import org.jetbrains.annotations.Nullable;

/**
 * Module-level variable or constant. Its own type is always a pointer to the
 * declared value type.
 */
public class GlobalVariable extends Value {
    private IRModule parent;
    private Constant initializer;
    private boolean isConst;
    private Linkage linkage = Linkage.EXTERNAL;

    public GlobalVariable(String name, Type valueType, @Nullable Constant initializer) {
        super(PointerType.get(valueType), name);
        this.initializer = initializer;
        this.isConst = false; // 默认不是常量
    }

    /* getter setter */
    public void setInitializer(@Nullable Constant initializer) {
        this.initializer = initializer;
    }

    public @Nullable Constant getInitializer() { return initializer; }
    public boolean hasInitializer() { return initializer != null; }
    public boolean isConst() { return isConst; }
    public void setConst(boolean isConst) { this.isConst = isConst; }
    public Linkage getLinkage() { return linkage; }
    public void setLinkage(Linkage linkage) { this.linkage = linkage; }
    public @Nullable IRModule getParent() { return parent; }

    public void setParent(IRModule parent) {
        this.parent = parent;
    }

    @Override
    public PointerType getType() {
        return (PointerType) super.getType();
    }

    public Type getValueType() {
        return getType().getElementType();
    }

    @Override
    public String toIR() {
        StringBuilder sb = new StringBuilder();
        sb.append("@").append(getName()).append(" = ");
        sb.append(linkage.getKeyword()).append(" ");
        if (isConst()) {
            sb.append("constant ");
        } else {
            sb.append("global ");
        }
        if (initializer != null) {
            sb.append(initializer.toIR());
        } else {
            // declaration only: print the global's own (pointer) type
            sb.append(getType().toIR());
        }
        return sb.toString();
    }
}
