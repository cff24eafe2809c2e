package ir.type;

import java.util.List;
import java.util.Objects;

public final class FunctionType extends Type {
    private final Type returnType;
    private final List<Type> paramTypes;
    private final boolean isVarArg;

    private FunctionType(Type returnType, List<Type> paramTypes, boolean var) {
        super(TypeKind.FUNC);
        if (returnType != null) {
            this.returnType = returnType;
        } else {
            this.returnType = VoidType.getVoid();
        }
        this.paramTypes = paramTypes == null ? List.of() : List.copyOf(paramTypes);
        this.isVarArg = var;
    }

    public static FunctionType get(Type ret, List<Type> params) {
        return get(ret, params, false);
    }

    public static FunctionType get(Type ret,
                                   List<Type> params,
                                   boolean isVarArg) {
        return new FunctionType(ret, params, isVarArg);
    }

    public Type getReturnType() { return returnType; }
    public List<Type> getParamTypes() { return paramTypes; }
    public boolean isVarArg() { return isVarArg; }

    @Override
    public String toIR() {
        StringBuilder sb = new StringBuilder();
        sb.append("fn(");
        for (int i = 0; i < paramTypes.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(paramTypes.get(i).toIR());
        }
        if (isVarArg) {
            if (!paramTypes.isEmpty()) sb.append(", ");
            sb.append("...");
        }
        sb.append(") -> ").append(returnType.toIR());
        return sb.toString();
    }

    @Override
    public long getBitSize() {
        return UNSIZED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionType other)) return false;
        return returnType.equals(other.returnType)
            && paramTypes.equals(other.paramTypes)
            && isVarArg == other.isVarArg;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), returnType, paramTypes, isVarArg);
    }
}
