package ir.value.instructions;

import java.util.List;

import ir.type.Type;
import ir.type.VoidType;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.Value;

import org.jetbrains.annotations.Nullable;

/**
 * Direct call. The callee is either a function of the module or just a
 * symbol name, for callees that are not (yet) declared. Every operand is an
 * argument.
 */
public class CallInst extends Instruction {
    private final Function callee;
    private final String calleeName;
    private boolean tailCall;

    public CallInst(Function callee, List<Value> args, String name) {
        super(Opcode.CALL, checkOperand(callee, "callee").getReturnType(), name, args.toArray(new Value[0]));
        this.callee = callee;
        this.calleeName = callee.getName();
    }

    /** Call by symbol name; a null return type is treated as void. */
    public CallInst(String calleeName, @Nullable Type returnType, List<Value> args, String name) {
        super(Opcode.CALL, returnType == null ? VoidType.getVoid() : returnType, name,
              args.toArray(new Value[0]));
        this.callee = null;
        this.calleeName = calleeName;
    }

    public @Nullable Function getCallee() {
        return callee;
    }

    public String getCalleeName() {
        return callee != null ? callee.getName() : calleeName;
    }

    public List<Value> getArgs() {
        return getOperands();
    }

    public boolean isTailCall() {
        return tailCall;
    }

    public void setTailCall(boolean tailCall) {
        this.tailCall = tailCall;
    }

    @Override
    public String toIR() {
        String tail = tailCall ? "tail " : "";
        String argStr = joinTyped(getArgs());
        // void 调用没有结果名
        if (getType().isVoid()) {
            return tail + "call void @" + getCalleeName() + "(" + argStr + ")";
        }
        return resultPrefix() + tail + "call " + getType().toIR()
                + " @" + getCalleeName() + "(" + argStr + ")";
    }
}
