package ir.value.instructions;

import ir.type.VoidType;
import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.Value;

import org.jetbrains.annotations.Nullable;

/**
 * Unconditional ({@code br label %dest}) or conditional
 * ({@code br i1 %c, label %then, label %else}) branch.
 */
public class BranchInst extends Instruction {

    public BranchInst(BasicBlock dest) {
        super(Opcode.BR, VoidType.getVoid(), null, dest);
    }

    public BranchInst(Value condition, BasicBlock thenBlock, BasicBlock elseBlock) {
        super(Opcode.COND_BR, VoidType.getVoid(), null, condition, thenBlock, elseBlock);
    }

    public boolean isConditional() {
        return opCode() == Opcode.COND_BR;
    }

    public @Nullable Value getCondition() {
        return isConditional() ? getOperand(0) : null;
    }

    public BasicBlock getThenBlock() {
        return (BasicBlock) (isConditional() ? getOperand(1) : getOperand(0));
    }

    public @Nullable BasicBlock getElseBlock() {
        return isConditional() ? (BasicBlock) getOperand(2) : null;
    }

    @Override
    public String toIR() {
        if (isConditional()) {
            return "br i1 " + getCondition().getReference()
                + ", label " + getThenBlock().getReference()
                + ", label " + getElseBlock().getReference();
        } else {
            return "br label " + getThenBlock().getReference();
        }
    }
}
