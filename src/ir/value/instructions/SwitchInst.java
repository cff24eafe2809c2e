package ir.value.instructions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import ir.type.VoidType;
import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.constants.ConstantInt;

/**
 * Multi-way branch. Operands are the condition and the default block; cases
 * are kept in their own list and grow through {@link #addCase}.
 */
public class SwitchInst extends Instruction {

    public record Case(ConstantInt value, BasicBlock dest) {
    }

    private final List<Case> cases = new ArrayList<>();

    public SwitchInst(Value condition, BasicBlock defaultBlock) {
        super(Opcode.SWITCH, VoidType.getVoid(), null, condition, defaultBlock);
    }

    public Value getCondition() {
        return getOperand(0);
    }

    public BasicBlock getDefaultBlock() {
        return (BasicBlock) getOperand(1);
    }

    public void addCase(ConstantInt value, BasicBlock dest) {
        cases.add(new Case(checkOperand(value, "case value"), checkOperand(dest, "case destination")));
    }

    public List<Case> getCases() {
        return Collections.unmodifiableList(cases);
    }

    public int getNumCases() {
        return cases.size();
    }

    @Override
    public String toIR() {
        StringBuilder sb = new StringBuilder();
        Value cond = getCondition();
        sb.append("switch ").append(cond.getTypedReference())
          .append(", label ").append(getDefaultBlock().getReference())
          .append(" [\n");
        for (Case c : cases) {
            sb.append("    ").append(c.value().toIR())
              .append(", label ").append(c.dest().getReference())
              .append("\n");
        }
        sb.append("  ]");
        return sb.toString();
    }
}
