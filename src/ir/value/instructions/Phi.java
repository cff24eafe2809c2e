package ir.value.instructions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import ir.type.Type;
import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.Value;

/**
 * SSA merge node. Incoming pairs are appended one at a time and are never
 * checked against the block's actual predecessors.
 */
public class Phi extends Instruction {

    public record Incoming(Value value, BasicBlock block) {
    }

    private final List<Incoming> incomings = new ArrayList<>();

    public Phi(Type type, String name) {
        super(Opcode.PHI, type, name);
    }

    public void addIncoming(Value value, BasicBlock block) {
        incomings.add(new Incoming(checkOperand(value, "incoming value"), checkOperand(block, "incoming block")));
    }

    public int getNumIncoming() {
        return incomings.size();
    }

    public List<Incoming> getIncomings() {
        return Collections.unmodifiableList(incomings);
    }

    public Value getIncomingValue(int index) {
        return incomings.get(index).value();
    }

    public BasicBlock getIncomingBlock(int index) {
        return incomings.get(index).block();
    }

    @Override
    public String toIR() {
        String pairs = incomings.stream()
                .map(inc -> "[ " + inc.value().getReference() + ", "
                        + inc.block().getReference() + " ]")
                .collect(Collectors.joining(", "));
        return resultPrefix() + "phi " + getType().toIR() + " " + pairs;
    }
}
