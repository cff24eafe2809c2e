package ir.value.instructions;

import java.util.List;
import java.util.stream.Collectors;

import exception.IRException;
import ir.type.Type;
import ir.value.*;
import util.IList.INode;

import org.jetbrains.annotations.Nullable;

/**
 * Base of every instruction. The operand count is checked against the
 * opcode when the instruction is created; a freshly created instruction
 * belongs to no block until it is inserted.
 */
public abstract class Instruction extends User {
    private final Opcode opcode;
    private final INode<Instruction, BasicBlock> instNode;

    protected Instruction(Opcode opcode, Type type, String name, Value... operands) {
        super(type, name, checkArity(opcode, operands));
        this.opcode = opcode;
        this.instNode = new INode<>(this);
    }

    private static Value[] checkArity(Opcode opcode, Value[] operands) {
        if (!opcode.acceptsOperandCount(operands.length)) {
            throw IRException.wrongArity(opcode, operands.length);
        }
        return operands;
    }

    /** For operands a constructor reads before the arity check can see them. */
    protected static <V extends Value> V checkOperand(V value, String role) {
        if (value == null) {
            throw IRException.illegalOperand(role + " is null");
        }
        return value;
    }

    public Opcode opCode() {
        return opcode;
    }

    public INode<Instruction, BasicBlock> _getINode() {
        return instNode;
    }

    public @Nullable Instruction getNext() {
        return instNode.getNext() != null ? instNode.getNext().getVal() : null;
    }

    public @Nullable Instruction getPrev() {
        return instNode.getPrev() != null ? instNode.getPrev().getVal() : null;
    }

    public @Nullable BasicBlock getParent() {
        return instNode.getParent() != null ? instNode.getParent().getVal() : null;
    }

    public boolean isTerminator() {
        return opcode.isTerminator();
    }

    public boolean isBinary() {
        return opcode.isBinary();
    }

    public boolean isCast() {
        return opcode.isCast();
    }

    /** The {@code %name = } prefix of instructions that produce a value. */
    protected String resultPrefix() {
        return getReference() + " = ";
    }

    protected static String joinTyped(List<? extends Value> values) {
        return values.stream()
                .map(Value::getTypedReference)
                .collect(Collectors.joining(", "));
    }

    protected static String joinIndices(List<Integer> indices) {
        return indices.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(", "));
    }
}
