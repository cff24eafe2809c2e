package ir.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exception.IRException;
import ir.type.LabelType;
import ir.value.instructions.Instruction;
import util.IList;
import util.IList.INode;

import org.jetbrains.annotations.Nullable;

/**
 * Straight-line instruction sequence. Predecessor and successor lists are kept
 * apart from the instructions and are only ever appended to; the same edge
 * may appear more than once.
 */
public class BasicBlock extends Value {
    private final IList<Instruction, BasicBlock> instructions;
    private final INode<BasicBlock, Function> blockNode;
    private final List<BasicBlock> predecessors;
    private final List<BasicBlock> successors;

    public BasicBlock(String name) {
        super(LabelType.getLabel(), name);
        this.instructions = new IList<>(this);
        this.predecessors = new ArrayList<>();
        this.successors = new ArrayList<>();
        this.blockNode = new INode<>(this);
    }

    /* getter setter */
    public IList<Instruction, BasicBlock> getInstructions() {
        return instructions;
    }

    /** Instructions in execution order, as a snapshot. */
    public List<Instruction> getInstructionList() {
        return instructions.values();
    }

    public int getNumInstructions() {
        return instructions.getNumNode();
    }

    public INode<BasicBlock, Function> _getINode() {
        return this.blockNode;
    }

    public @Nullable Function getParent() {
        return blockNode.getParent() != null ? blockNode.getParent().getVal() : null;
    }

    public @Nullable BasicBlock getNext() {
        return blockNode.getNext() != null ? blockNode.getNext().getVal() : null;
    }

    public List<BasicBlock> getPredecessors() {
        return Collections.unmodifiableList(predecessors);
    }

    public List<BasicBlock> getSuccessors() {
        return Collections.unmodifiableList(successors);
    }

    public @Nullable Instruction getFirstInstruction() {
        return instructions.getEntry() != null ? instructions.getEntry().getVal() : null;
    }

    public @Nullable Instruction getLastInstruction() {
        return instructions.getLast() != null ? instructions.getLast().getVal() : null;
    }

    public void addInstruction(Instruction inst) {
        if (inst == null) {
            throw IRException.illegalOperand("cannot add a null instruction to block " + getName());
        }
        inst._getINode().insertAtEnd(instructions);
    }

    public void addInstructionBefore(Instruction inst, Instruction before) {
        if (inst == null) {
            throw IRException.illegalOperand("cannot add a null instruction to block " + getName());
        }
        if (before.getParent() != this) {
            throw IRException.illegalOperand("anchor instruction is not in block " + getName());
        }
        inst._getINode().insertBefore(before._getINode());
    }

    /* CFG edges, appended without deduplication */
    public void addPredecessor(BasicBlock pred) {
        predecessors.add(pred);
    }

    public void addSuccessor(BasicBlock succ) {
        successors.add(succ);
    }

    /* 判断最后一条指令是不是terminator, 不扫描整个block */
    public @Nullable Instruction getTerminator() {
        Instruction last = getLastInstruction();
        return last != null && last.isTerminator() ? last : null;
    }

    public boolean isTerminated() {
        return getTerminator() != null;
    }

    @Override
    public String toIR() {
        StringBuilder sb = new StringBuilder();
        sb.append(getName()).append(":\n");
        for (var node : instructions) {
            sb.append("  ").append(node.getVal().toIR()).append("\n");
        }
        return sb.toString();
    }
}
