package ir.value;

import ir.IRModule;
import ir.type.FunctionType;
import ir.type.Type;
import util.IList;
import util.IList.INode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.jetbrains.annotations.Nullable;

public class Function extends Value {
    private IRModule module;
    private final List<Argument> arguments;

    private final INode<Function, IRModule> funcNode;
    private final IList<BasicBlock, Function> blocks;

    private Linkage linkage = Linkage.EXTERNAL;
    private final Set<FunctionAttribute> attributes = new LinkedHashSet<>();

    public Function(String name, FunctionType type) {
        super(type, name);
        this.blocks = new IList<>(this);
        this.funcNode = new INode<>(this);

        // 根据FunctionType创建参数
        List<Type> paramTypes = type.getParamTypes();
        List<Argument> args = new ArrayList<>(paramTypes.size());
        for (int i = 0; i < paramTypes.size(); i++) {
            args.add(new Argument(paramTypes.get(i), i, this));
        }
        this.arguments = Collections.unmodifiableList(args);
    }

    /* getter setter */
    public @Nullable IRModule getParent() {
        return module;
    }

    public void setParent(IRModule module) {
        this.module = module;
    }

    public FunctionType getFunctionType() {
        return (FunctionType) super.getType();
    }

    public Type getReturnType() {
        return getFunctionType().getReturnType();
    }

    public List<Argument> getArguments() {
        return arguments;
    }

    public Argument getParam(int index) {
        return arguments.get(index);
    }

    public IList<BasicBlock, Function> getBlocks() {
        return blocks;
    }

    public List<BasicBlock> getBlockList() {
        return blocks.values();
    }

    public int getNumBlocks() {
        return blocks.getNumNode();
    }

    public INode<Function, IRModule> _getINode() {
        return funcNode;
    }

    public Linkage getLinkage() {
        return linkage;
    }

    public void setLinkage(Linkage linkage) {
        this.linkage = linkage;
    }

    public Set<FunctionAttribute> getAttributes() {
        return Collections.unmodifiableSet(attributes);
    }

    public void addAttribute(FunctionAttribute attribute) {
        attributes.add(attribute);
    }

    public boolean hasAttribute(FunctionAttribute attribute) {
        return attributes.contains(attribute);
    }

    public void addBlock(BasicBlock block) {
        block._getINode().insertAtEnd(blocks);
    }

    /** First block in the list; there is no separate entry marker. */
    public @Nullable BasicBlock getEntryBlock() {
        return blocks.getEntry() != null ? blocks.getEntry().getVal() : null;
    }

    public @Nullable BasicBlock getBlockByName(String name) {
        for (var node : blocks) {
            BasicBlock block = node.getVal();
            if (name.equals(block.getName())) {
                return block;
            }
        }
        return null;
    }

    public boolean isDeclaration() {
        return blocks.isEmpty();
    }

    // 函数以 @name 被引用
    @Override
    public String getReference() {
        return "@" + getName();
    }

    @Override
    public String toIR() {
        StringBuilder sb = new StringBuilder();
        FunctionType fnType = getFunctionType();

        sb.append(isDeclaration() ? "declare " : "define ");
        sb.append(linkage.getKeyword()).append(" ");
        sb.append(fnType.getReturnType().toIR());
        sb.append(" @").append(getName()).append("(");

        String argsStr = arguments.stream()
                .map(Argument::toIR)
                .collect(Collectors.joining(", "));
        sb.append(argsStr);
        if (fnType.isVarArg()) {
            if (!arguments.isEmpty()) {
                sb.append(", ");
            }
            sb.append("...");
        }
        sb.append(")");

        for (FunctionAttribute attribute : attributes) {
            sb.append(" ").append(attribute.getKeyword());
        }

        if (!isDeclaration()) {
            sb.append(" {\n");
            for (var node : blocks) {
                sb.append(node.getVal().toIR());
            }
            sb.append("}");
        }
        return sb.toString();
    }
}
