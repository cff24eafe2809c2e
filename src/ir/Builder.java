package ir;

import java.util.Arrays;
import java.util.List;

import exception.IRException;
import ir.type.ArrayType;
import ir.type.FloatType;
import ir.type.FunctionType;
import ir.type.IntegerType;
import ir.type.PointerType;
import ir.type.StructType;
import ir.type.Type;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.GlobalVariable;
import ir.value.Linkage;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.constants.Constant;
import ir.value.constants.ConstantArray;
import ir.value.constants.ConstantFloat;
import ir.value.constants.ConstantInt;
import ir.value.constants.ConstantNull;
import ir.value.constants.ConstantStruct;
import ir.value.constants.ConstantUndef;
import ir.value.constants.ConstantZero;
import ir.value.instructions.AllocaInst;
import ir.value.instructions.BinOperator;
import ir.value.instructions.BranchInst;
import ir.value.instructions.CallInst;
import ir.value.instructions.CastInst;
import ir.value.instructions.ExtractValueInst;
import ir.value.instructions.FCmpInst;
import ir.value.instructions.FCmpPredicate;
import ir.value.instructions.GEPInst;
import ir.value.instructions.ICmpInst;
import ir.value.instructions.ICmpPredicate;
import ir.value.instructions.InsertValueInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.LoadInst;
import ir.value.instructions.Phi;
import ir.value.instructions.ReturnInst;
import ir.value.instructions.SelectInst;
import ir.value.instructions.StoreInst;
import ir.value.instructions.SwitchInst;
import ir.value.instructions.UnreachableInst;
import util.LoggingManager;
import util.logging.Logger;

import org.jetbrains.annotations.Nullable;

/**
 * The only mutator of the IR graph. Holds an insertion cursor and a naming
 * counter, and keeps predecessor/successor lists in step with the branches it
 * creates.
 *
 * <p>The cursor is either at the end of the current block, or before an
 * existing instruction; in the latter case consecutive insertions land in the
 * order they were issued, all before that instruction. Unnamed results get
 * {@code 0, 1, 2, ...} from a counter that belongs to this builder and is
 * shared by every function it builds. Explicit names are never checked
 * against generated ones.
 *
 * <p>Not thread-safe.
 */
public class Builder {
    private static final Logger log = LoggingManager.getLogger(Builder.class);

    private IRModule module;
    private BasicBlock currentBlock;
    private Function currentFunction;
    // null: 追加到块尾
    private Instruction insertPoint;

    private int nameCounter;

    public Builder() {
        this(null, 0);
    }

    public Builder(@Nullable IRModule module) {
        this(module, 0);
    }

    /**
     * @param firstName first value handed out by the naming counter; builders
     *                  that share a module can be given disjoint ranges
     */
    public Builder(@Nullable IRModule module, int firstName) {
        this.module = module;
        this.nameCounter = firstName;
    }

    /* getter */
    public @Nullable IRModule getModule() {
        return module;
    }

    public @Nullable Function getCurrentFunction() {
        return currentFunction;
    }

    public @Nullable BasicBlock getCurrentBlock() {
        return currentBlock;
    }

    public @Nullable Instruction getInsertPoint() {
        return insertPoint;
    }

    // ======================== 插入位置 ========================

    /** Moves the cursor to the end of {@code block}. */
    public void positionAtEnd(BasicBlock block) {
        this.currentBlock = block;
        this.currentFunction = block.getParent();
        this.insertPoint = null;
    }

    /** Moves the cursor right before {@code inst}, in the block that holds it. */
    public void positionBefore(Instruction inst) {
        BasicBlock parent = inst.getParent();
        if (parent == null) {
            throw IRException.illegalOperand("cannot position before an instruction that is not in a block");
        }
        this.currentBlock = parent;
        this.currentFunction = parent.getParent();
        this.insertPoint = inst;
    }

    // 指令构造成功后才分配编号, 失败的调用不占用计数器
    private <T extends Instruction> T insertNamed(T inst) {
        requireBlock();
        if (!inst.hasName()) {
            inst.setName(String.valueOf(nameCounter++));
        }
        return insertInstruction(inst);
    }

    private <T extends Instruction> T insertInstruction(T inst) {
        if (currentBlock == null) {
            throw IRException.noInsertionBlock();
        }
        if (insertPoint == null) {
            currentBlock.addInstruction(inst);
        } else {
            // 锚点不变, 后续指令依次排在前一条之后
            currentBlock.addInstructionBefore(inst, insertPoint);
        }
        if (log.isTraceEnabled()) {
            log.trace("{}: {}", currentBlock.getName(), inst.toIR());
        }
        return inst;
    }

    private void requireBlock() {
        if (currentBlock == null) {
            throw IRException.noInsertionBlock();
        }
    }

    private static void addEdge(BasicBlock from, BasicBlock to) {
        from.addSuccessor(to);
        to.addPredecessor(from);
    }

    // ======================== 模块级 ========================

    public IRModule createModule(String name) {
        this.module = new IRModule(name);
        log.debug("Created module {}", name);
        return module;
    }

    /** Creates a function, adds it to the module and makes it the current function. */
    public Function createFunction(String name, Type retType, List<Type> params, boolean isVarArg) {
        Function function = new Function(name, FunctionType.get(retType, params, isVarArg));
        if (module != null) {
            module.addFunction(function);
        }
        this.currentFunction = function;
        log.debug("Created function {}", name);
        return function;
    }

    /** Declares an external function. The current function is left alone. */
    public Function declareFunction(String name, Type retType, List<Type> params, boolean isVarArg) {
        Function function = new Function(name, FunctionType.get(retType, params, isVarArg));
        function.setLinkage(Linkage.EXTERNAL);
        if (module != null) {
            module.addFunction(function);
        }
        log.debug("Declared function {}", name);
        return function;
    }

    public GlobalVariable createGlobalVariable(String name, Type type, @Nullable Constant initializer) {
        GlobalVariable global = new GlobalVariable(name, type, initializer);
        if (module != null) {
            module.addGlobal(global);
        }
        return global;
    }

    public GlobalVariable createGlobalConstant(String name, Constant initializer) {
        GlobalVariable global = new GlobalVariable(name, initializer.getType(), initializer);
        global.setConst(true);
        if (module != null) {
            module.addGlobal(global);
        }
        return global;
    }

    // ======================== 基本块 ========================

    /** Creates a block at the end of the current function, or a detached one if there is none. */
    public BasicBlock createBlock(String name) {
        BasicBlock block = new BasicBlock(name);
        if (currentFunction != null) {
            currentFunction.addBlock(block);
            log.debug("Created block {} in {}", name, currentFunction.getName());
        }
        return block;
    }

    public BasicBlock createBlockInFunction(String name, Function function) {
        BasicBlock block = new BasicBlock(name);
        function.addBlock(block);
        log.debug("Created block {} in {}", name, function.getName());
        return block;
    }

    // ======================== 终结指令 ========================

    public ReturnInst buildRet(Value value) {
        return insertInstruction(new ReturnInst(value));
    }

    public ReturnInst buildRetVoid() {
        return insertInstruction(new ReturnInst());
    }

    public BranchInst buildBr(BasicBlock target) {
        BranchInst inst = insertInstruction(new BranchInst(target));
        addEdge(currentBlock, target);
        return inst;
    }

    public BranchInst buildCondBr(Value cond, BasicBlock thenBlock, BasicBlock elseBlock) {
        BranchInst inst = insertInstruction(new BranchInst(cond, thenBlock, elseBlock));
        addEdge(currentBlock, thenBlock);
        addEdge(currentBlock, elseBlock);
        return inst;
    }

    public SwitchInst buildSwitch(Value cond, BasicBlock defaultBlock) {
        SwitchInst inst = insertInstruction(new SwitchInst(cond, defaultBlock));
        addEdge(currentBlock, defaultBlock);
        return inst;
    }

    /** Adds a case and the matching edge from the block holding the switch. */
    public void addCase(SwitchInst sw, ConstantInt value, BasicBlock dest) {
        BasicBlock parent = sw.getParent();
        if (parent == null) {
            throw IRException.illegalOperand("switch is not in a block, no edge for the case");
        }
        sw.addCase(value, dest);
        addEdge(parent, dest);
    }

    public UnreachableInst buildUnreachable() {
        return insertInstruction(new UnreachableInst());
    }

    // ======================== 二元运算 ========================

    private BinOperator buildBinaryOperator(Opcode opcode, Value lhs, Value rhs, String name) {
        requireBlock();
        return insertNamed(new BinOperator(name, opcode, lhs, rhs));
    }

    // --- 算术指令 ---
    public BinOperator buildAdd(Value lhs, Value rhs, String name) {
        return buildBinaryOperator(Opcode.ADD, lhs, rhs, name);
    }

    public BinOperator buildNSWAdd(Value lhs, Value rhs, String name) {
        BinOperator inst = buildAdd(lhs, rhs, name);
        inst.setNoSignedWrap(true);
        return inst;
    }

    public BinOperator buildNUWAdd(Value lhs, Value rhs, String name) {
        BinOperator inst = buildAdd(lhs, rhs, name);
        inst.setNoUnsignedWrap(true);
        return inst;
    }

    public BinOperator buildSub(Value lhs, Value rhs, String name) {
        return buildBinaryOperator(Opcode.SUB, lhs, rhs, name);
    }

    public BinOperator buildNSWSub(Value lhs, Value rhs, String name) {
        BinOperator inst = buildSub(lhs, rhs, name);
        inst.setNoSignedWrap(true);
        return inst;
    }

    public BinOperator buildMul(Value lhs, Value rhs, String name) {
        return buildBinaryOperator(Opcode.MUL, lhs, rhs, name);
    }

    public BinOperator buildNSWMul(Value lhs, Value rhs, String name) {
        BinOperator inst = buildMul(lhs, rhs, name);
        inst.setNoSignedWrap(true);
        return inst;
    }

    public BinOperator buildUDiv(Value lhs, Value rhs, String name) {
        return buildBinaryOperator(Opcode.UDIV, lhs, rhs, name);
    }

    public BinOperator buildExactUDiv(Value lhs, Value rhs, String name) {
        BinOperator inst = buildUDiv(lhs, rhs, name);
        inst.setExact(true);
        return inst;
    }

    public BinOperator buildSDiv(Value lhs, Value rhs, String name) {
        return buildBinaryOperator(Opcode.SDIV, lhs, rhs, name);
    }

    public BinOperator buildExactSDiv(Value lhs, Value rhs, String name) {
        BinOperator inst = buildSDiv(lhs, rhs, name);
        inst.setExact(true);
        return inst;
    }

    public BinOperator buildURem(Value lhs, Value rhs, String name) {
        return buildBinaryOperator(Opcode.UREM, lhs, rhs, name);
    }

    public BinOperator buildSRem(Value lhs, Value rhs, String name) {
        return buildBinaryOperator(Opcode.SREM, lhs, rhs, name);
    }

    // --- 浮点算术指令 ---
    public BinOperator buildFAdd(Value lhs, Value rhs, String name) {
        return buildBinaryOperator(Opcode.FADD, lhs, rhs, name);
    }

    public BinOperator buildFSub(Value lhs, Value rhs, String name) {
        return buildBinaryOperator(Opcode.FSUB, lhs, rhs, name);
    }

    public BinOperator buildFMul(Value lhs, Value rhs, String name) {
        return buildBinaryOperator(Opcode.FMUL, lhs, rhs, name);
    }

    public BinOperator buildFDiv(Value lhs, Value rhs, String name) {
        return buildBinaryOperator(Opcode.FDIV, lhs, rhs, name);
    }

    public BinOperator buildFRem(Value lhs, Value rhs, String name) {
        return buildBinaryOperator(Opcode.FREM, lhs, rhs, name);
    }

    // --- 位运算指令 ---
    public BinOperator buildShl(Value lhs, Value rhs, String name) {
        return buildBinaryOperator(Opcode.SHL, lhs, rhs, name);
    }

    public BinOperator buildLShr(Value lhs, Value rhs, String name) {
        return buildBinaryOperator(Opcode.LSHR, lhs, rhs, name);
    }

    public BinOperator buildAShr(Value lhs, Value rhs, String name) {
        return buildBinaryOperator(Opcode.ASHR, lhs, rhs, name);
    }

    public BinOperator buildAnd(Value lhs, Value rhs, String name) {
        return buildBinaryOperator(Opcode.AND, lhs, rhs, name);
    }

    public BinOperator buildOr(Value lhs, Value rhs, String name) {
        return buildBinaryOperator(Opcode.OR, lhs, rhs, name);
    }

    public BinOperator buildXor(Value lhs, Value rhs, String name) {
        return buildBinaryOperator(Opcode.XOR, lhs, rhs, name);
    }

    // ======================== 内存操作 ========================

    public AllocaInst buildAlloca(Type type, String name) {
        requireBlock();
        return insertNamed(new AllocaInst(type, name));
    }

    public AllocaInst buildAllocaWithCount(Type type, Value count, String name) {
        requireBlock();
        return insertNamed(new AllocaInst(type, count, name));
    }

    public LoadInst buildLoad(Type type, Value pointer, String name) {
        requireBlock();
        return insertNamed(new LoadInst(type, pointer, name));
    }

    public LoadInst buildVolatileLoad(Type type, Value pointer, String name) {
        LoadInst inst = buildLoad(type, pointer, name);
        inst.setVolatile(true);
        return inst;
    }

    public LoadInst buildAlignedLoad(Type type, Value pointer, int align, String name) {
        LoadInst inst = buildLoad(type, pointer, name);
        inst.setAlignment(align);
        return inst;
    }

    public StoreInst buildStore(Value value, Value pointer) {
        return insertInstruction(new StoreInst(value, pointer));
    }

    public StoreInst buildVolatileStore(Value value, Value pointer) {
        StoreInst inst = buildStore(value, pointer);
        inst.setVolatile(true);
        return inst;
    }

    public StoreInst buildAlignedStore(Value value, Value pointer, int align) {
        StoreInst inst = buildStore(value, pointer);
        inst.setAlignment(align);
        return inst;
    }

    /**
     * The result type is always a pointer to {@code sourceElementType}; it is
     * not derived from the indices.
     */
    public GEPInst buildGEP(Type sourceElementType, Value pointer, List<Value> indices, String name) {
        requireBlock();
        return insertNamed(new GEPInst(sourceElementType, pointer, indices, false, name));
    }

    public GEPInst buildInBoundsGEP(Type sourceElementType, Value pointer, List<Value> indices, String name) {
        requireBlock();
        return insertNamed(new GEPInst(sourceElementType, pointer, indices, true, name));
    }

    /** {@code getelementptr T, ptr, i32 0, i32 field} */
    public GEPInst buildStructGEP(Type structType, Value pointer, int field, String name) {
        return buildGEP(structType, pointer,
                Arrays.<Value>asList(getInt32(0), getInt32(field)), name);
    }

    // ======================== 类型转换 ========================

    private CastInst buildCast(Opcode op, Value value, Type destType, String name) {
        requireBlock();
        return insertNamed(new CastInst(op, value, destType, name));
    }

    public CastInst buildTrunc(Value value, Type destType, String name) {
        return buildCast(Opcode.TRUNC, value, destType, name);
    }

    public CastInst buildZExt(Value value, Type destType, String name) {
        return buildCast(Opcode.ZEXT, value, destType, name);
    }

    public CastInst buildSExt(Value value, Type destType, String name) {
        return buildCast(Opcode.SEXT, value, destType, name);
    }

    public CastInst buildFPTrunc(Value value, Type destType, String name) {
        return buildCast(Opcode.FPTRUNC, value, destType, name);
    }

    public CastInst buildFPExt(Value value, Type destType, String name) {
        return buildCast(Opcode.FPEXT, value, destType, name);
    }

    public CastInst buildFPToUI(Value value, Type destType, String name) {
        return buildCast(Opcode.FPTOUI, value, destType, name);
    }

    public CastInst buildFPToSI(Value value, Type destType, String name) {
        return buildCast(Opcode.FPTOSI, value, destType, name);
    }

    public CastInst buildUIToFP(Value value, Type destType, String name) {
        return buildCast(Opcode.UITOFP, value, destType, name);
    }

    public CastInst buildSIToFP(Value value, Type destType, String name) {
        return buildCast(Opcode.SITOFP, value, destType, name);
    }

    public CastInst buildPtrToInt(Value value, Type destType, String name) {
        return buildCast(Opcode.PTRTOINT, value, destType, name);
    }

    public CastInst buildIntToPtr(Value value, Type destType, String name) {
        return buildCast(Opcode.INTTOPTR, value, destType, name);
    }

    public CastInst buildBitCast(Value value, Type destType, String name) {
        return buildCast(Opcode.BITCAST, value, destType, name);
    }

    // ======================== 比较指令 ========================

    public ICmpInst buildICmp(ICmpPredicate pred, Value lhs, Value rhs, String name) {
        requireBlock();
        return insertNamed(new ICmpInst(pred, lhs, rhs, name));
    }

    public FCmpInst buildFCmp(FCmpPredicate pred, Value lhs, Value rhs, String name) {
        requireBlock();
        return insertNamed(new FCmpInst(pred, lhs, rhs, name));
    }

    // 整数比较指令区域
    public ICmpInst buildICmpEQ(Value lhs, Value rhs, String name) {
        return buildICmp(ICmpPredicate.EQ, lhs, rhs, name);
    }

    public ICmpInst buildICmpNE(Value lhs, Value rhs, String name) {
        return buildICmp(ICmpPredicate.NE, lhs, rhs, name);
    }

    public ICmpInst buildICmpUGT(Value lhs, Value rhs, String name) {
        return buildICmp(ICmpPredicate.UGT, lhs, rhs, name);
    }

    public ICmpInst buildICmpUGE(Value lhs, Value rhs, String name) {
        return buildICmp(ICmpPredicate.UGE, lhs, rhs, name);
    }

    public ICmpInst buildICmpULT(Value lhs, Value rhs, String name) {
        return buildICmp(ICmpPredicate.ULT, lhs, rhs, name);
    }

    public ICmpInst buildICmpULE(Value lhs, Value rhs, String name) {
        return buildICmp(ICmpPredicate.ULE, lhs, rhs, name);
    }

    public ICmpInst buildICmpSGT(Value lhs, Value rhs, String name) {
        return buildICmp(ICmpPredicate.SGT, lhs, rhs, name);
    }

    public ICmpInst buildICmpSGE(Value lhs, Value rhs, String name) {
        return buildICmp(ICmpPredicate.SGE, lhs, rhs, name);
    }

    public ICmpInst buildICmpSLT(Value lhs, Value rhs, String name) {
        return buildICmp(ICmpPredicate.SLT, lhs, rhs, name);
    }

    public ICmpInst buildICmpSLE(Value lhs, Value rhs, String name) {
        return buildICmp(ICmpPredicate.SLE, lhs, rhs, name);
    }

    // ======================== 其他指令 ========================

    /** Inserts an empty phi at the cursor; fill it with {@link Phi#addIncoming}. */
    public Phi buildPhi(Type type, String name) {
        requireBlock();
        return insertNamed(new Phi(type, name));
    }

    public SelectInst buildSelect(Value cond, Value trueVal, Value falseVal, String name) {
        requireBlock();
        return insertNamed(new SelectInst(cond, trueVal, falseVal, name));
    }

    /** Void calls are never given a generated name. */
    public CallInst buildCall(Function callee, List<Value> args, String name) {
        requireBlock();
        CallInst inst = new CallInst(callee, args, name);
        return inst.getType().isVoid() ? insertInstruction(inst) : insertNamed(inst);
    }

    /** Call to a symbol that need not exist in the module; a null return type means void. */
    public CallInst buildCallByName(String calleeName, @Nullable Type retType, List<Value> args, String name) {
        requireBlock();
        CallInst inst = new CallInst(calleeName, retType, args, name);
        return inst.getType().isVoid() ? insertInstruction(inst) : insertNamed(inst);
    }

    public CallInst buildTailCall(Function callee, List<Value> args, String name) {
        CallInst inst = buildCall(callee, args, name);
        inst.setTailCall(true);
        return inst;
    }

    public ExtractValueInst buildExtractValue(Value aggregate, List<Integer> indices, String name) {
        requireBlock();
        return insertNamed(new ExtractValueInst(aggregate, indices, name));
    }

    public InsertValueInst buildInsertValue(Value aggregate, Value value, List<Integer> indices, String name) {
        requireBlock();
        return insertNamed(new InsertValueInst(aggregate, value, indices, name));
    }

    // ======================== 常量 ========================

    public ConstantInt getInt(IntegerType type, long value) {
        return new ConstantInt(type, value);
    }

    public ConstantInt getInt32(long value) {
        return new ConstantInt(IntegerType.getI32(), value);
    }

    public ConstantFloat getFloat(FloatType type, double value) {
        return new ConstantFloat(type, value);
    }

    public ConstantNull getNull(PointerType type) {
        return new ConstantNull(type);
    }

    public ConstantUndef getUndef(Type type) {
        return new ConstantUndef(type);
    }

    public ConstantZero getZero(Type type) {
        return new ConstantZero(type);
    }

    public ConstantArray getArray(ArrayType type, List<Constant> elements) {
        return new ConstantArray(type, elements);
    }

    public ConstantStruct getStruct(StructType type, List<Constant> fields) {
        return new ConstantStruct(type, fields);
    }

    /** {@code i1 1} */
    public ConstantInt getTrue() {
        return new ConstantInt(IntegerType.getI1(), 1);
    }

    /** {@code i1 0} */
    public ConstantInt getFalse() {
        return new ConstantInt(IntegerType.getI1(), 0);
    }
}
