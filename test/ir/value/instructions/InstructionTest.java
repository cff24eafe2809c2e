package ir.value.instructions;

import exception.IRException;
import ir.type.ArrayType;
import ir.type.FloatType;
import ir.type.FunctionType;
import ir.type.IntegerType;
import ir.type.PointerType;
import ir.type.StructType;
import ir.type.Type;
import ir.type.VoidType;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.GlobalVariable;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.constants.ConstantFloat;
import ir.value.constants.ConstantInt;
import ir.value.constants.ConstantNull;
import ir.value.constants.ConstantUndef;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InstructionTest {
    private static final IntegerType I32 = IntegerType.getI32();

    private static ConstantInt i32(long v) {
        return new ConstantInt(I32, v);
    }

    @Test
    public void testTerminatorClassification() {
        BasicBlock bb = new BasicBlock("bb");
        assertTrue(new ReturnInst().isTerminator());
        assertTrue(new BranchInst(bb).isTerminator());
        assertTrue(new BranchInst(new ConstantInt(IntegerType.getI1(), 1), bb, bb).isTerminator());
        assertTrue(new SwitchInst(i32(0), bb).isTerminator());
        assertTrue(new UnreachableInst().isTerminator());
        assertFalse(new BinOperator("x", Opcode.ADD, i32(1), i32(2)).isTerminator());
        assertFalse(new Phi(I32, "p").isTerminator());
        assertFalse(new StoreInst(i32(1), new ConstantNull(PointerType.get(I32))).isTerminator());
    }

    @Test
    public void testWrongArityIsRejected() {
        IRException e = assertThrows(IRException.class, () -> new Instruction(Opcode.ADD, I32, "x", i32(1)) {
            @Override
            public String toIR() {
                return "";
            }
        });
        assertTrue(e.getMessage().contains("add"));
        assertThrows(IRException.class, () -> new BinOperator("x", Opcode.ADD, i32(1), null));
        assertThrows(IRException.class, () -> new BinOperator("x", Opcode.ADD, null, i32(1)));
        assertThrows(IRException.class, () -> new SelectInst(new ConstantInt(IntegerType.getI1(), 1), null, i32(2), "s"));
        assertThrows(IRException.class, () -> new ExtractValueInst(null, List.of(0), "e"));
        assertThrows(IRException.class, () -> new InsertValueInst(null, i32(1), List.of(0), "v"));
        assertThrows(IRException.class, () -> new CallInst((Function) null, List.of(), "r"));
        assertThrows(IRException.class, () -> new Phi(I32, "p").addIncoming(null, new BasicBlock("b")));
        assertThrows(IRException.class, () -> new BinOperator("x", Opcode.TRUNC, i32(1), i32(2)));
        assertThrows(IRException.class, () -> new CastInst(Opcode.ADD, i32(1), I32, "c"));
    }

    @Test
    public void testSetOperandStaysInRange() {
        BinOperator add = new BinOperator("x", Opcode.ADD, i32(1), i32(2));
        add.setOperand(1, i32(5));
        assertEquals("%x = add i32 1, 5", add.toIR());
        assertThrows(IRException.class, () -> add.setOperand(2, i32(3)));
        assertThrows(IRException.class, () -> add.setOperand(0, null));
        assertEquals(2, add.getNumOperands());
    }

    @Test
    public void testBinaryFlags() {
        Value lhs = new ConstantUndef(I32);
        BinOperator inst = new BinOperator("r", Opcode.SDIV, lhs, i32(4));
        inst.setNoUnsignedWrap(true);
        inst.setNoSignedWrap(true);
        inst.setExact(true);
        assertEquals("%r = sdiv nuw nsw exact i32 undef, 4", inst.toIR());

        BinOperator fadd = new BinOperator("f", Opcode.FADD,
            new ConstantFloat(FloatType.getDouble(), 1.5), new ConstantFloat(FloatType.getDouble(), 2));
        assertEquals("%f = fadd f64 1.5, 2", fadd.toIR());
        assertTrue(fadd.isCommutative());
    }

    @Test
    public void testMemoryInstructions() {
        AllocaInst slot = new AllocaInst(I32, "slot");
        assertEquals(PointerType.get(I32), slot.getType());
        assertEquals("%slot = alloca i32", slot.toIR());
        slot.setAlignment(4);
        assertEquals("%slot = alloca i32, align 4", slot.toIR());

        AllocaInst buf = new AllocaInst(IntegerType.getI8(), i32(16), "buf");
        assertEquals("%buf = alloca i8, i32 16", buf.toIR());

        LoadInst load = new LoadInst(I32, slot, "v");
        load.setVolatile(true);
        load.setAlignment(4);
        assertEquals("%v = load volatile i32, ptr<i32> %slot, align 4", load.toIR());

        StoreInst store = new StoreInst(load, slot);
        assertEquals("store i32 %v, ptr<i32> %slot", store.toIR());
        store.setVolatile(true);
        store.setAlignment(8);
        assertEquals("store volatile i32 %v, ptr<i32> %slot, align 8", store.toIR());
    }

    @Test
    public void testGEPResultIsPointerToSourceType() {
        ArrayType arr = ArrayType.get(I32, 10);
        AllocaInst base = new AllocaInst(arr, "arr");
        GEPInst gep = new GEPInst(arr, base, List.of(i32(0), i32(3)), true, "p");

        assertEquals(PointerType.get(arr), gep.getType());
        assertEquals(2, gep.getNumIndices());
        assertEquals("%p = getelementptr inbounds [10 x i32], ptr<[10 x i32]> %arr, i32 0, i32 3", gep.toIR());
    }

    @Test
    public void testCastAndCompare() {
        AllocaInst slot = new AllocaInst(I32, "slot");
        LoadInst v = new LoadInst(I32, slot, "v");
        CastInst ext = new CastInst(Opcode.SEXT, v, IntegerType.getI64(), "w");
        assertEquals("%w = sext i32 %v to i64", ext.toIR());
        assertTrue(ext.isCast());

        ICmpInst cmp = new ICmpInst(ICmpPredicate.SLT, v, i32(10), "c");
        assertEquals(IntegerType.getI1(), cmp.getType());
        assertEquals("%c = icmp slt i32 %v, 10", cmp.toIR());

        FCmpInst fcmp = new FCmpInst(FCmpPredicate.UNO,
            new ConstantFloat(FloatType.getFloat(), 0.5), new ConstantFloat(FloatType.getFloat(), 1e6), "u");
        assertEquals("%u = fcmp uno f32 0.5, 1e+06", fcmp.toIR());

        SelectInst sel = new SelectInst(cmp, v, i32(0), "s");
        assertEquals("%s = select i1 %c, i32 %v, i32 0", sel.toIR());
    }

    @Test
    public void testBranches() {
        BasicBlock then = new BasicBlock("then");
        BasicBlock other = new BasicBlock("else");
        assertEquals("br label %then", new BranchInst(then).toIR());

        ICmpInst cond = new ICmpInst(ICmpPredicate.EQ, i32(1), i32(2), "c");
        BranchInst br = new BranchInst(cond, then, other);
        assertTrue(br.isConditional());
        assertSame(other, br.getElseBlock());
        assertEquals("br i1 %c, label %then, label %else", br.toIR());

        assertEquals("ret void", new ReturnInst().toIR());
        assertEquals("ret i32 7", new ReturnInst(i32(7)).toIR());
        assertEquals("unreachable", new UnreachableInst().toIR());
    }

    @Test
    public void testSwitchText() {
        BasicBlock def = new BasicBlock("default");
        BasicBlock one = new BasicBlock("one");
        SwitchInst sw = new SwitchInst(i32(3), def);
        sw.addCase(i32(1), one);
        sw.addCase(i32(2), one);
        assertEquals(2, sw.getNumCases());
        assertEquals("switch i32 3, label %default [\n"
                   + "    i32 1, label %one\n"
                   + "    i32 2, label %one\n"
                   + "  ]", sw.toIR());
    }

    @Test
    public void testPhiGrowsOneIncomingAtATime() {
        BasicBlock a = new BasicBlock("a");
        BasicBlock b = new BasicBlock("b");
        Phi phi = new Phi(I32, "p");
        assertEquals(0, phi.getNumOperands());
        phi.addIncoming(i32(1), a);
        phi.addIncoming(i32(1), a);
        phi.addIncoming(new ConstantUndef(I32), b);
        assertEquals(3, phi.getNumIncoming());
        assertSame(b, phi.getIncomingBlock(2));
        assertEquals("%p = phi i32 [ 1, %a ], [ 1, %a ], [ undef, %b ]", phi.toIR());
    }

    @Test
    public void testCalls() {
        Function f = new Function("f", FunctionType.get(VoidType.getVoid(), List.of()));
        assertEquals("call void @f()", new CallInst(f, List.of(), null).toIR());

        Function sum = new Function("sum", FunctionType.get(I32, List.of(I32, I32)));
        CallInst call = new CallInst(sum, List.of(i32(1), i32(2)), "r");
        call.setTailCall(true);
        assertSame(sum, call.getCallee());
        assertEquals("%r = tail call i32 @sum(i32 1, i32 2)", call.toIR());

        CallInst byName = new CallInst("puts", null, List.of(i32(0)), "ignored");
        assertTrue(byName.getType().isVoid());
        assertNull(byName.getCallee());
        assertEquals("call void @puts(i32 0)", byName.toIR());
    }

    @Test
    public void testAggregateValues() {
        StructType pair = StructType.get(List.<Type>of(I32, I32));
        Value agg = new ConstantUndef(pair);
        InsertValueInst ins = new InsertValueInst(agg, i32(5), List.of(1), "a");
        assertEquals(pair, ins.getType());
        assertEquals("%a = insertvalue { i32, i32 } undef, i32 5, 1", ins.toIR());

        ExtractValueInst ext = new ExtractValueInst(ins, List.of(1), "b");
        assertEquals(pair, ext.getType());
        assertEquals("%b = extractvalue { i32, i32 } %a, 1", ext.toIR());
    }

    @Test
    public void testOperandReferences() {
        GlobalVariable g = new GlobalVariable("counter", I32, i32(0));
        LoadInst load = new LoadInst(I32, g, "v");
        assertEquals("%v = load i32, ptr<i32> %counter", load.toIR());

        Function f = new Function("h", FunctionType.get(VoidType.getVoid(), List.of(I32)));
        BinOperator add = new BinOperator(null, Opcode.ADD, f.getParam(0), i32(1));
        assertEquals("%<unnamed> = add i32 %0, 1", add.toIR());
    }
}
