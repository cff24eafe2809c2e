package ir.value;

import ir.type.FloatType;
import ir.type.FunctionType;
import ir.type.IntegerType;
import ir.type.PointerType;
import ir.type.Type;
import ir.type.VoidType;
import ir.value.instructions.ReturnInst;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FunctionTest {

    @Test
    public void testArgumentsFollowSignature() {
        List<Type> params = List.of(IntegerType.getI32(), FloatType.getDouble(),
                                    PointerType.get(IntegerType.getI8()));
        Function f = new Function("f", FunctionType.get(VoidType.getVoid(), params));

        assertEquals(3, f.getArguments().size());
        for (int i = 0; i < params.size(); i++) {
            Argument arg = f.getArguments().get(i);
            assertEquals(params.get(i), arg.getType());
            assertEquals(i, arg.getIndex());
            assertSame(f, arg.getParent());
        }
    }

    @Test
    public void testDeclarationText() {
        Function printf = new Function("printf",
            FunctionType.get(IntegerType.getI32(), List.of(PointerType.get(IntegerType.getI8())), true));
        assertTrue(printf.isDeclaration());
        assertNull(printf.getEntryBlock());
        assertEquals("declare external i32 @printf(ptr<i8> %0, ...)", printf.toIR());
    }

    @Test
    public void testDefinitionText() {
        Function f = new Function("id", FunctionType.get(IntegerType.getI32(), List.of(IntegerType.getI32())));
        f.getParam(0).setName("x");
        f.setLinkage(Linkage.INTERNAL);
        f.addAttribute(FunctionAttribute.NO_UNWIND);
        f.addAttribute(FunctionAttribute.READ_NONE);

        BasicBlock entry = new BasicBlock("entry");
        f.addBlock(entry);
        entry.addInstruction(new ReturnInst(f.getParam(0)));

        assertFalse(f.isDeclaration());
        assertSame(entry, f.getEntryBlock());
        assertSame(f, entry.getParent());
        assertEquals("define internal i32 @id(i32 %x) nounwind readnone {\n"
                   + "entry:\n"
                   + "  ret i32 %x\n"
                   + "}", f.toIR());
    }

    @Test
    public void testEntryIsFirstBlock() {
        Function f = new Function("g", FunctionType.get(VoidType.getVoid(), List.of()));
        BasicBlock a = new BasicBlock("a");
        BasicBlock b = new BasicBlock("b");
        f.addBlock(a);
        f.addBlock(b);
        assertSame(a, f.getEntryBlock());
        assertEquals(List.of(a, b), f.getBlockList());
        assertSame(b, f.getBlockByName("b"));
        assertNull(f.getBlockByName("c"));
    }
}
