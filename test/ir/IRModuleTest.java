package ir;

import exception.IRException;
import ir.type.ArrayType;
import ir.type.FunctionType;
import ir.type.IntegerType;
import ir.type.StructType;
import ir.type.Type;
import ir.type.VoidType;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.GlobalVariable;
import ir.value.Linkage;
import ir.value.constants.ConstantInt;
import ir.value.instructions.ReturnInst;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IRModuleTest {
    private static final IntegerType I32 = IntegerType.getI32();

    @Test
    public void testEmptyModule() {
        IRModule module = new IRModule("empty");
        assertEquals("", module.toIR());
        assertEquals("empty", module.getName());
    }

    @Test
    public void testLookupIsByNameAndMayMiss() {
        IRModule module = new IRModule("m");
        Function f = new Function("f", FunctionType.get(VoidType.getVoid(), List.of()));
        GlobalVariable g = new GlobalVariable("g", I32, null);
        module.addFunction(f);
        module.addGlobal(g);

        assertSame(f, module.getFunction("f"));
        assertSame(module, f.getParent());
        assertSame(g, module.getGlobal("g"));
        assertSame(module, g.getParent());
        assertNull(module.getFunction("g"));
        assertNull(module.getGlobal("missing"));
    }

    @Test
    public void testDuplicateNamesAreKept() {
        IRModule module = new IRModule("m");
        Function first = new Function("f", FunctionType.get(VoidType.getVoid(), List.of()));
        Function second = new Function("f", FunctionType.get(I32, List.of()));
        module.addFunction(first);
        module.addFunction(second);
        assertEquals(2, module.getFunctions().size());
        assertSame(first, module.getFunction("f"));
    }

    @Test
    public void testGlobalText() {
        GlobalVariable counter = new GlobalVariable("counter", I32, new ConstantInt(I32, 0));
        assertEquals("@counter = external global i32 0", counter.toIR());

        GlobalVariable table = new GlobalVariable("table", ArrayType.get(I32, 4), null);
        table.setConst(true);
        table.setLinkage(Linkage.PRIVATE);
        assertEquals("@table = private constant ptr<[4 x i32]>", table.toIR());
        assertEquals(ArrayType.get(I32, 4), table.getValueType());
    }

    @Test
    public void testModuleText() {
        IRModule module = new IRModule("m");
        module.setDataLayout("e-m:e-i64:64");
        module.setTargetTriple("x86_64-unknown-linux-gnu");
        module.addNamedType(StructType.getNamed("Point", List.<Type>of(I32, I32), false));
        module.addGlobal(new GlobalVariable("g", I32, new ConstantInt(I32, 1)));

        Function decl = new Function("ext", FunctionType.get(VoidType.getVoid(), List.of()));
        module.addFunction(decl);
        Function main = new Function("main", FunctionType.get(I32, List.of()));
        BasicBlock entry = new BasicBlock("entry");
        main.addBlock(entry);
        entry.addInstruction(new ReturnInst(new ConstantInt(I32, 0)));
        module.addFunction(main);

        String expected = "target datalayout = \"e-m:e-i64:64\"\n"
            + "target triple = \"x86_64-unknown-linux-gnu\"\n"
            + "\n"
            + "%Point = type { i32, i32 }\n"
            + "\n"
            + "@g = external global i32 1\n"
            + "\n"
            + "declare external void @ext()\n"
            + "\n"
            + "define external i32 @main() {\n"
            + "entry:\n"
            + "  ret i32 0\n"
            + "}\n";
        assertEquals(expected, module.toIR());
        assertNotNull(module.getNamedType("Point"));
    }

    @Test
    public void testAnonymousStructCannotBeRegistered() {
        IRModule module = new IRModule("m");
        assertThrows(IRException.class,
            () -> module.addNamedType(StructType.get(List.<Type>of(I32))));
    }

    @Test
    public void testPrintToFile(@TempDir Path dir) throws IOException {
        IRModule module = new IRModule("m");
        module.addFunction(new Function("f", FunctionType.get(VoidType.getVoid(), List.of())));
        Path out = dir.resolve("m.ir");
        module.printToFile(out);
        assertEquals(module.toIR(), Files.readString(out, StandardCharsets.UTF_8));
    }
}
