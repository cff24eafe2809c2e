package ir.type;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TypeTest {

    @Test
    public void testPrimitiveSyntax() {
        assertEquals("void", VoidType.getVoid().toIR());
        assertEquals("label", LabelType.getLabel().toIR());
        assertEquals("i32", IntegerType.getI32().toIR());
        assertEquals("u8", IntegerType.U8.toIR());
        assertEquals("i7", IntegerType.get(7, true).toIR());
        assertEquals("f32", FloatType.getFloat().toIR());
        assertEquals("f64", FloatType.getDouble().toIR());
    }

    @Test
    public void testCompositeSyntax() {
        Type i32 = IntegerType.getI32();
        assertEquals("ptr<i32>", PointerType.get(i32).toIR());
        assertEquals("ptr<i32, 3>", PointerType.get(i32, 3).toIR());
        assertEquals("[4 x i32]", ArrayType.get(i32, 4).toIR());
        assertEquals("<4 x f32>", VectorType.get(FloatType.getFloat(), 4).toIR());
        assertEquals("<vscale x 2 x i64>", VectorType.getScalable(IntegerType.getI64(), 2).toIR());
        assertEquals("fn(i32, ptr<i8>) -> void",
            FunctionType.get(VoidType.getVoid(), List.of(i32, PointerType.get(IntegerType.getI8()))).toIR());
        assertEquals("fn(ptr<i8>, ...) -> i32",
            FunctionType.get(i32, List.of(PointerType.get(IntegerType.getI8())), true).toIR());
        assertEquals("fn(...) -> i32", FunctionType.get(i32, List.of(), true).toIR());
    }

    @Test
    public void testStructSyntax() {
        Type i32 = IntegerType.getI32();
        StructType anon = StructType.get(List.of(i32, FloatType.getDouble()));
        assertEquals("{ i32, f64 }", anon.toIR());
        assertEquals("<{ i32, f64 }>", StructType.get(List.of(i32, FloatType.getDouble()), true).toIR());

        StructType point = StructType.getNamed("Point", List.of(i32, i32), false);
        assertEquals("%Point", point.toIR());
        assertEquals("{ i32, i32 }", point.getBodyIR());
    }

    @Test
    public void testStructuralEquality() {
        Type i32 = IntegerType.getI32();
        assertEquals(IntegerType.get(32, true), i32);
        assertNotEquals(IntegerType.get(32, false), i32);
        assertEquals(PointerType.get(ArrayType.get(i32, 2)), PointerType.get(ArrayType.get(i32, 2)));
        assertNotEquals(PointerType.get(i32), PointerType.get(i32, 1));
        assertNotEquals(ArrayType.get(i32, 2), ArrayType.get(i32, 3));
        assertNotEquals(VectorType.get(i32, 4), VectorType.getScalable(i32, 4));
        assertEquals(FunctionType.get(i32, List.of(i32)), FunctionType.get(i32, List.of(i32), false));
        assertNotEquals(FunctionType.get(i32, List.of(i32)), FunctionType.get(i32, List.of(i32), true));
        assertNotEquals(i32, FloatType.getFloat());
        assertEquals(VoidType.getVoid(), VoidType.getVoid());
    }

    @Test
    public void testNamedStructsCompareByName() {
        StructType a = StructType.getNamed("Point", List.of(IntegerType.getI32(), IntegerType.getI32()), false);
        StructType b = StructType.getNamed("Point", List.of(FloatType.getDouble()), false);
        StructType c = StructType.getNamed("Other", List.of(IntegerType.getI32(), IntegerType.getI32()), false);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }

    @Test
    public void testAnonymousStructEquality() {
        Type i32 = IntegerType.getI32();
        StructType named = StructType.getNamed("Pair", List.of(i32, i32), false);
        StructType anon = StructType.get(List.of(i32, i32));

        assertEquals(anon, StructType.get(List.of(i32, i32)));
        assertNotEquals(anon, StructType.get(List.of(i32, i32), true));
        assertEquals(named, anon);
        assertEquals(named.hashCode(), anon.hashCode());
        assertFalse(StructType.getNamed("", List.of(i32), false).isNamed());
    }

    @Test
    public void testBitSize() {
        Type i32 = IntegerType.getI32();
        assertEquals(32, i32.getBitSize());
        assertEquals(128, ArrayType.get(i32, 4).getBitSize());
        assertEquals(96, StructType.get(List.of(i32, FloatType.getDouble())).getBitSize());
        assertEquals(PointerType.POINTER_BITS, PointerType.get(i32).getBitSize());
        assertEquals(256, VectorType.get(IntegerType.getI64(), 4).getBitSize());

        assertEquals(Type.UNSIZED, FunctionType.get(i32, List.of()).getBitSize());
        assertEquals(Type.UNSIZED, LabelType.getLabel().getBitSize());
        assertEquals(Type.UNSIZED, VectorType.getScalable(i32, 4).getBitSize());
        assertFalse(VectorType.getScalable(i32, 4).isSized());
        assertTrue(i32.isSized());
    }

    @Test
    public void testClassification() {
        Type i32 = IntegerType.getI32();
        assertTrue(i32.isInteger());
        assertTrue(FloatType.getFloat().isFloat());
        assertTrue(PointerType.get(i32).isPointer());
        assertTrue(ArrayType.get(i32, 1).isAggregate());
        assertTrue(StructType.get(List.of(i32)).isAggregate());
        assertFalse(VectorType.get(i32, 4).isAggregate());
        assertEquals(TypeKind.LABEL, LabelType.getLabel().getKind());
    }
}
