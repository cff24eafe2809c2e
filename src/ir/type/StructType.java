package ir.type;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import org.jetbrains.annotations.Nullable;

/**
 * Named or anonymous aggregate of fields.
 *
 * <p>Two named structs are equal iff their names are equal, whatever their
 * field lists say; this lets a forward declaration stand in for the full
 * definition. If either side is anonymous the comparison is structural over
 * fields and the packed flag.
 */
public final class StructType extends Type {
    private final String name;
    private final List<Type> fields;
    private final boolean packed;

    private StructType(String name, List<Type> fields, boolean packed) {
        super(TypeKind.STRUCT);
        this.name = name;
        this.fields = List.copyOf(fields);
        this.packed = packed;
    }

    public static StructType get(List<Type> fields) {
        return new StructType(null, fields, false);
    }

    public static StructType get(List<Type> fields, boolean packed) {
        return new StructType(null, fields, packed);
    }

    /** An empty or null name makes the struct anonymous. */
    public static StructType getNamed(String name, List<Type> fields, boolean packed) {
        return new StructType(name == null || name.isEmpty() ? null : name,
                              fields, packed);
    }

    public @Nullable String getName() { return name; }
    public boolean isNamed() { return name != null; }
    public List<Type> getFields() { return fields; }
    public Type getField(int index) { return fields.get(index); }
    public int getNumFields() { return fields.size(); }
    public boolean isPacked() { return packed; }

    /** The brace-delimited field list, also used for named type definitions. */
    public String getBodyIR() {
        String body = fields.stream()
            .map(Type::toIR)
            .collect(Collectors.joining(", "));
        return packed ? "<{ " + body + " }>" : "{ " + body + " }";
    }

    @Override
    public String toIR() {
        if (isNamed()) {
            return "%" + name;
        }
        return getBodyIR();
    }

    @Override
    public long getBitSize() {
        long total = 0;
        for (Type field : fields) {
            total += field.getBitSize();
        }
        return total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StructType other)) return false;
        if (isNamed() && other.isNamed()) {
            return name.equals(other.name);
        }
        return packed == other.packed && fields.equals(other.fields);
    }

    // only the kind: a named struct may equal an anonymous one with the same fields
    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode());
    }
}
