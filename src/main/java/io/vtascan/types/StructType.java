package io.vtascan.types;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A struct type. Fields are addressed by their ordinal.
 *
 * @param fields The fields in declaration order
 */
public record StructType(List<Field> fields) implements Type {

    /**
     * A struct field.
     *
     * @param name     Field name (the type name for embedded fields)
     * @param type     Field type
     * @param embedded Whether the field is embedded
     */
    public record Field(String name, Type type, boolean embedded) {
        public Field {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(type, "type");
        }

        public Field(String name, Type type) {
            this(name, type, false);
        }

        @Override
        public String toString() {
            return embedded ? type.toString() : name + " " + type;
        }
    }

    public StructType {
        fields = List.copyOf(fields);
    }

    /**
     * Returns the field at the given ordinal.
     *
     * @throws IndexOutOfBoundsException if the struct has no such field
     */
    public Field field(int index) {
        return fields.get(index);
    }

    public int size() {
        return fields.size();
    }

    @Override
    public String toString() {
        return fields.stream()
                .map(Field::toString)
                .collect(Collectors.joining("; ", "struct{", "}"));
    }
}
