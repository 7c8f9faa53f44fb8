package params;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Expected shape of one declared field.
 *
 * <p> A closed set of variants: {@link Primitive}, {@link NestedSchema}, {@link Sequence}, {@link Mapping},
 * {@link Optional} and {@link Union}. Descriptors are built with the static factories and compose freely,
 * e.g. {@code mapOf(string(), listOf(nested(rowSchema)))}.
 *
 * @since 0.1.0
 */
public sealed interface TypeDescriptor {

    /**
     * @return short, human readable type name used in error reports, e.g. {@code list<string>}
     */
    String shortName();

    /**
     * @return the Java type of values this descriptor produces
     */
    Class<?> javaType();

    // ============================================================
    // Factories
    // ============================================================

    static TypeDescriptor string() {
        return Primitive.STRING;
    }

    static TypeDescriptor bool() {
        return Primitive.BOOLEAN;
    }

    static TypeDescriptor integer() {
        return Primitive.INTEGER;
    }

    static TypeDescriptor int64() {
        return Primitive.LONG;
    }

    static TypeDescriptor number() {
        return Primitive.DOUBLE;
    }

    static TypeDescriptor decimal() {
        return Primitive.DECIMAL;
    }

    static TypeDescriptor any() {
        return Primitive.ANY;
    }

    static TypeDescriptor nested(Schema<?> schema) {
        return new NestedSchema(schema);
    }

    static TypeDescriptor listOf(TypeDescriptor element) {
        return new Sequence(element);
    }

    static TypeDescriptor mapOf(TypeDescriptor key, TypeDescriptor value) {
        return new Mapping(key, value);
    }

    /**
     * Mapping with string keys, the common case for JSON objects used as dictionaries.
     */
    static TypeDescriptor mapOf(TypeDescriptor value) {
        return new Mapping(Primitive.STRING, value);
    }

    static TypeDescriptor optional(TypeDescriptor inner) {
        return new Optional(inner);
    }

    static TypeDescriptor union(TypeDescriptor... alternatives) {
        if (alternatives == null) throw new Params.ConfigurationException("Union alternatives must not be null");
        return new Union(Arrays.asList(alternatives));
    }

    // ============================================================
    // Variants
    // ============================================================

    enum Kind {
        STRING(String.class),
        BOOLEAN(Boolean.class),
        INTEGER(Integer.class),
        LONG(Long.class),
        DOUBLE(Double.class),
        DECIMAL(BigDecimal.class),
        ANY(Object.class);

        private final Class<?> javaType;

        Kind(Class<?> javaType) {
            this.javaType = javaType;
        }

        public Class<?> javaType() {
            return javaType;
        }
    }

    record Primitive(Kind kind) implements TypeDescriptor {
        static final Primitive STRING = new Primitive(Kind.STRING);
        static final Primitive BOOLEAN = new Primitive(Kind.BOOLEAN);
        static final Primitive INTEGER = new Primitive(Kind.INTEGER);
        static final Primitive LONG = new Primitive(Kind.LONG);
        static final Primitive DOUBLE = new Primitive(Kind.DOUBLE);
        static final Primitive DECIMAL = new Primitive(Kind.DECIMAL);
        static final Primitive ANY = new Primitive(Kind.ANY);

        public Primitive {
            requireDeclared(kind, "Primitive kind");
        }

        @Override
        public String shortName() {
            return switch (kind) {
                case STRING -> "string";
                case BOOLEAN -> "boolean";
                case INTEGER -> "integer";
                case LONG -> "long";
                case DOUBLE -> "number";
                case DECIMAL -> "decimal";
                case ANY -> "any";
            };
        }

        @Override
        public Class<?> javaType() {
            return kind.javaType();
        }
    }

    record NestedSchema(Schema<?> schema) implements TypeDescriptor {
        public NestedSchema {
            requireDeclared(schema, "Nested schema");
        }

        @Override
        public String shortName() {
            return schema.name();
        }

        @Override
        public Class<?> javaType() {
            return schema.type();
        }
    }

    record Sequence(TypeDescriptor element) implements TypeDescriptor {
        public Sequence {
            requireDeclared(element, "Sequence element descriptor");
        }

        @Override
        public String shortName() {
            return "list<" + element.shortName() + ">";
        }

        @Override
        public Class<?> javaType() {
            return List.class;
        }
    }

    /**
     * JSON object used as a dictionary. Keys are matched as JSON strings against {@code key},
     * which must be a {@link Primitive}.
     */
    record Mapping(TypeDescriptor key, TypeDescriptor value) implements TypeDescriptor {
        public Mapping {
            requireDeclared(key, "Mapping key descriptor");
            requireDeclared(value, "Mapping value descriptor");
            if (!(key instanceof Primitive))
                throw new Params.ConfigurationException(
                        "Mapping keys must be primitive, got " + key.shortName());
        }

        @Override
        public String shortName() {
            return "map<" + key.shortName() + ", " + value.shortName() + ">";
        }

        @Override
        public Class<?> javaType() {
            return Map.class;
        }
    }

    /**
     * Accepts an absent member or JSON {@code null} as {@link java.util.Optional#empty()}.
     */
    record Optional(TypeDescriptor inner) implements TypeDescriptor {
        public Optional {
            requireDeclared(inner, "Optional inner descriptor");
        }

        @Override
        public String shortName() {
            return "optional<" + inner.shortName() + ">";
        }

        @Override
        public Class<?> javaType() {
            return java.util.Optional.class;
        }
    }

    /**
     * Alternatives are tried in declared order; the first that matches without errors wins.
     */
    record Union(List<TypeDescriptor> alternatives) implements TypeDescriptor {
        public Union {
            requireDeclared(alternatives, "Union alternatives");
            if (alternatives.isEmpty())
                throw new Params.ConfigurationException("Union must declare at least one alternative");
            var copy = new ArrayList<TypeDescriptor>(alternatives.size());
            for (var alternative : alternatives) copy.add(requireDeclared(alternative, "Union alternative"));
            alternatives = Collections.unmodifiableList(copy);
        }

        @Override
        public String shortName() {
            return alternatives.stream().map(TypeDescriptor::shortName).collect(Collectors.joining(" | "));
        }

        @Override
        public Class<?> javaType() {
            return Object.class;
        }
    }

    private static <T> T requireDeclared(T value, String what) {
        if (value == null) throw new Params.ConfigurationException(what + " must not be null");
        return value;
    }
}
