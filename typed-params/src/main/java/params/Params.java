package params;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.jspecify.annotations.Nullable;

/**
 * Entry points for building typed params from a parsed params document.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * record RowNames(String TOTAL_ROW, String QUESTION_ROW) {}
 * record PublicationParams(RowNames ROW_NAMES, List<String> PUBLICATION_ROW_ORDER) {}
 *
 * PublicationParams params = Params.load(Schema.of(PublicationParams.class), Path.of("params_2024.json"));
 * params.ROW_NAMES().TOTAL_ROW();
 * }</pre>
 *
 * <p> A build either returns a fully populated instance or throws {@link ValidationException}
 * listing every problem found in the document.
 *
 * @since 0.1.0
 */
public final class Params {

    /**
     * Default nesting limit for schema descent and JSON text.
     */
    public static final int DEFAULT_MAX_DEPTH = 64;

    private static final Options defaultOptions = Options.builder().build();

    private Params() {
        throw new UnsupportedOperationException();
    }

    // ============================================================
    // Public API
    // ============================================================

    /**
     * Build a typed instance of {@code schema} from a raw value.
     *
     * @param schema target schema, not {@code null}
     * @param raw    a {@link JsonValue} or a JSON-like Java value (maps, lists, strings, numbers, booleans)
     * @param <T>    instance type
     * @return fully populated instance
     * @throws ValidationException if the raw value does not satisfy the schema
     */
    public static <T> T construct(Schema<T> schema, @Nullable Object raw) {
        return construct(schema, raw, defaultOptions);
    }

    public static <T> T construct(Schema<T> schema, @Nullable Object raw, Options options) {
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(options, "options");
        var builder = new InstanceBuilder(options);
        JsonValue tree;
        try {
            tree = JsonValue.fromJavaObject(raw, options.getMaxDepth());
        } catch (DepthExceededException e) {
            var error = ValidationError.depthExceeded(e.getPath(), null, null, e.getMaxDepth());
            throw new ValidationException(schema.name(), ErrorReport.of(error));
        }
        return builder.build(schema, tree);
    }

    /**
     * Convenience overload of {@link #construct(Schema, Object)} for a record type.
     */
    public static <T extends Record> T construct(Class<T> recordType, @Nullable Object raw) {
        return construct(Schema.of(recordType), raw);
    }

    /**
     * Rebuild the instance held by {@code holder} from a new raw value.
     *
     * @see ParamsHolder#replace(Object)
     */
    public static <T> void replace(ParamsHolder<T> holder, @Nullable Object raw) {
        Objects.requireNonNull(holder, "holder").replace(raw);
    }

    /**
     * Parse JSON text into a raw value tree.
     *
     * @param json JSON text, not {@code null}
     * @return parsed tree
     * @throws SyntaxException if the text is not valid JSON
     */
    public static JsonValue parse(String json) {
        return parse(json, defaultOptions);
    }

    public static JsonValue parse(String json, Options options) {
        return JsonReader.read(json, options.getMaxDepth());
    }

    /**
     * Read and parse a params file.
     *
     * @throws ReadException   if the file cannot be read
     * @throws SyntaxException if the file is not valid JSON
     */
    public static JsonValue read(Path file) {
        return read(file, defaultOptions);
    }

    public static JsonValue read(Path file, Options options) {
        Objects.requireNonNull(file, "file");
        String text;
        try {
            text = Files.readString(file);
        } catch (IOException e) {
            throw new ReadException("Failed to read params file " + file, e);
        }
        return parse(text, options);
    }

    /**
     * Read a params file and build a typed instance from it.
     */
    public static <T> T load(Schema<T> schema, Path file) {
        return load(schema, file, defaultOptions);
    }

    public static <T> T load(Schema<T> schema, Path file, Options options) {
        return construct(schema, read(file, options), options);
    }

    /**
     * Convert a typed instance back into the raw value model.
     *
     * <p> Building {@code toRaw(instance)} against the instance's schema yields an equal instance.
     */
    public static JsonValue toRaw(@Nullable Object instance) {
        return toRaw(instance, defaultOptions);
    }

    /**
     * @throws DepthExceededException if {@code instance} nests deeper than {@code options.getMaxDepth()}
     */
    public static JsonValue toRaw(@Nullable Object instance, Options options) {
        return JsonValue.fromJavaObject(instance, options.getMaxDepth());
    }

    public static Options options() {
        return defaultOptions;
    }

    // ============================================================
    // Options
    // ============================================================

    /**
     * How primitive values are matched against their declared kind.
     */
    public enum Coercion {
        /**
         * The raw value must already have the declared JSON type.
         */
        STRICT,
        /**
         * Also accept textual forms: numbers and booleans as strings, numeric and boolean strings.
         */
        LENIENT
    }

    /**
     * What to do with raw object members that the schema does not declare.
     */
    public enum UnknownKeys {
        IGNORE,
        REJECT
    }

    @Getter
    @ToString
    @Builder(toBuilder = true)
    public static final class Options {

        @Builder.Default
        private final Coercion coercion = Coercion.STRICT;

        @Builder.Default
        private final UnknownKeys unknownKeys = UnknownKeys.IGNORE;

        @Builder.Default
        private final int maxDepth = DEFAULT_MAX_DEPTH;
    }

    // ============================================================
    // Exceptions
    // ============================================================

    /**
     * Base exception for all params errors.
     */
    public abstract static class Exception extends RuntimeException {
        public Exception(String message) {
            super(message);
        }

        public Exception(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * A schema declaration is malformed. Raised when the schema is declared or first used,
     * independent of any params document.
     */
    public static class ConfigurationException extends Exception {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * A Java type or type descriptor that the builder has no mapping for.
     */
    public static class UnsupportedTypeException extends ConfigurationException {
        public UnsupportedTypeException(String message) {
            super(message);
        }
    }

    /**
     * A params document does not satisfy its schema. Carries every error found during the build.
     */
    public static class ValidationException extends Exception {
        private final String schemaName;
        private final ErrorReport report;

        public ValidationException(String schemaName, ErrorReport report) {
            super(report.render(schemaName));
            this.schemaName = schemaName;
            this.report = report;
        }

        public String getSchemaName() {
            return schemaName;
        }

        public ErrorReport getReport() {
            return report;
        }

        public List<ValidationError> getErrors() {
            return report.errors();
        }
    }

    /**
     * Params text is not valid JSON.
     */
    public static class SyntaxException extends Exception {
        private final int line;
        private final int column;

        public SyntaxException(String message, int line, int column) {
            super(String.format("%s at line %d, column %d", message, line, column));
            this.line = line;
            this.column = column;
        }

        public int getLine() {
            return line;
        }

        public int getColumn() {
            return column;
        }
    }

    /**
     * A params file could not be read.
     */
    public static class ReadException extends Exception {
        public ReadException(String message, IOException cause) {
            super(message, cause);
        }
    }

    /**
     * A Java value cannot be represented in the raw value model.
     */
    public static class ConversionException extends Exception {
        public ConversionException(String message) {
            super(message);
        }
    }

    /**
     * A Java value nests deeper than the configured maximum depth.
     */
    public static class DepthExceededException extends ConversionException {
        private final FieldPath path;
        private final int maxDepth;

        public DepthExceededException(FieldPath path, int maxDepth) {
            super("Value at " + path + " is nested deeper than the maximum depth of " + maxDepth);
            this.path = path;
            this.maxDepth = maxDepth;
        }

        public FieldPath getPath() {
            return path;
        }

        public int getMaxDepth() {
            return maxDepth;
        }
    }
}
