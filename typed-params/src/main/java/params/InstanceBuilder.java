package params;

import java.lang.reflect.InvocationTargetException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a typed instance of a schema from a raw object, walking every declared field.
 *
 * <p> A build never stops at the first problem: all fields, elements and keys are visited and every error is
 * reported together. An instance is created only when the whole subtree matched.
 */
final class InstanceBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(InstanceBuilder.class);

    private final Params.Options options;
    private final TypeMatcher matcher;

    InstanceBuilder(Params.Options options) {
        if (options.getMaxDepth() < 1)
            throw new Params.ConfigurationException("maxDepth must be at least 1, got " + options.getMaxDepth());
        this.options = options;
        this.matcher = new TypeMatcher(options, this);
    }

    /**
     * Build from the document root.
     *
     * @throws Params.ValidationException carrying every error found
     */
    <T> T build(Schema<T> schema, JsonValue raw) {
        var result = build(schema, raw, FieldPath.root());
        if (!result.isOk()) {
            LOGGER.debug("Building {} failed with {} error(s)", schema.name(), result.errors().size());
            throw new Params.ValidationException(schema.name(), result.errors());
        }
        LOGGER.debug("Built {}", schema.name());
        return schema.type().cast(result.value());
    }

    TypeMatcher.Result build(Schema<?> schema, JsonValue raw, FieldPath path) {
        if (!(raw instanceof JsonObject object))
            return TypeMatcher.Result.failed(
                    ValidationError.typeMismatch(path, TypeDescriptor.nested(schema), raw));

        var errors = new ErrorReport();
        Map<String, Object> values = new LinkedHashMap<>();
        for (var field : schema.fields()) {
            var fieldPath = path.field(field.key());
            var value = object.value().get(field.key());
            if (value == null && !(field.descriptor() instanceof TypeDescriptor.Optional)) {
                errors.add(ValidationError.missingField(fieldPath, field.descriptor()));
                continue;
            }
            var result = matcher.coerce(field.descriptor(), value, fieldPath);
            if (result.isOk()) values.put(field.name(), result.value());
            else errors.addAll(result.errors());
        }
        if (options.getUnknownKeys() == Params.UnknownKeys.REJECT) {
            for (var en : object.value().entrySet()) {
                if (!schema.declaredFields().containsKey(en.getKey()))
                    errors.add(ValidationError.unknownField(path.field(en.getKey()), en.getValue()));
            }
        }
        if (!errors.isEmpty()) return TypeMatcher.Result.failed(errors);

        try {
            return TypeMatcher.Result.ok(schema.instantiate(values));
        } catch (InvocationTargetException e) {
            var cause = e.getCause() == null ? e : e.getCause();
            return TypeMatcher.Result.failed(ValidationError.rejected(path, schema, raw, cause.getMessage()));
        }
    }
}
