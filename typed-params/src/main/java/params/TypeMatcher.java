package params;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Matches one raw value against one {@link TypeDescriptor}, converting it to its typed form.
 *
 * <p> Ordinary mismatches never throw; they come back as a failed {@link Result} so that the caller can keep
 * walking sibling values. Only schema defects throw.
 */
final class TypeMatcher {

    private static final BigInteger INT_MIN = BigInteger.valueOf(Integer.MIN_VALUE);
    private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);
    private static final int MAX_INTEGRAL_DIGITS = 19;

    private final Params.Options options;
    private final InstanceBuilder builder;

    TypeMatcher(Params.Options options, InstanceBuilder builder) {
        this.options = options;
        this.builder = builder;
    }

    /**
     * Either a typed value (errors empty) or the errors explaining why there is none.
     */
    record Result(@Nullable Object value, ErrorReport errors) {
        static Result ok(@Nullable Object value) {
            return new Result(value, new ErrorReport());
        }

        static Result failed(ErrorReport errors) {
            return new Result(null, errors);
        }

        static Result failed(ValidationError error) {
            return new Result(null, ErrorReport.of(error));
        }

        boolean isOk() {
            return errors.isEmpty();
        }
    }

    /**
     * @param descriptor expected shape
     * @param raw        raw value, {@code null} when the member is absent
     * @param path       location of {@code raw}
     */
    Result coerce(TypeDescriptor descriptor, @Nullable JsonValue raw, FieldPath path) {
        if (path.depth() > options.getMaxDepth())
            return Result.failed(ValidationError.depthExceeded(path, descriptor, raw, options.getMaxDepth()));

        if (descriptor instanceof TypeDescriptor.Optional o) {
            if (raw == null || raw instanceof JsonNull) return Result.ok(java.util.Optional.empty());
            var inner = coerce(o.inner(), raw, path);
            return inner.isOk() ? Result.ok(java.util.Optional.ofNullable(inner.value())) : inner;
        }
        if (raw == null) return Result.failed(ValidationError.missingField(path, descriptor));
        if (descriptor instanceof TypeDescriptor.Primitive p)
            return coercePrimitive(p, raw, path, options.getCoercion() == Params.Coercion.LENIENT);
        if (descriptor instanceof TypeDescriptor.NestedSchema n) return builder.build(n.schema(), raw, path);
        if (descriptor instanceof TypeDescriptor.Sequence s) return coerceSequence(s, raw, path);
        if (descriptor instanceof TypeDescriptor.Mapping m) return coerceMapping(m, raw, path);
        if (descriptor instanceof TypeDescriptor.Union u) return coerceUnion(u, raw, path);
        throw new Params.UnsupportedTypeException(
                "Unsupported type descriptor " + descriptor.getClass().getName() + " at " + path);
    }

    private Result coerceSequence(TypeDescriptor.Sequence descriptor, JsonValue raw, FieldPath path) {
        if (!(raw instanceof JsonArray array))
            return Result.failed(ValidationError.typeMismatch(path, descriptor, raw));
        var errors = new ErrorReport();
        var values = new ArrayList<>(array.value().size());
        for (int i = 0; i < array.value().size(); i++) {
            var element = coerce(descriptor.element(), array.value().get(i), path.index(i));
            if (element.isOk()) values.add(element.value());
            else errors.addAll(element.errors());
        }
        if (!errors.isEmpty()) return Result.failed(errors);
        return Result.ok(Collections.unmodifiableList(values));
    }

    private Result coerceMapping(TypeDescriptor.Mapping descriptor, JsonValue raw, FieldPath path) {
        if (!(raw instanceof JsonObject object))
            return Result.failed(ValidationError.typeMismatch(path, descriptor, raw));
        var errors = new ErrorReport();
        var values = new LinkedHashMap<Object, Object>();
        for (var en : object.value().entrySet()) {
            // errors are reported under the key as written; typed keys are always read from that text
            var entryPath = path.key(en.getKey());
            var rawKey = new JsonString(en.getKey());
            var key = coercePrimitive((TypeDescriptor.Primitive) descriptor.key(), rawKey, entryPath, true);
            var value = coerce(descriptor.value(), en.getValue(), entryPath);
            errors.addAll(key.errors());
            errors.addAll(value.errors());
            if (!key.isOk() || !value.isOk()) continue;
            if (values.containsKey(key.value())) {
                errors.add(ValidationError.typeMismatch(
                        entryPath,
                        descriptor.key(),
                        rawKey,
                        "key converts to " + key.value() + ", which another key already converted to"));
                continue;
            }
            values.put(key.value(), value.value());
        }
        if (!errors.isEmpty()) return Result.failed(errors);
        return Result.ok(Collections.unmodifiableMap(values));
    }

    private Result coerceUnion(TypeDescriptor.Union descriptor, JsonValue raw, FieldPath path) {
        var rejected = new ErrorReport();
        for (var alternative : descriptor.alternatives()) {
            var result = coerce(alternative, raw, path);
            if (result.isOk()) return result;
            rejected.addAll(result.errors());
        }
        var errors = ErrorReport.of(ValidationError.noUnionMatch(path, descriptor, raw));
        errors.addAll(rejected);
        return Result.failed(errors);
    }

    private Result coercePrimitive(TypeDescriptor.Primitive descriptor, JsonValue raw, FieldPath path, boolean lenient) {
        return switch (descriptor.kind()) {
            case ANY -> coerceAny(raw, path);
            case STRING -> {
                if (raw instanceof JsonString s) yield Result.ok(s.value());
                if (lenient && (raw instanceof JsonNumber || raw instanceof JsonBoolean)) yield Result.ok(raw.stringify());
                yield mismatch(descriptor, raw, path);
            }
            case BOOLEAN -> {
                if (raw instanceof JsonBoolean b) yield Result.ok(b.value());
                if (lenient && raw instanceof JsonString s) {
                    var text = s.value().trim().toLowerCase(Locale.ROOT);
                    if (text.equals("true")) yield Result.ok(Boolean.TRUE);
                    if (text.equals("false")) yield Result.ok(Boolean.FALSE);
                }
                yield mismatch(descriptor, raw, path);
            }
            case INTEGER, LONG -> coerceIntegral(descriptor, raw, path, lenient);
            case DOUBLE -> {
                Double d = null;
                if (raw instanceof JsonNumber n) d = n.value().doubleValue();
                else if (lenient) {
                    var decimal = decimalOf(raw);
                    if (decimal != null) d = decimal.doubleValue();
                }
                if (d == null) yield mismatch(descriptor, raw, path);
                yield Double.isFinite(d) ? Result.ok(d) : outOfRange(descriptor, raw, path);
            }
            case DECIMAL -> {
                var decimal = raw instanceof JsonNumber || lenient ? decimalOf(raw) : null;
                if (decimal != null) yield Result.ok(decimal);
                yield mismatch(descriptor, raw, path);
            }
        };
    }

    /**
     * Plain Java form of an untyped value. Walks the subtree under the same depth bound as typed values.
     */
    private Result coerceAny(JsonValue raw, FieldPath path) {
        if (path.depth() > options.getMaxDepth())
            return Result.failed(ValidationError.depthExceeded(path, TypeDescriptor.any(), raw, options.getMaxDepth()));
        if (raw instanceof JsonArray array) {
            var errors = new ErrorReport();
            var values = new ArrayList<>(array.value().size());
            for (int i = 0; i < array.value().size(); i++) {
                var element = coerceAny(array.value().get(i), path.index(i));
                if (element.isOk()) values.add(element.value());
                else errors.addAll(element.errors());
            }
            return errors.isEmpty() ? Result.ok(Collections.unmodifiableList(values)) : Result.failed(errors);
        }
        if (raw instanceof JsonObject object) {
            var errors = new ErrorReport();
            var values = new LinkedHashMap<String, Object>();
            for (var en : object.value().entrySet()) {
                var member = coerceAny(en.getValue(), path.key(en.getKey()));
                if (member.isOk()) values.put(en.getKey(), member.value());
                else errors.addAll(member.errors());
            }
            return errors.isEmpty() ? Result.ok(Collections.unmodifiableMap(values)) : Result.failed(errors);
        }
        return Result.ok(raw.toJava());
    }

    private Result coerceIntegral(TypeDescriptor.Primitive descriptor, JsonValue raw, FieldPath path, boolean lenient) {
        var decimal = raw instanceof JsonNumber || lenient ? decimalOf(raw) : null;
        if (decimal == null) return mismatch(descriptor, raw, path);
        // magnitude is checked on the decimal form; 1e30000000 must not become a BigInteger
        var stripped = decimal.stripTrailingZeros();
        if (stripped.scale() > 0)
            return Result.failed(ValidationError.typeMismatch(
                    path, descriptor, raw, "expected a whole number but got " + raw.stringify()));
        if (stripped.precision() - stripped.scale() > MAX_INTEGRAL_DIGITS) return outOfRange(descriptor, raw, path);
        var integral = stripped.toBigIntegerExact();
        boolean isInt = descriptor.kind() == TypeDescriptor.Kind.INTEGER;
        var min = isInt ? INT_MIN : LONG_MIN;
        var max = isInt ? INT_MAX : LONG_MAX;
        if (integral.compareTo(min) < 0 || integral.compareTo(max) > 0) return outOfRange(descriptor, raw, path);
        return Result.ok(isInt ? (Object) integral.intValue() : (Object) integral.longValue());
    }

    private static Result outOfRange(TypeDescriptor descriptor, JsonValue raw, FieldPath path) {
        return Result.failed(ValidationError.typeMismatch(
                path, descriptor, raw, raw.stringify() + " is out of range for " + descriptor.shortName()));
    }

    private static Result mismatch(TypeDescriptor descriptor, JsonValue raw, FieldPath path) {
        return Result.failed(ValidationError.typeMismatch(path, descriptor, raw));
    }

    /**
     * @return the exact decimal value of a number or numeric string, {@code null} if there is none
     */
    static @Nullable BigDecimal decimalOf(JsonValue raw) {
        if (raw instanceof JsonNumber n) {
            Number number = n.value();
            if (number instanceof BigDecimal bd) return bd;
            if (number instanceof BigInteger bi) return new BigDecimal(bi);
            if (number instanceof Double || number instanceof Float) {
                double d = number.doubleValue();
                return Double.isFinite(d) ? new BigDecimal(number.toString()) : null;
            }
            try {
                return new BigDecimal(number.toString());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        if (raw instanceof JsonString s) {
            try {
                return new BigDecimal(s.value().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
