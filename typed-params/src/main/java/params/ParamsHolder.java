package params;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the current params instance of one schema, e.g. the params of the publication currently being processed.
 *
 * <p> A holder is created from a valid document, so it always holds an instance. {@link #replace(Object)} builds
 * the new instance completely before swapping it in: readers see either the old or the new instance, never a mix,
 * and a failed replace leaves the old instance in place. Replacements are serialized; reads take no lock.
 *
 * @param <T> instance type
 * @since 0.1.0
 */
public final class ParamsHolder<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ParamsHolder.class);

    private final Schema<T> schema;
    private final Params.Options options;
    private final AtomicReference<T> current;
    private final ReentrantLock replaceLock = new ReentrantLock();

    private ParamsHolder(Schema<T> schema, Params.Options options, T initial) {
        this.schema = schema;
        this.options = options;
        this.current = new AtomicReference<>(initial);
    }

    /**
     * @throws Params.ValidationException if {@code raw} does not satisfy the schema
     */
    public static <T> ParamsHolder<T> of(Schema<T> schema, @Nullable Object raw) {
        return of(schema, raw, Params.options());
    }

    public static <T> ParamsHolder<T> of(Schema<T> schema, @Nullable Object raw, Params.Options options) {
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(options, "options");
        return new ParamsHolder<>(schema, options, Params.construct(schema, raw, options));
    }

    public static <T> ParamsHolder<T> load(Schema<T> schema, Path file) {
        return load(schema, file, Params.options());
    }

    public static <T> ParamsHolder<T> load(Schema<T> schema, Path file, Params.Options options) {
        return of(schema, Params.read(file, options), options);
    }

    /**
     * @return the instance currently held
     */
    public T get() {
        return current.get();
    }

    /**
     * Read several values from one consistent instance, even while a replace is in progress.
     */
    public <R> R read(Function<? super T, ? extends R> reader) {
        return reader.apply(current.get());
    }

    public Schema<T> schema() {
        return schema;
    }

    /**
     * Build a new instance from {@code raw} against the holder's schema and swap it in.
     *
     * @throws Params.ValidationException if {@code raw} does not satisfy the schema; the held instance is unchanged
     */
    public void replace(@Nullable Object raw) {
        replaceLock.lock();
        try {
            T next;
            try {
                next = Params.construct(schema, raw, options);
            } catch (Params.ValidationException e) {
                LOGGER.warn("Rejected new {} params, keeping the current ones: {} error(s)", schema.name(), e.getErrors().size());
                throw e;
            }
            current.set(next);
            LOGGER.info("Replaced {} params", schema.name());
        } finally {
            replaceLock.unlock();
        }
    }

    /**
     * Read a params file and {@link #replace(Object)} with its contents.
     */
    public void replace(Path file) {
        replace(Params.read(file, options));
    }

    @Override
    public String toString() {
        return "ParamsHolder{" + schema.name() + "=" + current.get() + "}";
    }
}
