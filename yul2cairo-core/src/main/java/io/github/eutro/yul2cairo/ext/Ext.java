package io.github.eutro.yul2cairo.ext;

import org.jetbrains.annotations.NotNull;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A key under which a value of type {@code T} can be attached to an {@link ExtContainer},
 * such as an analysis result attached to a Yul node.
 * <p>
 * Exts are ordered by creation, which only matters for the iteration order
 * of {@link ExtHolder}'s backing map.
 *
 * @param <T> The type of the ext.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger(0);

    private final Class<? super T> type;
    private final int id = ID_COUNTER.getAndIncrement();
    private final String name;

    private Ext(Class<? super T> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Creates a new ext with the given name.
     * <p>
     * The class only needs to be a superclass of the value type, since
     * classes cannot carry generic arguments. It is kept for debugging.
     *
     * @param type The most specific superclass of the type of the ext.
     * @param name The name of the ext.
     * @param <T>  The type of the class.
     * @param <R>  The type of the ext.
     * @return The new ext.
     */
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return new Ext<>(type, name);
    }

    public Class<? super T> getType() {
        return type;
    }

    /**
     * Get the value of this ext in the given container.
     *
     * @param ec The container.
     * @return The value, if attached.
     * @see ExtContainer#getExt(Ext)
     */
    public Optional<T> getIn(ExtContainer ec) {
        return ec.getExt(this);
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + ": " + type.getName();
    }
}
