package br.gc.stock.tracker.repositories;

import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * How one attribute of an incoming record is folded into an already stored record.
 *
 * @param <E> entity type
 */
@FunctionalInterface
public interface MergeRule<E> {

    /**
     * @return true if {@code existing} was changed
     */
    boolean merge(E existing, E incoming);

    /**
     * Copies the incoming value only when the stored one is blank and the incoming one is not.
     * A populated stored value is never overwritten.
     */
    static <E, V> MergeRule<E> fillIfBlank(Function<E, V> getter, BiConsumer<E, V> setter) {
        return (existing, incoming) -> {
            V current = getter.apply(existing);
            V candidate = getter.apply(incoming);
            if (isBlank(current) && !isBlank(candidate)) {
                setter.accept(existing, candidate);
                return true;
            }
            return false;
        };
    }

    private static boolean isBlank(Object value) {
        return value == null || (value instanceof CharSequence text && text.toString().isBlank());
    }
}
