package br.gc.stock.tracker.query;

import org.springframework.data.domain.Sort;

/**
 * Ordering of a filtered query on a single field.
 */
public final class OrderBy<E> {

    private static final OrderBy<?> UNSORTED = new OrderBy<>(null, Sort.Direction.ASC);

    private final EntityField<E> field;
    private final Sort.Direction direction;

    private OrderBy(EntityField<E> field, Sort.Direction direction) {
        this.field = field;
        this.direction = direction;
    }

    public static <E> OrderBy<E> asc(EntityField<E> field) {
        return new OrderBy<>(field, Sort.Direction.ASC);
    }

    public static <E> OrderBy<E> desc(EntityField<E> field) {
        return new OrderBy<>(field, Sort.Direction.DESC);
    }

    @SuppressWarnings("unchecked")
    public static <E> OrderBy<E> unsorted() {
        return (OrderBy<E>) UNSORTED;
    }

    /**
     * Ordering on a caller-named field. An unknown or missing name yields {@link #unsorted()}.
     */
    public static <E, F extends Enum<F> & EntityField<E>> OrderBy<E> parse(Class<F> fieldType, String name,
                                                                          boolean descending) {
        return EntityField.lookup(fieldType, name)
                .map(field -> descending ? OrderBy.<E>desc(field) : OrderBy.<E>asc(field))
                .orElseGet(OrderBy::unsorted);
    }

    public boolean isSorted() {
        return field != null;
    }

    public Sort toSort() {
        return field == null ? Sort.unsorted() : Sort.by(direction, field.attribute());
    }
}
