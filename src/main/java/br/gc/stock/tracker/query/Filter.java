package br.gc.stock.tracker.query;

import br.gc.stock.tracker.entities.BaseEntity;
import jakarta.persistence.criteria.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Conjunction of per-field conditions over one entity type.
 * <p>
 * Every filter also requires {@code deleted_at IS NULL}; there is no way to opt out of that
 * through a filter.
 *
 * <pre>{@code
 * Filter<HistoricalEntry> filter = Filter.where(HistoricalEntryField.STOCK_ID, Condition.equalTo(stockId))
 *         .and(HistoricalEntryField.TRADING_DATE, Condition.between(start, end));
 * }</pre>
 *
 * @param <E> entity being filtered
 */
@Slf4j
public final class Filter<E extends BaseEntity> {

    private final List<Criterion<E>> criteria = new ArrayList<>();

    private Filter() {
    }

    /**
     * Matches every live row.
     */
    public static <E extends BaseEntity> Filter<E> all() {
        return new Filter<>();
    }

    public static <E extends BaseEntity> Filter<E> where(EntityField<E> field, Condition condition) {
        return new Filter<E>().and(field, condition);
    }

    /**
     * Shorthand for an equality condition.
     */
    public static <E extends BaseEntity> Filter<E> where(EntityField<E> field, Object value) {
        return where(field, Condition.equalTo(value));
    }

    public static <E extends BaseEntity> Filter<E> byId(String id) {
        EntityField<E> idField = () -> BaseEntity.ID;
        return where(idField, Condition.equalTo(id));
    }

    public Filter<E> and(EntityField<E> field, Condition condition) {
        criteria.add(new Criterion<>(field, condition));
        return this;
    }

    public Filter<E> and(EntityField<E> field, Object value) {
        return and(field, Condition.equalTo(value));
    }

    /**
     * Adds a condition on a field named by the caller, typically a request parameter.
     * Names the entity does not have are ignored, so optional filters can be passed through
     * unchecked.
     */
    public <F extends Enum<F> & EntityField<E>> Filter<E> andIfKnown(Class<F> fieldType, String name,
                                                                     Condition condition) {
        EntityField.lookup(fieldType, name).ifPresentOrElse(
                field -> and(field, condition),
                () -> log.debug("Ignoring filter on unknown field '{}' of {}", name, fieldType.getSimpleName()));
        return this;
    }

    public List<Criterion<E>> criteria() {
        return Collections.unmodifiableList(criteria);
    }

    public Specification<E> toSpecification() {
        List<Criterion<E>> snapshot = List.copyOf(criteria);
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>(snapshot.size() + 1);
            predicates.add(cb.isNull(root.get(BaseEntity.DELETED_AT)));
            for (Criterion<E> criterion : snapshot) {
                predicates.add(criterion.condition().toPredicate(cb, root.get(criterion.field().attribute())));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    public record Criterion<E>(EntityField<E> field, Condition condition) {
    }
}
