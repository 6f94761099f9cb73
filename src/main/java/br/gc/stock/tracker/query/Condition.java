package br.gc.stock.tracker.query;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * What a single attribute must satisfy. The set of variants is closed; build them through the
 * static factories.
 */
public interface Condition {

    Predicate toPredicate(CriteriaBuilder cb, Path<?> path);

    static Condition equalTo(Object value) {
        return new Equals(value);
    }

    static Condition notEqualTo(Object value) {
        return new NotEquals(value);
    }

    static Condition in(Collection<?> values) {
        return new In(List.copyOf(values));
    }

    static Condition notIn(Collection<?> values) {
        return new NotIn(List.copyOf(values));
    }

    static Condition isNull() {
        return new IsNull();
    }

    static Condition isNotNull() {
        return new IsNotNull();
    }

    static <T extends Comparable<? super T>> Condition atLeast(T bound) {
        return new GreaterThanOrEqual(Objects.requireNonNull(bound, "bound"));
    }

    static <T extends Comparable<? super T>> Condition atMost(T bound) {
        return new LessThanOrEqual(Objects.requireNonNull(bound, "bound"));
    }

    static <T extends Comparable<? super T>> Condition between(T lower, T upper) {
        return new Between(Objects.requireNonNull(lower, "lower"), Objects.requireNonNull(upper, "upper"));
    }

    /**
     * Equality; a null value means IS NULL.
     */
    record Equals(Object value) implements Condition {
        @Override
        public Predicate toPredicate(CriteriaBuilder cb, Path<?> path) {
            return value == null ? cb.isNull(path) : cb.equal(path, value);
        }
    }

    /**
     * Inequality; a null value means IS NOT NULL.
     */
    record NotEquals(Object value) implements Condition {
        @Override
        public Predicate toPredicate(CriteriaBuilder cb, Path<?> path) {
            return value == null ? cb.isNotNull(path) : cb.notEqual(path, value);
        }
    }

    /**
     * Membership. An empty set matches nothing.
     */
    record In(List<?> values) implements Condition {
        @Override
        public Predicate toPredicate(CriteriaBuilder cb, Path<?> path) {
            return values.isEmpty() ? cb.disjunction() : path.in(values);
        }
    }

    /**
     * Exclusion. An empty set matches everything; rows with a null attribute never match.
     */
    record NotIn(List<?> values) implements Condition {
        @Override
        public Predicate toPredicate(CriteriaBuilder cb, Path<?> path) {
            return values.isEmpty() ? cb.conjunction() : cb.not(path.in(values));
        }
    }

    record IsNull() implements Condition {
        @Override
        public Predicate toPredicate(CriteriaBuilder cb, Path<?> path) {
            return cb.isNull(path);
        }
    }

    record IsNotNull() implements Condition {
        @Override
        public Predicate toPredicate(CriteriaBuilder cb, Path<?> path) {
            return cb.isNotNull(path);
        }
    }

    record GreaterThanOrEqual(Comparable<?> bound) implements Condition {
        @Override
        @SuppressWarnings({"unchecked", "rawtypes"})
        public Predicate toPredicate(CriteriaBuilder cb, Path<?> path) {
            return cb.greaterThanOrEqualTo((Expression) path, (Comparable) bound);
        }
    }

    record LessThanOrEqual(Comparable<?> bound) implements Condition {
        @Override
        @SuppressWarnings({"unchecked", "rawtypes"})
        public Predicate toPredicate(CriteriaBuilder cb, Path<?> path) {
            return cb.lessThanOrEqualTo((Expression) path, (Comparable) bound);
        }
    }

    /**
     * Inclusive range.
     */
    record Between(Comparable<?> lower, Comparable<?> upper) implements Condition {
        @Override
        @SuppressWarnings({"unchecked", "rawtypes"})
        public Predicate toPredicate(CriteriaBuilder cb, Path<?> path) {
            return cb.between((Expression) path, (Comparable) lower, (Comparable) upper);
        }
    }
}
