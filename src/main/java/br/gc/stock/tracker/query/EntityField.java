package br.gc.stock.tracker.query;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * A filterable attribute of entity {@code E}. Implemented by one enum per entity, so a filter
 * can only name attributes that exist.
 *
 * @param <E> entity the attribute belongs to
 */
@FunctionalInterface
public interface EntityField<E> {

    /**
     * JPA attribute name, as used in {@code root.get(...)}.
     */
    String attribute();

    /**
     * Resolves a request-supplied name (either {@code url_news} or {@code urlNews} style) to a
     * field of the given enum.
     *
     * @return the field, or empty when the enum has no such attribute
     */
    static <E, F extends Enum<F> & EntityField<E>> Optional<F> lookup(Class<F> fieldType, String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.replace("_", "").toLowerCase(Locale.ROOT);
        return Arrays.stream(fieldType.getEnumConstants())
                .filter(field -> field.attribute().toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst();
    }
}
