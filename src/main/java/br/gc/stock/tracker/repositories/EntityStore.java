package br.gc.stock.tracker.repositories;

import br.gc.stock.tracker.entities.BaseEntity;
import br.gc.stock.tracker.exceptions.StorageException;
import br.gc.stock.tracker.query.Filter;
import br.gc.stock.tracker.query.OrderBy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * CRUD and bulk operations over one entity type, built on {@link Filter}.
 *
 * <h3>Contract:</h3>
 * <ul>
 *   <li>Reads never return soft-deleted rows, {@link #findById} included</li>
 *   <li>Misses are reported as {@link Optional#empty()} or {@code false}, never thrown</li>
 *   <li>Store failures surface as {@link StorageException} and are not retried here</li>
 * </ul>
 *
 * @param <E> entity handled by this store
 */
@Slf4j
public abstract class EntityStore<E extends BaseEntity> {

    protected final SoftDeleteRepository<E> repository;
    private final String entityName;

    protected EntityStore(SoftDeleteRepository<E> repository, String entityName) {
        this.repository = repository;
        this.entityName = entityName;
    }

    /**
     * Inserts one entity in its own transaction.
     *
     * @throws StorageException with kind CONSTRAINT_VIOLATION when required attributes are missing
     */
    @Transactional
    public E create(E entity) {
        requireComplete(entity);
        return execute("create " + entityName, () -> repository.saveAndFlush(entity));
    }

    /**
     * Inserts all entities as one batch; either all rows are written or none.
     */
    @Transactional
    public List<E> createMany(List<E> entities) {
        if (entities.isEmpty()) {
            return List.of();
        }
        entities.forEach(this::requireComplete);
        return execute("create " + entities.size() + " " + entityName, () -> {
            List<E> saved = repository.saveAll(entities);
            repository.flush();
            return saved;
        });
    }

    @Transactional(readOnly = true)
    public Optional<E> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return findOneBy(Filter.byId(id));
    }

    @Transactional(readOnly = true)
    public List<E> findAll() {
        return findBy(Filter.all());
    }

    @Transactional(readOnly = true)
    public List<E> findBy(Filter<E> filter) {
        return findBy(filter, OrderBy.unsorted());
    }

    @Transactional(readOnly = true)
    public List<E> findBy(Filter<E> filter, OrderBy<E> order) {
        return execute("query " + entityName, () -> repository.findAll(filter.toSpecification(), order.toSort()));
    }

    /**
     * First match of the filter, in no particular order.
     */
    @Transactional(readOnly = true)
    public Optional<E> findOneBy(Filter<E> filter) {
        return findOneBy(filter, OrderBy.unsorted());
    }

    @Transactional(readOnly = true)
    public Optional<E> findOneBy(Filter<E> filter, OrderBy<E> order) {
        return execute("query " + entityName, () -> repository
                .findAll(filter.toSpecification(), PageRequest.of(0, 1, order.toSort()))
                .stream()
                .findFirst());
    }

    @Transactional(readOnly = true)
    public long count(Filter<E> filter) {
        return execute("count " + entityName, () -> repository.count(filter.toSpecification()));
    }

    @Transactional(readOnly = true)
    public boolean exists(Filter<E> filter) {
        return count(filter) > 0;
    }

    /**
     * Applies {@code changes} to the live entity and writes it back. The returned entity carries
     * the refreshed {@code updatedAt}.
     *
     * @return the updated entity, or empty when no live entity has this id
     */
    @Transactional
    public Optional<E> update(String id, Consumer<? super E> changes) {
        Optional<E> found = findById(id);
        if (found.isEmpty()) {
            log.debug("No live {} with id {} to update", entityName, id);
            return Optional.empty();
        }
        E entity = found.get();
        changes.accept(entity);
        requireComplete(entity);
        return Optional.of(execute("update " + entityName, () -> repository.saveAndFlush(entity)));
    }

    /**
     * Sets {@code deleted_at} on a live row.
     *
     * @return true if a row was marked; false when it is missing or already deleted
     */
    @Transactional
    public boolean softDelete(String id) {
        if (id == null) {
            return false;
        }
        int affected = execute("soft delete " + entityName,
                () -> repository.softDeleteById(id, LocalDateTime.now()));
        return affected > 0;
    }

    /**
     * Physically removes the row. Not reversible; prefer {@link #softDelete}.
     */
    @Transactional
    public boolean delete(String id) {
        if (id == null) {
            return false;
        }
        int affected = execute("delete " + entityName, () -> repository.hardDeleteById(id));
        if (affected > 0) {
            log.info("Physically deleted {} {}", entityName, id);
        }
        return affected > 0;
    }

    protected String entityName() {
        return entityName;
    }

    protected void requireComplete(E entity) {
        List<String> missing = entity.missingRequiredAttributes();
        if (!missing.isEmpty()) {
            throw StorageException.constraintViolation(
                    "Cannot store " + entityName + ": missing required attributes " + missing);
        }
    }

    protected <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataIntegrityViolationException e) {
            log.error("Constraint violation on {}: {}", operation, e.getMostSpecificCause().getMessage());
            throw StorageException.constraintViolation("Constraint violation on " + operation, e);
        } catch (DataAccessException e) {
            log.error("Storage failure on {}", operation, e);
            throw StorageException.unavailable("Storage failure on " + operation, e);
        }
    }
}
