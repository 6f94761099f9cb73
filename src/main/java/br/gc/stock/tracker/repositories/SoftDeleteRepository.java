package br.gc.stock.tracker.repositories;

import br.gc.stock.tracker.entities.BaseEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;

/**
 * Base repository of every tracked table.
 */
@NoRepositoryBean
public interface SoftDeleteRepository<E extends BaseEntity> extends JpaRepository<E, String>, JpaSpecificationExecutor<E> {

    /**
     * Marks a live row as deleted.
     *
     * @return number of rows affected; 0 when the row is missing or already deleted
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE #{#entityName} e SET e.deletedAt = :deletedAt, e.updatedAt = :deletedAt " +
           "WHERE e.id = :id AND e.deletedAt IS NULL")
    int softDeleteById(@Param("id") String id, @Param("deletedAt") LocalDateTime deletedAt);

    /**
     * Physically removes a row, live or soft-deleted.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM #{#entityName} e WHERE e.id = :id")
    int hardDeleteById(@Param("id") String id);
}
