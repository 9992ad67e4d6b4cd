package com.controlsdashboard.repository;

import com.controlsdashboard.model.Control;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface ControlRepository extends JpaRepository<Control, String> {

    /**
     * Inserts a control unless one with the same id already exists.
     *
     * @return 1 when a row was written, 0 when the id was already present
     */
    @Transactional
    @Modifying
    @Query(value = """
            insert into controls (control_id, catalog_id, class, title, label, statement)
            values (:controlId, :catalogId, :controlClass, :title, :label, :statement)
            on conflict (control_id) do nothing
            """, nativeQuery = true)
    int insertIgnore(@Param("controlId") String controlId,
                     @Param("catalogId") String catalogId,
                     @Param("controlClass") String controlClass,
                     @Param("title") String title,
                     @Param("label") String label,
                     @Param("statement") String statement);
}
