package com.controlsdashboard.repository;

import com.controlsdashboard.model.ControlRelation;
import com.controlsdashboard.model.ControlRelationId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface ControlRelationRepository extends JpaRepository<ControlRelation, ControlRelationId> {

    @Transactional
    @Modifying
    @Query(value = """
            insert into control_relations (parent_control_id, child_control_id)
            values (:parentControlId, :childControlId)
            on conflict (parent_control_id, child_control_id) do nothing
            """, nativeQuery = true)
    int insertIgnore(@Param("parentControlId") String parentControlId,
                     @Param("childControlId") String childControlId);

    /**
     * Loads the enhancements nested under a control.
     */
    List<ControlRelation> findAllByParentControlIdOrderByChildControlIdAsc(String parentControlId);
}
