package com.controlsdashboard.repository;

import com.controlsdashboard.model.BaselineControl;
import com.controlsdashboard.model.BaselineControlId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface BaselineControlRepository extends JpaRepository<BaselineControl, BaselineControlId> {

    @Transactional
    @Modifying
    @Query(value = """
            insert into baseline_controls (baseline_id, control_id)
            values (:baselineId, :controlId)
            on conflict (baseline_id, control_id) do nothing
            """, nativeQuery = true)
    int insertIgnore(@Param("baselineId") Integer baselineId,
                     @Param("controlId") String controlId);

    List<BaselineControl> findAllByBaselineIdOrderByControlIdAsc(Integer baselineId);
}
