package com.controlsdashboard.repository;

import com.controlsdashboard.model.Parameter;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface ParameterRepository extends JpaRepository<Parameter, String> {

    @Transactional
    @Modifying
    @Query(value = """
            insert into parameters (parameter_id, control_id, label, guideline)
            values (:parameterId, :controlId, :label, :guideline)
            on conflict (parameter_id) do nothing
            """, nativeQuery = true)
    int insertIgnore(@Param("parameterId") String parameterId,
                     @Param("controlId") String controlId,
                     @Param("label") String label,
                     @Param("guideline") String guideline);

    /**
     * Loads the parameters owned by a control.
     */
    List<Parameter> findAllByControlIdOrderByParameterIdAsc(String controlId);
}
