package com.controlsdashboard.repository;

import com.controlsdashboard.model.Part;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface PartRepository extends JpaRepository<Part, String> {

    @Transactional
    @Modifying
    @Query(value = """
            insert into parts (part_id, control_id, name, prose, "order")
            values (:partId, :controlId, :name, :prose, :order)
            on conflict (part_id) do nothing
            """, nativeQuery = true)
    int insertIgnore(@Param("partId") String partId,
                     @Param("controlId") String controlId,
                     @Param("name") String name,
                     @Param("prose") String prose,
                     @Param("order") Integer order);

    List<Part> findAllByControlId(String controlId);
}
