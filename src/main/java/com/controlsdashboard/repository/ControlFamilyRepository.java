package com.controlsdashboard.repository;

import com.controlsdashboard.model.ControlFamily;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface ControlFamilyRepository extends JpaRepository<ControlFamily, Long> {

    @Transactional
    @Modifying
    @Query(value = """
            insert into control_families (family_code, family_name, description, updated_at)
            values (:familyCode, :familyName, :description, now())
            on conflict (family_code) do nothing
            """, nativeQuery = true)
    int insertIgnore(@Param("familyCode") String familyCode,
                     @Param("familyName") String familyName,
                     @Param("description") String description);

    List<ControlFamily> findAllByOrderByFamilyCodeAsc();
}
