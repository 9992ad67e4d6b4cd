package com.controlsdashboard.repository;

import com.controlsdashboard.model.Prop;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface PropRepository extends JpaRepository<Prop, String> {

    @Transactional
    @Modifying
    @Query(value = """
            insert into props (prop_id, control_id, name, value, ns)
            values (:propId, :controlId, :name, :value, :ns)
            on conflict (prop_id) do nothing
            """, nativeQuery = true)
    int insertIgnore(@Param("propId") String propId,
                     @Param("controlId") String controlId,
                     @Param("name") String name,
                     @Param("value") String value,
                     @Param("ns") String ns);

    List<Prop> findAllByControlId(String controlId);
}
