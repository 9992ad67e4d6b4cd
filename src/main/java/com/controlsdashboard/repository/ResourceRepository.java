package com.controlsdashboard.repository;

import com.controlsdashboard.model.Resource;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface ResourceRepository extends JpaRepository<Resource, String> {

    /**
     * Inserts a resource, overwriting title, location and citation when the uuid already exists.
     */
    @Transactional
    @Modifying
    @Query(value = """
            insert into resources (uuid, title, location, citation)
            values (:uuid, :title, :location, :citation)
            on conflict (uuid) do update set
                title = excluded.title,
                location = excluded.location,
                citation = excluded.citation
            """, nativeQuery = true)
    int upsert(@Param("uuid") String uuid,
               @Param("title") String title,
               @Param("location") String location,
               @Param("citation") String citation);
}
