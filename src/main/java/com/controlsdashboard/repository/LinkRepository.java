package com.controlsdashboard.repository;

import com.controlsdashboard.model.Link;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface LinkRepository extends JpaRepository<Link, String> {

    @Transactional
    @Modifying
    @Query(value = """
            insert into links (link_id, control_id, href, rel, media_type)
            values (:linkId, :controlId, :href, :rel, :mediaType)
            on conflict (link_id) do nothing
            """, nativeQuery = true)
    int insertIgnore(@Param("linkId") String linkId,
                     @Param("controlId") String controlId,
                     @Param("href") String href,
                     @Param("rel") String rel,
                     @Param("mediaType") String mediaType);

    List<Link> findAllByControlId(String controlId);
}
