package com.controlsdashboard.repository;

import com.controlsdashboard.model.Baseline;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface BaselineRepository extends JpaRepository<Baseline, Integer> {
}
