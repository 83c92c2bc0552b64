package com.creditintel.backend.repository;

import com.creditintel.backend.model.ModelPerformance;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ModelPerformanceRepository extends JpaRepository<ModelPerformance, Long> {

    List<ModelPerformance> findByOrderByIdDesc(Pageable pageable);

    List<ModelPerformance> findByModelVersionOrderByIdAsc(Long modelVersion);
}
