package com.creditintel.backend.repository;

import com.creditintel.backend.model.ModelVersionEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ModelVersionEntryRepository extends JpaRepository<ModelVersionEntry, Long> {

    List<ModelVersionEntry> findAllByOrderByVersionIdAsc();
}
