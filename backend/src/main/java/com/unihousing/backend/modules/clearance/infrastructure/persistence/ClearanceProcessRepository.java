package com.unihousing.backend.modules.clearance.infrastructure.persistence;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;

import com.unihousing.backend.modules.clearance.domain.ClearanceProcess;

public interface ClearanceProcessRepository extends JpaRepository<ClearanceProcess, Long> {

    Optional<ClearanceProcess> findByStudentId(Long studentId);

    boolean existsByStudentId(Long studentId);
}
