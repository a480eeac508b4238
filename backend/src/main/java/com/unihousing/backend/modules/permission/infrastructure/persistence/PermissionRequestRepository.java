package com.unihousing.backend.modules.permission.infrastructure.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import com.unihousing.backend.modules.permission.domain.PermissionRequest;

public interface PermissionRequestRepository
        extends JpaRepository<PermissionRequest, Long>, PermissionRequestRepositoryCustom {

    long countByStudentId(Long studentId);
}
