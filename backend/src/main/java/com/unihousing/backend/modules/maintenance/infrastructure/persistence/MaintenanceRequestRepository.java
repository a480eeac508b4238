package com.unihousing.backend.modules.maintenance.infrastructure.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import com.unihousing.backend.modules.maintenance.domain.MaintenanceRequest;

public interface MaintenanceRequestRepository
        extends JpaRepository<MaintenanceRequest, Long>, MaintenanceRequestRepositoryCustom {
}
