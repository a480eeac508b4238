package com.unihousing.backend.modules.maintenance.infrastructure.persistence;

import java.util.List;

import com.unihousing.backend.modules.maintenance.domain.MaintenanceRequest;

public interface MaintenanceRequestRepositoryCustom {

    List<MaintenanceRequest> search(MaintenanceSearchCondition condition);
}
