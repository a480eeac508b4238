package com.unihousing.backend.modules.permission.infrastructure.persistence;

import java.util.List;

import com.unihousing.backend.modules.permission.domain.PermissionRequest;

public interface PermissionRequestRepositoryCustom {

    List<PermissionRequest> search(PermissionSearchCondition condition);
}
