package com.unihousing.backend.modules.complaint.infrastructure.persistence;

import java.util.List;

import com.unihousing.backend.modules.complaint.domain.Complaint;

public interface ComplaintRepositoryCustom {

    List<Complaint> search(ComplaintSearchCondition condition);
}
