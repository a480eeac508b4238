package com.unihousing.backend.modules.complaint.infrastructure.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import com.unihousing.backend.modules.complaint.domain.Complaint;

public interface ComplaintRepository extends JpaRepository<Complaint, Long>, ComplaintRepositoryCustom {

    long countByStudentId(Long studentId);
}
