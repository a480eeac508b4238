package com.unihousing.backend.modules.complaint.application;

import java.util.List;

import com.unihousing.backend.global.validation.RequestValidation;
import com.unihousing.backend.modules.complaint.domain.Complaint;
import com.unihousing.backend.modules.complaint.domain.ComplaintStatus;
import com.unihousing.backend.modules.complaint.domain.ComplaintType;
import com.unihousing.backend.modules.complaint.infrastructure.persistence.ComplaintRepository;
import com.unihousing.backend.modules.complaint.infrastructure.persistence.ComplaintSearchCondition;
import com.unihousing.backend.modules.complaint.presentation.dto.ComplaintResponse;
import com.unihousing.backend.modules.complaint.presentation.dto.CreateComplaintRequest;
import com.unihousing.backend.modules.student.application.StudentSupport;
import com.unihousing.backend.modules.student.domain.Student;
import com.unihousing.backend.modules.student.infrastructure.persistence.StudentRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ComplaintService {

    private static final Logger log = LoggerFactory.getLogger(ComplaintService.class);

    private final ComplaintRepository complaintRepository;
    private final StudentRepository studentRepository;

    public ComplaintService(ComplaintRepository complaintRepository, StudentRepository studentRepository) {
        this.complaintRepository = complaintRepository;
        this.studentRepository = studentRepository;
    }

    @Transactional(readOnly = true)
    public List<ComplaintResponse> getComplaints(Long studentId, String status, String type) {
        ComplaintSearchCondition condition = new ComplaintSearchCondition(
                studentId,
                RequestValidation.parseFilter(ComplaintStatus.class, status),
                RequestValidation.parseFilter(ComplaintType.class, type)
        );
        return complaintRepository.search(condition).stream()
                .map(ComplaintResponse::from)
                .toList();
    }

    @Transactional
    public ComplaintResponse createComplaint(Long studentId, CreateComplaintRequest request) {
        NewComplaint command = ComplaintRequestValidator.validate(request);
        Student student = StudentSupport.requireStudent(studentRepository, studentId);

        Complaint saved = complaintRepository.save(new Complaint(
                student,
                command.title(),
                command.description(),
                command.type(),
                command.secret(),
                command.recipient()
        ));
        log.info("Complaint {} filed by student {} ({})", saved.getId(), studentId, command.type().getCode());
        return ComplaintResponse.from(saved);
    }
}
