package com.unihousing.backend.modules.clearance.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.unihousing.backend.global.error.ProblemException;
import com.unihousing.backend.modules.clearance.domain.ClearanceProcess;
import com.unihousing.backend.modules.clearance.infrastructure.persistence.ClearanceProcessRepository;
import com.unihousing.backend.modules.clearance.presentation.dto.ClearanceResponse;
import com.unihousing.backend.modules.student.application.StudentSupport;
import com.unihousing.backend.modules.student.domain.Student;
import com.unihousing.backend.modules.student.infrastructure.persistence.StudentRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ClearanceService {

    private static final Logger log = LoggerFactory.getLogger(ClearanceService.class);

    public static final String CLEARANCE_ALREADY_INITIATED = "CLEARANCE_ALREADY_INITIATED";
    private static final String UNIQUE_STUDENT_CONSTRAINT = "uq_clearance_process_student";

    private final ClearanceProcessRepository clearanceProcessRepository;
    private final StudentRepository studentRepository;
    private final Clock clock;

    public ClearanceService(
            ClearanceProcessRepository clearanceProcessRepository,
            StudentRepository studentRepository,
            Clock clock
    ) {
        this.clearanceProcessRepository = clearanceProcessRepository;
        this.studentRepository = studentRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public ClearanceResponse getClearance(Long studentId) {
        return clearanceProcessRepository.findByStudentId(studentId)
                .map(ClearanceResponse::from)
                .orElseGet(ClearanceResponse::notInitiated);
    }

    @Transactional
    public ClearanceResponse initiate(Long studentId) {
        if (clearanceProcessRepository.existsByStudentId(studentId)) {
            throw alreadyInitiated();
        }
        Student student = StudentSupport.requireStudent(studentRepository, studentId);

        try {
            ClearanceProcess saved = clearanceProcessRepository.saveAndFlush(
                    new ClearanceProcess(student, OffsetDateTime.now(clock)));
            log.info("Clearance initiated for student {}", studentId);
            return ClearanceResponse.from(saved);
        } catch (DataIntegrityViolationException ex) {
            if (isUniqueStudentViolation(ex)) {
                throw alreadyInitiated();
            }
            throw ex;
        }
    }

    private static ProblemException alreadyInitiated() {
        return ProblemException.conflict(CLEARANCE_ALREADY_INITIATED, "Clearance process already initiated");
    }

    private static boolean isUniqueStudentViolation(DataIntegrityViolationException ex) {
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = cause.getMessage();
        return message != null && message.contains(UNIQUE_STUDENT_CONSTRAINT);
    }
}
