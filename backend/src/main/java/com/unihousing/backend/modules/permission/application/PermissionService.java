package com.unihousing.backend.modules.permission.application;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

import com.unihousing.backend.global.validation.RequestValidation;
import com.unihousing.backend.modules.permission.domain.PermissionRequest;
import com.unihousing.backend.modules.permission.domain.PermissionStatus;
import com.unihousing.backend.modules.permission.domain.PermissionType;
import com.unihousing.backend.modules.permission.infrastructure.persistence.PermissionRequestRepository;
import com.unihousing.backend.modules.permission.infrastructure.persistence.PermissionSearchCondition;
import com.unihousing.backend.modules.permission.presentation.dto.CreatePermissionRequest;
import com.unihousing.backend.modules.permission.presentation.dto.PermissionRequestResponse;
import com.unihousing.backend.modules.student.application.StudentSupport;
import com.unihousing.backend.modules.student.domain.Student;
import com.unihousing.backend.modules.student.infrastructure.persistence.StudentRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PermissionService {

    private static final Logger log = LoggerFactory.getLogger(PermissionService.class);

    private final PermissionRequestRepository permissionRequestRepository;
    private final StudentRepository studentRepository;
    private final Clock clock;

    public PermissionService(
            PermissionRequestRepository permissionRequestRepository,
            StudentRepository studentRepository,
            Clock clock
    ) {
        this.permissionRequestRepository = permissionRequestRepository;
        this.studentRepository = studentRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<PermissionRequestResponse> getPermissions(Long studentId, String status, String type) {
        PermissionSearchCondition condition = new PermissionSearchCondition(
                studentId,
                RequestValidation.parseFilter(PermissionStatus.class, status),
                RequestValidation.parseFilter(PermissionType.class, type)
        );
        return permissionRequestRepository.search(condition).stream()
                .map(PermissionRequestResponse::from)
                .toList();
    }

    @Transactional
    public PermissionRequestResponse createPermission(Long studentId, CreatePermissionRequest request) {
        NewPermissionRequest command = PermissionRequestValidator.validate(request, LocalDate.now(clock));
        Student student = StudentSupport.requireStudent(studentRepository, studentId);

        PermissionRequest saved = permissionRequestRepository.save(new PermissionRequest(
                student,
                command.type(),
                command.startDate(),
                command.endDate(),
                command.reason()
        ));
        log.info("Permission {} ({}) requested by student {} for {}..{}", saved.getId(), command.type().getCode(),
                studentId, command.startDate(), command.endDate());
        return PermissionRequestResponse.from(saved);
    }
}
