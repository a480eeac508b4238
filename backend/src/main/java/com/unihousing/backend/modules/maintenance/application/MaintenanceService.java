package com.unihousing.backend.modules.maintenance.application;

import java.util.List;

import com.unihousing.backend.global.validation.RequestValidation;
import com.unihousing.backend.modules.maintenance.domain.MaintenanceCategory;
import com.unihousing.backend.modules.maintenance.domain.MaintenanceRequest;
import com.unihousing.backend.modules.maintenance.domain.MaintenanceStatus;
import com.unihousing.backend.modules.maintenance.infrastructure.persistence.MaintenanceRequestRepository;
import com.unihousing.backend.modules.maintenance.infrastructure.persistence.MaintenanceSearchCondition;
import com.unihousing.backend.modules.maintenance.presentation.dto.CreateMaintenanceRequest;
import com.unihousing.backend.modules.maintenance.presentation.dto.MaintenanceRequestResponse;
import com.unihousing.backend.modules.student.application.StudentSupport;
import com.unihousing.backend.modules.student.domain.Room;
import com.unihousing.backend.modules.student.domain.Student;
import com.unihousing.backend.modules.student.infrastructure.persistence.StudentRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class MaintenanceService {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceService.class);

    private final MaintenanceRequestRepository maintenanceRequestRepository;
    private final StudentRepository studentRepository;

    public MaintenanceService(MaintenanceRequestRepository maintenanceRequestRepository, StudentRepository studentRepository) {
        this.maintenanceRequestRepository = maintenanceRequestRepository;
        this.studentRepository = studentRepository;
    }

    /**
     * Every request filed for the caller's current room, whoever filed it.
     */
    @Transactional(readOnly = true)
    public List<MaintenanceRequestResponse> getRequests(Long studentId, String status, String category) {
        Room room = StudentSupport.requireAssignedRoom(studentRepository, studentId);
        MaintenanceSearchCondition condition = new MaintenanceSearchCondition(
                room.getId(),
                RequestValidation.parseFilter(MaintenanceStatus.class, status),
                RequestValidation.parseFilter(MaintenanceCategory.class, category)
        );
        return maintenanceRequestRepository.search(condition).stream()
                .map(MaintenanceRequestResponse::from)
                .toList();
    }

    @Transactional
    public MaintenanceRequestResponse createRequest(Long studentId, CreateMaintenanceRequest request) {
        NewMaintenanceRequest command = MaintenanceRequestValidator.validate(request);
        Room room = StudentSupport.requireAssignedRoom(studentRepository, studentId);
        Student student = studentRepository.getReferenceById(studentId);

        MaintenanceRequest saved = maintenanceRequestRepository.save(
                new MaintenanceRequest(student, room, command.category(), command.description()));
        log.info("Maintenance request {} opened for room {} by student {}", saved.getId(), room.getId(), studentId);
        return MaintenanceRequestResponse.from(saved);
    }
}
