package com.unihousing.backend.modules.student.application;

import com.unihousing.backend.global.error.ProblemException;
import com.unihousing.backend.modules.student.infrastructure.persistence.StudentRepository;
import com.unihousing.backend.modules.student.presentation.dto.StudentProfileResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class StudentProfileService {

    private final StudentRepository studentRepository;

    public StudentProfileService(StudentRepository studentRepository) {
        this.studentRepository = studentRepository;
    }

    @Transactional(readOnly = true)
    public StudentProfileResponse getProfile(Long studentId) {
        return studentRepository.findProfileById(studentId)
                .map(StudentProfileResponse::from)
                .orElseThrow(() -> ProblemException.notFound(StudentSupport.STUDENT_NOT_FOUND, "Student not found"));
    }
}
