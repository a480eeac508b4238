package com.unihousing.backend.modules.student.application;

import com.unihousing.backend.global.error.ProblemException;
import com.unihousing.backend.modules.student.domain.Room;
import com.unihousing.backend.modules.student.domain.Student;
import com.unihousing.backend.modules.student.infrastructure.persistence.StudentRepository;

/**
 * Lookups shared by the student-scoped services.
 */
public final class StudentSupport {

    public static final String STUDENT_NOT_FOUND = "STUDENT_NOT_FOUND";
    public static final String NOT_ASSIGNED_TO_ROOM = "NOT_ASSIGNED_TO_ROOM";

    private StudentSupport() {
    }

    public static Student requireStudent(StudentRepository studentRepository, Long studentId) {
        return studentRepository.findById(studentId)
                .orElseThrow(() -> ProblemException.notFound(STUDENT_NOT_FOUND, "Student not found"));
    }

    public static Room requireAssignedRoom(StudentRepository studentRepository, Long studentId) {
        return studentRepository.findAssignedRoom(studentId)
                .orElseThrow(() -> ProblemException.notFound(NOT_ASSIGNED_TO_ROOM, "You are not assigned to a room"));
    }
}
