package com.unihousing.backend.modules.student.presentation.dto;

import java.time.OffsetDateTime;

import com.unihousing.backend.modules.student.domain.Student;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Profile view. {@code room} is serialized as {@code null} for students without a room.
 */
public record StudentProfileResponse(
        Long id,
        String nationalId,
        String fullName,
        String studentCode,
        String college,
        Integer academicYear,
        String photoUrl,
        String housingType,
        @JsonProperty("is_suspended") boolean isSuspended,
        RoomResponse room,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static StudentProfileResponse from(Student student) {
        return new StudentProfileResponse(
                student.getId(),
                student.getNationalId(),
                student.getFullName(),
                student.getStudentCode(),
                student.getCollege(),
                student.getAcademicYear(),
                student.getPhotoUrl(),
                student.getHousingType(),
                student.isSuspended(),
                RoomResponse.from(student.getRoom()),
                student.getCreatedAt(),
                student.getUpdatedAt()
        );
    }
}
