package com.unihousing.backend.modules.student.infrastructure.persistence;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.unihousing.backend.modules.student.domain.Room;
import com.unihousing.backend.modules.student.domain.Student;

public interface StudentRepository extends JpaRepository<Student, Long> {

    @Query("""
            select s from Student s
              left join fetch s.room
             where s.id = :studentId
            """)
    Optional<Student> findProfileById(@Param("studentId") Long studentId);

    /**
     * Empty when the student does not exist or has no room.
     */
    @Query("select r from Student s join s.room r where s.id = :studentId")
    Optional<Room> findAssignedRoom(@Param("studentId") Long studentId);
}
