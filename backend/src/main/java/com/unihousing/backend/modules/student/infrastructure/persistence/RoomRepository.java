package com.unihousing.backend.modules.student.infrastructure.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import com.unihousing.backend.modules.student.domain.Room;

public interface RoomRepository extends JpaRepository<Room, Long> {
}
