package com.unihousing.backend.modules.student.presentation.dto;

import com.unihousing.backend.modules.student.domain.Room;

public record RoomResponse(Long id, String roomNumber, String building, int floor, int capacity) {

    public static RoomResponse from(Room room) {
        if (room == null) {
            return null;
        }
        return new RoomResponse(room.getId(), room.getRoomNumber(), room.getBuilding(), room.getFloor(), room.getCapacity());
    }
}
