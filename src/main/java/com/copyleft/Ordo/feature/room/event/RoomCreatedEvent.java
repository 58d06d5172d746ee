package com.copyleft.Ordo.feature.room.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public class RoomCreatedEvent {
    private final String roomId;
}
