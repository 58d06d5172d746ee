package com.copyleft.Ordo.feature.room.dto;

import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@NoArgsConstructor
public class RoomRequest {
    // 방 생성용 (CREATE_ROOM)
    private String name;
    private List<String> options;

    // 방 조회/관리용 (GET_ROOM, GET_ADMIN_VIEW, START_VOTE, END_VOTE)
    private String roomId;
    private String adminSecret;
}
