package com.copyleft.Ordo.domain.type;

public enum RoomStatus {
    OPEN,    // 투표자 입장 가능, 관리자가 시작 가능
    VOTING,  // 승인된 투표자만 투표 가능, 관리자가 종료 가능
    ENDED    // 집계 완료 (만료 시 삭제)
}
