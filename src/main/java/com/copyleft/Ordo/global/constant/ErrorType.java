package com.copyleft.Ordo.global.constant;

public enum ErrorType {
    VALIDATION, // 입력값 오류
    NOT_FOUND,  // 없음, 상태 불일치, 비밀값 불일치
    CONFLICT,   // 투표 옵션 불일치 등
    INTERNAL    // 저장소 오류 등 (상세 내용은 로그에만)
}
