package com.copyleft.Ordo.global.constant;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum ErrorCode {

    EMPTY_ROOM_NAME(ErrorType.VALIDATION, "방 이름을 입력해주세요."),
    EMPTY_OPTIONS(ErrorType.VALIDATION, "투표 항목이 최소 1개 필요합니다."),
    EMPTY_OPTION(ErrorType.VALIDATION, "비어 있는 투표 항목이 있습니다."),
    INVALID_REQUEST(ErrorType.VALIDATION, "잘못된 요청입니다."),

    // 비밀값 불일치도 여기로 보고한다 (존재 여부를 노출하지 않기 위해)
    ROOM_NOT_FOUND(ErrorType.NOT_FOUND, "존재하지 않거나 진행할 수 없는 방입니다."),
    VOTER_NOT_FOUND(ErrorType.NOT_FOUND, "존재하지 않는 투표자입니다."),

    UNKNOWN_OPTIONS(ErrorType.CONFLICT, "투표 항목이 방의 항목과 일치하지 않습니다."),
    VOTER_NOT_APPROVED(ErrorType.CONFLICT, "아직 승인되지 않은 투표자입니다."),

    UNKNOWN_ERROR(ErrorType.INTERNAL, "알 수 없는 오류가 발생했습니다.");

    private final ErrorType type;
    private final String message;
}
