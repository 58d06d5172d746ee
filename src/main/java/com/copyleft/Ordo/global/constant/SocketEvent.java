package com.copyleft.Ordo.global.constant;

public enum SocketEvent {
    // 요청에 대한 1:1 응답
    ROOM_CREATED,
    ROOM_INFO,
    ADMIN_VIEW,
    VOTER_VIEW,
    JOIN_SUCCESS,
    APPROVE_SUCCESS,
    START_SUCCESS,
    BALLOT_ACCEPTED,
    END_SUCCESS,
    SUBSCRIBED,

    // 구독 스트림 (역할별 투영 결과)
    VOTER_JOINED,    // 관리자: 새 투표자 행 추가
    VOTER_COUNT,     // 참가자 수 갱신
    VOTER_APPROVED,  // 관리자: 투표자 행 갱신
    APPROVED,        // 투표자 본인: 대기 해제
    VOTE_STARTABLE,  // 관리자: 시작 버튼 활성화
    VOTE_STARTED,    // 관리자: 투표 진행 화면
    BALLOT_FORM,     // 승인된 투표자: 순위 입력 폼
    VOTE_SUBMITTED,  // 관리자: 투표 완료 표시
    VOTE_COUNT,      // 제출된 투표 수 갱신
    VOTE_ENDABLE,    // 관리자: 종료 버튼 활성화
    VOTE_RESULT,     // 집계 결과
    HEARTBEAT,

    ERROR_MESSAGE
}
