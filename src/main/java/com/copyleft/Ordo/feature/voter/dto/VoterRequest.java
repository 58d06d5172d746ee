package com.copyleft.Ordo.feature.voter.dto;

import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@NoArgsConstructor
public class VoterRequest {
    // 입장용 (JOIN_ROOM)
    private String roomId;

    // 본인 확인용 (SUBMIT_BALLOT, GET_VOTER_VIEW)
    private String voterId;
    private String voterSecret;

    // 승인용 (APPROVE_VOTER)
    private String adminSecret;

    // 순위대로 나열한 전체 항목
    private List<String> ballot;
}
