package com.copyleft.Ordo.feature.broadcast.dto;

import com.copyleft.Ordo.domain.vo.TallyEntry;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

public class BroadcastPayloads {

    // 관리자 화면의 투표자 행 갱신용
    @Getter
    @Builder
    public static class VoterRef {
        private String voterId;
        private boolean approved;
        private boolean voted;
    }

    @Getter
    @Builder
    public static class Count {
        private long count;
    }

    // 승인된 투표자에게 보내는 순위 입력 폼
    @Getter
    @Builder
    public static class BallotForm {
        private List<String> options;
    }

    @Getter
    @Builder
    public static class VoteResult {
        private List<TallyEntry> tally;
    }
}
