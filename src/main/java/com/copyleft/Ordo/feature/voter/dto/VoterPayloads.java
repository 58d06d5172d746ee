package com.copyleft.Ordo.feature.voter.dto;

import com.copyleft.Ordo.feature.room.dto.RoomPayloads;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

public class VoterPayloads {

    // 입장 결과 (voterSecret은 본인에게만 전달)
    @Getter
    @Builder
    public static class VoterJoined {
        private String roomId;
        private String voterId;
        private String voterSecret;
        private long voterCount;
    }

    @Getter
    @Builder
    public static class VoterView {
        private String voterId;
        private boolean approved;
        private List<String> ballot;
        private RoomPayloads.RoomInfo room;
    }

    @Getter
    @Builder
    public static class BallotAccepted {
        private String voterId;
        private List<String> ballot;
        private long voteCount;
    }
}
