package com.copyleft.Ordo.feature.room.dto;

import com.copyleft.Ordo.domain.type.RoomStatus;
import com.copyleft.Ordo.domain.vo.TallyEntry;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

public class RoomPayloads {

    // 방 생성 결과 (adminSecret은 생성자에게만 전달)
    @Getter
    @Builder
    public static class RoomCreated {
        private String roomId;
        private String adminSecret;
        private String name;
        private List<String> options;
        private RoomStatus status;
    }

    // 공개 방 정보 (입장 화면 등)
    @Getter
    @Builder
    public static class RoomInfo {
        private String roomId;
        private String name;
        private List<String> options;
        private RoomStatus status;
        private long voterCount;
        private long voteCount;
    }

    @Getter
    @Builder
    public static class AdminView {
        private RoomInfo room;
        private List<VoterRow> voters;
    }

    @Getter
    @Builder
    public static class VoterRow {
        private String voterId;
        private boolean approved;
        private boolean voted;
    }

    @Getter
    @Builder
    public static class TallyResult {
        private String roomId;
        private List<TallyEntry> tally;
    }
}
