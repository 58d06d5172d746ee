package com.copyleft.Ordo.feature.broadcast;

import com.copyleft.Ordo.domain.vo.TallyEntry;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.List;
import java.util.Set;

/**
 * 방 채널로 흘러가는 휘발성 이벤트. 저장하지 않는다.
 * 역할별 투영에 필요한 값만 담는다.
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class RoomEvent {

    private final Type type;
    private final String voterId;
    private final long count;
    private final List<String> options;
    private final Set<String> approvedVoterIds;
    private final List<TallyEntry> tally;

    public enum Type {
        NEW_VOTER,        // 투표자 입장
        NEW_VOTER_COUNT,  // 입장 인원 수
        VOTER_APPROVED,   // 투표자 승인
        VOTE_STARTABLE,   // 승인 인원 0 -> 1
        VOTE_STARTED,     // 투표 시작
        NEW_VOTE,         // 투표 제출
        NEW_VOTE_COUNT,   // 제출된 투표 수
        VOTE_ENDABLE,     // 제출 수 0 -> 1
        VOTE_ENDED        // 투표 종료 및 집계
    }

    public static RoomEvent newVoter(String voterId) {
        return new RoomEvent(Type.NEW_VOTER, voterId, 0, List.of(), Set.of(), List.of());
    }

    public static RoomEvent newVoterCount(long count) {
        return new RoomEvent(Type.NEW_VOTER_COUNT, null, count, List.of(), Set.of(), List.of());
    }

    public static RoomEvent voterApproved(String voterId) {
        return new RoomEvent(Type.VOTER_APPROVED, voterId, 0, List.of(), Set.of(), List.of());
    }

    public static RoomEvent voteStartable() {
        return new RoomEvent(Type.VOTE_STARTABLE, null, 0, List.of(), Set.of(), List.of());
    }

    public static RoomEvent voteStarted(List<String> options, Set<String> approvedVoterIds) {
        return new RoomEvent(Type.VOTE_STARTED, null, 0, List.copyOf(options), Set.copyOf(approvedVoterIds), List.of());
    }

    public static RoomEvent newVote(String voterId) {
        return new RoomEvent(Type.NEW_VOTE, voterId, 0, List.of(), Set.of(), List.of());
    }

    public static RoomEvent newVoteCount(long count) {
        return new RoomEvent(Type.NEW_VOTE_COUNT, null, count, List.of(), Set.of(), List.of());
    }

    public static RoomEvent voteEndable() {
        return new RoomEvent(Type.VOTE_ENDABLE, null, 0, List.of(), Set.of(), List.of());
    }

    public static RoomEvent voteEnded(List<TallyEntry> tally) {
        return new RoomEvent(Type.VOTE_ENDED, null, 0, List.of(), Set.of(), List.copyOf(tally));
    }
}
