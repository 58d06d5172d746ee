package com.copyleft.Ordo.feature.broadcast;

import com.copyleft.Ordo.feature.broadcast.dto.BroadcastPayloads;
import com.copyleft.Ordo.global.constant.SocketEvent;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * (이벤트 종류, 구독자 역할) 전체에 대해 정의된 투영 함수.
 * 결과가 비어 있으면 전송 계층은 하트비트를 보낸다.
 *
 * <p>모든 분기를 enum switch 식으로 작성해서 종류나 역할이 추가되면 컴파일 단계에서 누락이 드러난다.
 */
@Component
public class RoomEventProjector {

    public Optional<ProjectedEvent> project(RoomEvent event, SubscriberRole role) {
        return switch (event.getType()) {
            case NEW_VOTER -> switch (role.kind()) {
                case ADMIN -> Optional.of(voterRow(SocketEvent.VOTER_JOINED, event.getVoterId(), false, false));
                case VOTER, ANONYMOUS -> Optional.empty();
            };
            case NEW_VOTER_COUNT -> switch (role.kind()) {
                case ADMIN, VOTER -> Optional.of(count(SocketEvent.VOTER_COUNT, event.getCount()));
                case ANONYMOUS -> Optional.empty();
            };
            case VOTER_APPROVED -> switch (role.kind()) {
                case ADMIN -> Optional.of(voterRow(SocketEvent.VOTER_APPROVED, event.getVoterId(), true, false));
                case VOTER -> role.isVoter(event.getVoterId())
                        ? Optional.of(voterRow(SocketEvent.APPROVED, event.getVoterId(), true, false))
                        : Optional.empty();
                case ANONYMOUS -> Optional.empty();
            };
            case VOTE_STARTABLE -> switch (role.kind()) {
                case ADMIN -> Optional.of(ProjectedEvent.of(SocketEvent.VOTE_STARTABLE, null));
                case VOTER, ANONYMOUS -> Optional.empty();
            };
            case VOTE_STARTED -> switch (role.kind()) {
                case ADMIN -> Optional.of(ProjectedEvent.of(SocketEvent.VOTE_STARTED, null));
                // 시작 시점에 승인돼 있던 투표자만 폼을 받는다
                case VOTER -> event.getApprovedVoterIds().contains(role.id())
                        ? Optional.of(ProjectedEvent.of(SocketEvent.BALLOT_FORM,
                                BroadcastPayloads.BallotForm.builder().options(event.getOptions()).build()))
                        : Optional.empty();
                case ANONYMOUS -> Optional.empty();
            };
            case NEW_VOTE -> switch (role.kind()) {
                case ADMIN -> Optional.of(voterRow(SocketEvent.VOTE_SUBMITTED, event.getVoterId(), true, true));
                case VOTER, ANONYMOUS -> Optional.empty();
            };
            case NEW_VOTE_COUNT -> switch (role.kind()) {
                case ADMIN, VOTER -> Optional.of(count(SocketEvent.VOTE_COUNT, event.getCount()));
                case ANONYMOUS -> Optional.empty();
            };
            case VOTE_ENDABLE -> switch (role.kind()) {
                case ADMIN -> Optional.of(ProjectedEvent.of(SocketEvent.VOTE_ENDABLE, null));
                case VOTER, ANONYMOUS -> Optional.empty();
            };
            case VOTE_ENDED -> switch (role.kind()) {
                case ADMIN, VOTER -> Optional.of(ProjectedEvent.of(SocketEvent.VOTE_RESULT,
                        BroadcastPayloads.VoteResult.builder().tally(event.getTally()).build()));
                case ANONYMOUS -> Optional.empty();
            };
        };
    }

    private ProjectedEvent voterRow(SocketEvent socketEvent, String voterId, boolean approved, boolean voted) {
        return ProjectedEvent.of(socketEvent, BroadcastPayloads.VoterRef.builder()
                .voterId(voterId)
                .approved(approved)
                .voted(voted)
                .build());
    }

    private ProjectedEvent count(SocketEvent socketEvent, long count) {
        return ProjectedEvent.of(socketEvent, BroadcastPayloads.Count.builder().count(count).build());
    }
}
