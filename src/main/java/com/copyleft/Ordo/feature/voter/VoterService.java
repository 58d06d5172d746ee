package com.copyleft.Ordo.feature.voter;

import com.copyleft.Ordo.config.OrdoProperties;
import com.copyleft.Ordo.domain.Room;
import com.copyleft.Ordo.domain.Voter;
import com.copyleft.Ordo.domain.type.RoomStatus;
import com.copyleft.Ordo.feature.broadcast.RoomEvent;
import com.copyleft.Ordo.feature.broadcast.RoomEventBus;
import com.copyleft.Ordo.feature.room.RoomService;
import com.copyleft.Ordo.feature.voter.dto.VoterPayloads;
import com.copyleft.Ordo.global.constant.ErrorCode;
import com.copyleft.Ordo.global.exception.OrdoException;
import com.copyleft.Ordo.global.util.RandomUtil;
import com.copyleft.Ordo.infra.persistence.RoomRepository;
import com.copyleft.Ordo.infra.persistence.VoterRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class VoterService {

    private final RoomRepository roomRepository;
    private final VoterRepository voterRepository;
    private final RoomService roomService;
    private final RoomEventBus eventBus;
    private final OrdoProperties ordoProperties;

    public VoterPayloads.VoterJoined joinRoom(String roomId) {
        roomRepository.findByIdAndStatus(roomId, RoomStatus.OPEN)
                .orElseThrow(() -> new OrdoException(ErrorCode.ROOM_NOT_FOUND));

        String voterId = RandomUtil.generateId();
        String voterSecret = RandomUtil.generateSecret(ordoProperties.secretBytes());
        voterRepository.save(Voter.create(voterId, roomId, voterSecret));

        // 동시 입장 시 숫자가 앞서거나 뒤처질 수 있다. 다음 이벤트로 맞춰진다.
        long voterCount = voterRepository.countByRoomId(roomId);

        eventBus.publish(roomId, RoomEvent.newVoter(voterId));
        eventBus.publish(roomId, RoomEvent.newVoterCount(voterCount));
        log.info("투표자 입장: room={}, voter={}, count={}", roomId, voterId, voterCount);

        return VoterPayloads.VoterJoined.builder()
                .roomId(roomId)
                .voterId(voterId)
                .voterSecret(voterSecret)
                .voterCount(voterCount)
                .build();
    }

    /**
     * 투표자 승인. 이미 승인된 투표자면 아무것도 바꾸지 않고 이벤트도 보내지 않는다.
     * VOTE_STARTABLE은 승인 인원이 0에서 1이 될 때만 발행한다.
     */
    public void approveVoter(String voterId, String adminSecret) {
        Voter voter = voterRepository.findById(voterId)
                .orElseThrow(() -> new OrdoException(ErrorCode.VOTER_NOT_FOUND));
        Room room = roomRepository.findById(voter.getRoomId())
                .orElseThrow(() -> new OrdoException(ErrorCode.VOTER_NOT_FOUND));

        if (!room.isAdmin(adminSecret)) {
            log.warn("승인 요청 비밀값 불일치: room={}, voter={}", room.getId(), voterId);
            throw new OrdoException(ErrorCode.VOTER_NOT_FOUND);
        }

        // 동시 승인이어도 한 요청만 1을 받는다
        if (voterRepository.approve(voterId) == 0) {
            log.info("이미 승인되었거나 삭제된 투표자: voter={}", voterId);
            return;
        }

        String roomId = room.getId();
        eventBus.publish(roomId, RoomEvent.voterApproved(voterId));

        long approvedCount = voterRepository.countByRoomIdAndApprovedTrue(roomId);
        if (approvedCount == 1) {
            eventBus.publish(roomId, RoomEvent.voteStartable());
        }
        log.info("투표자 승인: room={}, voter={}, 승인 인원={}", roomId, voterId, approvedCount);
    }

    /**
     * 투표 제출. 재제출 시 마지막 투표가 남는다.
     * VOTE_ENDABLE은 제출 수가 0에서 1이 될 때만 발행한다.
     */
    public VoterPayloads.BallotAccepted submitBallot(String voterId, String voterSecret, List<String> ballot) {
        if (ballot == null) {
            throw new OrdoException(ErrorCode.INVALID_REQUEST);
        }

        Voter voter = findOwnedVoter(voterId, voterSecret);
        String roomId = voter.getRoomId();

        Room room = roomRepository.findByIdAndStatus(roomId, RoomStatus.VOTING)
                .orElseThrow(() -> new OrdoException(ErrorCode.ROOM_NOT_FOUND));

        if (!voter.isApproved()) {
            throw new OrdoException(ErrorCode.VOTER_NOT_APPROVED);
        }
        if (!room.acceptsBallot(ballot)) {
            throw new OrdoException(ErrorCode.UNKNOWN_OPTIONS);
        }

        boolean firstBallot = !voter.hasBallot();
        if (voterRepository.updateBallot(voterId, ballot) == 0) {
            log.warn("투표 저장 실패 (삭제된 투표자): room={}, voter={}", roomId, voterId);
            throw new OrdoException(ErrorCode.VOTER_NOT_FOUND);
        }

        eventBus.publish(roomId, RoomEvent.newVote(voterId));

        long voteCount = voterRepository.countByRoomIdAndBallotIsNotNull(roomId);
        eventBus.publish(roomId, RoomEvent.newVoteCount(voteCount));
        if (firstBallot && voteCount == 1) {
            eventBus.publish(roomId, RoomEvent.voteEndable());
        }
        log.info("투표 제출: room={}, voter={}, 제출 수={}, 재제출={}", roomId, voterId, voteCount, !firstBallot);

        return VoterPayloads.BallotAccepted.builder()
                .voterId(voterId)
                .ballot(List.copyOf(ballot))
                .voteCount(voteCount)
                .build();
    }

    public VoterPayloads.VoterView getVoterView(String voterId, String voterSecret) {
        Voter voter = findOwnedVoter(voterId, voterSecret);
        Room room = roomRepository.findById(voter.getRoomId())
                .orElseThrow(() -> new OrdoException(ErrorCode.ROOM_NOT_FOUND));

        return VoterPayloads.VoterView.builder()
                .voterId(voterId)
                .approved(voter.isApproved())
                .ballot(voter.getBallot())
                .room(roomService.toRoomInfo(room))
                .build();
    }

    private Voter findOwnedVoter(String voterId, String voterSecret) {
        Voter voter = voterRepository.findById(voterId)
                .orElseThrow(() -> new OrdoException(ErrorCode.VOTER_NOT_FOUND));
        if (!voter.isOwnedBy(voterSecret)) {
            log.warn("투표자 비밀값 불일치: voter={}", voterId);
            throw new OrdoException(ErrorCode.VOTER_NOT_FOUND);
        }
        return voter;
    }
}
