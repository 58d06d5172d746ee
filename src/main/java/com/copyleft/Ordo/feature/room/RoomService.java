package com.copyleft.Ordo.feature.room;

import com.copyleft.Ordo.config.OrdoProperties;
import com.copyleft.Ordo.domain.Room;
import com.copyleft.Ordo.domain.Voter;
import com.copyleft.Ordo.domain.type.RoomStatus;
import com.copyleft.Ordo.domain.vo.TallyEntry;
import com.copyleft.Ordo.feature.broadcast.RoomEvent;
import com.copyleft.Ordo.feature.broadcast.RoomEventBus;
import com.copyleft.Ordo.feature.room.dto.RoomPayloads;
import com.copyleft.Ordo.feature.room.event.RoomCreatedEvent;
import com.copyleft.Ordo.global.constant.ErrorCode;
import com.copyleft.Ordo.global.exception.OrdoException;
import com.copyleft.Ordo.global.util.RandomUtil;
import com.copyleft.Ordo.infra.persistence.RoomRepository;
import com.copyleft.Ordo.infra.persistence.VoterRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 방 상태 전이: OPEN -> VOTING -> ENDED.
 *
 * <p>상태 조건은 조회 쿼리에 포함되므로 상태가 맞지 않는 방, 비밀값이 틀린 요청은
 * 모두 {@link ErrorCode#ROOM_NOT_FOUND}로 보고한다.
 * 저장이 끝난 뒤에 알림을 보내며, 알림 실패가 상태 변경을 되돌리지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoomService {

    private final RoomRepository roomRepository;
    private final VoterRepository voterRepository;
    private final RoomEventBus eventBus;
    private final VoteTallyService voteTallyService;
    private final OrdoProperties ordoProperties;
    private final ApplicationEventPublisher eventPublisher;

    public RoomPayloads.RoomCreated createRoom(String name, List<String> options) {
        validateRoom(name, options);

        String roomId = RandomUtil.generateId();
        String adminSecret = RandomUtil.generateSecret(ordoProperties.secretBytes());

        Room room = Room.create(roomId, name, options, adminSecret);
        roomRepository.save(room);

        eventPublisher.publishEvent(new RoomCreatedEvent(roomId));
        log.info("방 생성 완료: id={}, options={}", roomId, options.size());

        return RoomPayloads.RoomCreated.builder()
                .roomId(roomId)
                .adminSecret(adminSecret)
                .name(room.getName())
                .options(room.getOptions())
                .status(room.getStatus())
                .build();
    }

    private void validateRoom(String name, List<String> options) {
        if (!StringUtils.hasLength(name)) {
            throw new OrdoException(ErrorCode.EMPTY_ROOM_NAME);
        }
        if (options == null || options.isEmpty()) {
            throw new OrdoException(ErrorCode.EMPTY_OPTIONS);
        }
        for (String option : options) {
            if (!StringUtils.hasLength(option)) {
                throw new OrdoException(ErrorCode.EMPTY_OPTION);
            }
        }
    }

    public void startVote(String roomId, String adminSecret) {
        Room room = findAdminRoom(roomId, RoomStatus.OPEN, adminSecret);
        transition(roomId, RoomStatus.OPEN, RoomStatus.VOTING);

        Set<String> approvedVoterIds = voterRepository.findAllByRoomIdAndApprovedTrue(roomId).stream()
                .map(Voter::getId)
                .collect(Collectors.toSet());

        eventBus.publish(roomId, RoomEvent.voteStarted(room.getOptions(), approvedVoterIds));
        log.info("투표 시작: room={}, 승인된 투표자={}", roomId, approvedVoterIds.size());
    }

    /**
     * 투표를 종료하고 집계한다. 방은 삭제하지 않으며 (삭제는 만료 시), 채널만 해제한다.
     */
    public RoomPayloads.TallyResult endVote(String roomId, String adminSecret) {
        Room room = findAdminRoom(roomId, RoomStatus.VOTING, adminSecret);
        transition(roomId, RoomStatus.VOTING, RoomStatus.ENDED);

        List<List<String>> ballots = voterRepository.findAllByRoomIdAndBallotIsNotNullOrderByJoinedAtAscIdAsc(roomId).stream()
                .map(Voter::getBallot)
                .toList();
        List<TallyEntry> tally = voteTallyService.tally(room.getCanonicalOptions(), ballots);

        eventBus.publish(roomId, RoomEvent.voteEnded(tally));
        eventBus.teardown(roomId);
        log.info("투표 종료: room={}, 집계된 투표={}", roomId, ballots.size());

        return RoomPayloads.TallyResult.builder()
                .roomId(roomId)
                .tally(tally)
                .build();
    }

    /**
     * 상태와 관계없이 방과 투표자를 함께 삭제하고 채널을 해제한다.
     * 이미 삭제된 방이면 false를 돌려줄 뿐 오류가 아니다.
     */
    @Transactional
    public boolean expire(String roomId) {
        int voters = voterRepository.deleteAllOfRoom(roomId);
        int rooms = roomRepository.deleteRoomById(roomId);
        eventBus.teardown(roomId);

        if (rooms == 0) {
            log.info("이미 삭제된 방의 만료 요청: room={}", roomId);
            return false;
        }
        log.info("방 삭제 완료: room={}, voters={}", roomId, voters);
        return true;
    }

    public RoomPayloads.RoomInfo getRoom(String roomId) {
        Room room = roomRepository.findById(roomId)
                .orElseThrow(() -> new OrdoException(ErrorCode.ROOM_NOT_FOUND));
        return toRoomInfo(room);
    }

    public RoomPayloads.AdminView getAdminView(String roomId, String adminSecret) {
        Room room = roomRepository.findById(roomId)
                .filter(r -> r.isAdmin(adminSecret))
                .orElseThrow(() -> new OrdoException(ErrorCode.ROOM_NOT_FOUND));

        List<RoomPayloads.VoterRow> voters = voterRepository.findAllByRoomIdOrderByJoinedAtAscIdAsc(roomId).stream()
                .map(v -> RoomPayloads.VoterRow.builder()
                        .voterId(v.getId())
                        .approved(v.isApproved())
                        .voted(v.hasBallot())
                        .build())
                .toList();

        return RoomPayloads.AdminView.builder()
                .room(toRoomInfo(room))
                .voters(voters)
                .build();
    }

    public RoomPayloads.RoomInfo toRoomInfo(Room room) {
        return RoomPayloads.RoomInfo.builder()
                .roomId(room.getId())
                .name(room.getName())
                .options(room.getOptions())
                .status(room.getStatus())
                .voterCount(voterRepository.countByRoomId(room.getId()))
                .voteCount(voterRepository.countByRoomIdAndBallotIsNotNull(room.getId()))
                .build();
    }

    private Room findAdminRoom(String roomId, RoomStatus status, String adminSecret) {
        Room room = roomRepository.findByIdAndStatus(roomId, status)
                .orElseThrow(() -> new OrdoException(ErrorCode.ROOM_NOT_FOUND));

        if (!room.isAdmin(adminSecret)) {
            log.warn("관리자 비밀값 불일치: room={}", roomId);
            throw new OrdoException(ErrorCode.ROOM_NOT_FOUND);
        }
        return room;
    }

    // 조회와 갱신 사이에 만료나 다른 전이가 끼어들면 0건이 갱신된다
    private void transition(String roomId, RoomStatus from, RoomStatus to) {
        if (roomRepository.updateStatus(roomId, from, to) == 0) {
            log.warn("상태 전이 실패 (삭제되었거나 이미 전이됨): room={}, {} -> {}", roomId, from, to);
            throw new OrdoException(ErrorCode.ROOM_NOT_FOUND);
        }
    }
}
