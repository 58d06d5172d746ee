package com.copyleft.Ordo.feature.broadcast;

import com.copyleft.Ordo.domain.Room;
import com.copyleft.Ordo.domain.Voter;
import com.copyleft.Ordo.infra.persistence.RoomRepository;
import com.copyleft.Ordo.infra.persistence.VoterRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * 구독 요청의 비밀값으로 역할을 한 번 판정한다.
 * 비밀값이 없거나 틀리면 오류 대신 익명으로 떨어진다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubscriberRoleResolver {

    private final RoomRepository roomRepository;
    private final VoterRepository voterRepository;

    public SubscriberRole resolve(String roomId, String adminSecret, String voterId, String voterSecret) {
        try {
            if (StringUtils.hasText(adminSecret)) {
                Optional<Room> room = roomRepository.findById(roomId);
                if (room.isPresent() && room.get().isAdmin(adminSecret)) {
                    return SubscriberRole.admin(roomId);
                }
            }

            if (StringUtils.hasText(voterId) && StringUtils.hasText(voterSecret)) {
                Optional<Voter> voter = voterRepository.findById(voterId);
                if (voter.isPresent()
                        && roomId.equals(voter.get().getRoomId())
                        && voter.get().isOwnedBy(voterSecret)) {
                    return SubscriberRole.voter(voterId);
                }
            }
        } catch (RuntimeException e) {
            log.warn("구독자 역할 판정 실패, 익명으로 처리: room={}", roomId, e);
        }
        return SubscriberRole.anonymous();
    }
}
