package com.copyleft.Ordo.infra.persistence;

import com.copyleft.Ordo.domain.Voter;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

public interface VoterRepository extends JpaRepository<Voter, String> {

    List<Voter> findAllByRoomIdOrderByJoinedAtAscIdAsc(String roomId);

    List<Voter> findAllByRoomIdAndApprovedTrue(String roomId);

    // 집계 순서 = 입장 순서
    List<Voter> findAllByRoomIdAndBallotIsNotNullOrderByJoinedAtAscIdAsc(String roomId);

    long countByRoomId(String roomId);

    long countByRoomIdAndApprovedTrue(String roomId);

    long countByRoomIdAndBallotIsNotNull(String roomId);

    /**
     * @return 1이면 이번 호출로 승인됨. 이미 승인됐거나 삭제된 투표자면 0.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Voter v set v.approved = true where v.id = :voterId and v.approved = false")
    int approve(@Param("voterId") String voterId);

    // 재제출은 덮어쓴다. 삭제된 투표자면 0.
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Voter v set v.ballot = :ballot where v.id = :voterId and v.approved = true")
    int updateBallot(@Param("voterId") String voterId, @Param("ballot") List<String> ballot);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from Voter v where v.roomId = :roomId")
    int deleteAllOfRoom(@Param("roomId") String roomId);
}
