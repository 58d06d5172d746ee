package com.copyleft.Ordo.infra.persistence;

import com.copyleft.Ordo.domain.Room;
import com.copyleft.Ordo.domain.type.RoomStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

public interface RoomRepository extends JpaRepository<Room, String> {

    // 상태까지 조건에 포함한 조회: 상태 불일치는 "없음"과 구분되지 않는다
    Optional<Room> findByIdAndStatus(String id, RoomStatus status);

    /**
     * 현재 상태가 from인 경우에만 to로 바꾼다.
     * 이미 삭제됐거나 다른 요청이 먼저 바꿨으면 0을 돌려주며, 행을 새로 만들지 않는다.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Room r set r.status = :to where r.id = :roomId and r.status = :from")
    int updateStatus(@Param("roomId") String roomId, @Param("from") RoomStatus from, @Param("to") RoomStatus to);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from Room r where r.id = :roomId")
    int deleteRoomById(@Param("roomId") String roomId);
}
