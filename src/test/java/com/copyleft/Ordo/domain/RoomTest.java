package com.copyleft.Ordo.domain;

import com.copyleft.Ordo.domain.type.RoomStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoomTest {

    @Test
    @DisplayName("방 생성 시 입력한 항목 순서가 그대로 저장되고 상태는 OPEN이다")
    void create_KeepsDisplayOrder() {
        // when
        Room room = Room.create("room-1", "점심 메뉴", List.of("Sushi", "Pizza", "Bibimbap"), "secret");

        // then
        assertEquals(List.of("Sushi", "Pizza", "Bibimbap"), room.getOptions());
        assertEquals(RoomStatus.OPEN, room.getStatus());
        assertNotNull(room.getCreatedAt());
    }

    @Test
    @DisplayName("비교용 항목 뷰는 정렬되어 있고 저장된 순서를 바꾸지 않는다")
    void canonicalOptions_SortedWithoutMutation() {
        // given
        Room room = Room.create("room-1", "점심 메뉴", List.of("Sushi", "Pizza", "Bibimbap"), "secret");

        // when
        List<String> canonical = room.getCanonicalOptions();

        // then
        assertEquals(List.of("Bibimbap", "Pizza", "Sushi"), canonical);
        assertEquals(List.of("Sushi", "Pizza", "Bibimbap"), room.getOptions());
    }

    @Test
    @DisplayName("항목 다중집합이 같으면 순서와 관계없이 투표를 받는다")
    void acceptsBallot_AnyPermutation() {
        Room room = Room.create("room-1", "점심 메뉴", List.of("A", "B", "C"), "secret");

        assertTrue(room.acceptsBallot(List.of("C", "A", "B")));
        assertTrue(room.acceptsBallot(List.of("A", "B", "C")));
    }

    @Test
    @DisplayName("빠지거나, 중복되거나, 모르는 항목이 있는 투표는 거절한다")
    void acceptsBallot_RejectsMismatch() {
        Room room = Room.create("room-1", "점심 메뉴", List.of("A", "B", "C"), "secret");

        assertFalse(room.acceptsBallot(List.of("A", "B")));
        assertFalse(room.acceptsBallot(List.of("A", "A", "B")));
        assertFalse(room.acceptsBallot(List.of("A", "B", "D")));
        assertFalse(room.acceptsBallot(List.of("A", "B", "C", "C")));
        assertFalse(room.acceptsBallot(null));
    }

    @Test
    @DisplayName("중복 항목이 있는 방은 같은 다중집합의 투표만 받는다")
    void acceptsBallot_DuplicateOptions() {
        Room room = Room.create("room-1", "중복", List.of("A", "A", "B"), "secret");

        assertTrue(room.acceptsBallot(List.of("A", "B", "A")));
        assertFalse(room.acceptsBallot(List.of("A", "B", "B")));
    }

    @Test
    @DisplayName("관리자 비밀값은 정확히 일치할 때만 인정된다")
    void isAdmin() {
        Room room = Room.create("room-1", "점심 메뉴", List.of("A"), "admin-secret");

        assertTrue(room.isAdmin("admin-secret"));
        assertFalse(room.isAdmin("admin-secret2"));
        assertFalse(room.isAdmin(""));
        assertFalse(room.isAdmin(null));
    }
}
