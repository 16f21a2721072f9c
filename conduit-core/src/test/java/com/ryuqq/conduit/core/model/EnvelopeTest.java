package com.ryuqq.conduit.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Envelope, Pagination 값 타입 테스트.
 *
 * @author Conduit Team
 * @since 1.0.0
 */
class EnvelopeTest {

    @Test
    void success_false이면_result는_항상_null() {
        // When
        Envelope<String> envelope = new Envelope<>(false, List.of(new ApiError(1001, "a")), List.of(), "ignored", null);

        // Then
        assertNull(envelope.result());
        assertEquals(1, envelope.errors().size());
    }

    @Test
    void success_true이면_result_유지() {
        Envelope<String> envelope = new Envelope<>(true, null, null, "zone", null);

        assertEquals("zone", envelope.result());
        assertTrue(envelope.errors().isEmpty());
        assertTrue(envelope.messages().isEmpty());
    }

    @Test
    void apiError_format은_코드와_메시지를_포함() {
        assertEquals("[1001] a", new ApiError(1001, "a").format());
        assertEquals("[7] ", new ApiError(7, null).format());
    }

    @Test
    void cursor가_비어있으면_hasCursor_false() {
        assertFalse(new CursorInfo(10, 10, null).hasCursor());
        assertFalse(new CursorInfo(10, 10, "").hasCursor());
        assertTrue(new CursorInfo(10, 10, "abc").hasCursor());
    }

    @Test
    void totalPages_0은_알수없음을_의미() {
        assertFalse(new PageInfo(1, 20, 20, 0, 0).hasKnownTotalPages());
        assertTrue(new PageInfo(1, 20, 20, 40, 2).hasKnownTotalPages());
    }

    @Test
    void pageState_다음_페이지와_커서() {
        // Given
        PageState first = PageState.first(1, 50);

        // When
        PageState second = first.nextPage();
        PageState cursorState = first.withCursor("c-1");

        // Then
        assertEquals(2, second.page());
        assertEquals(50, second.perPage());
        assertFalse(second.hasCursor());
        assertEquals("c-1", cursorState.cursor());
        assertTrue(cursorState.hasCursor());
        assertThrows(IllegalArgumentException.class, () -> PageState.first(0, null));
    }

    @Test
    void quotaSignal_남은_비율이_임계값보다_낮은지_판단() {
        QuotaSignal low = new QuotaSignal(5, 100, java.time.Instant.EPOCH);
        QuotaSignal unknownLimit = new QuotaSignal(0, 0, java.time.Instant.EPOCH);

        assertTrue(low.isBelow(0.1));
        assertFalse(low.isBelow(0.05));
        assertFalse(unknownLimit.isBelow(0.5));
    }
}
