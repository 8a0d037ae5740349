package com.questrail.interactivity.internal.state;

import com.questrail.interactivity.api.PaginationAction;
import com.questrail.interactivity.api.PaginationBehavior;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NavigationReducerTest
 * -----------------------------------------------------------------------------
 * Unit tests for the pure navigation reducer.
 *
 * These tests deliberately do not involve sessions, timers or threading.
 */
class NavigationReducerTest {

    private final NavigationReducer clamp = new NavigationReducer(PaginationBehavior.CLAMP);
    private final NavigationReducer wrap = new NavigationReducer(PaginationBehavior.WRAP_AROUND);

    @Test
    void clampNextAtLastIsNoOp() {
        NavigationState last = new NavigationState(2, 3);

        NavigationReducer.Result r = clamp.apply(last, PaginationAction.NEXT);

        assertEquals(2, r.newState().index());
        assertFalse(r.changed());
    }

    @Test
    void clampPreviousAtFirstIsNoOp() {
        NavigationReducer.Result r = clamp.apply(NavigationState.initial(3), PaginationAction.PREVIOUS);

        assertEquals(0, r.newState().index());
        assertFalse(r.changed());
    }

    @Test
    void wrapNextAtLastGoesToFirst() {
        NavigationReducer.Result r = wrap.apply(new NavigationState(2, 3), PaginationAction.NEXT);

        assertEquals(0, r.newState().index());
        assertTrue(r.changed());
    }

    @Test
    void wrapPreviousAtFirstGoesToLast() {
        NavigationReducer.Result r = wrap.apply(NavigationState.initial(3), PaginationAction.PREVIOUS);

        assertEquals(2, r.newState().index());
        assertTrue(r.changed());
    }

    @Test
    void nextAndPreviousMoveByOneInsideBounds() {
        NavigationState middle = new NavigationState(1, 3);

        assertEquals(2, clamp.apply(middle, PaginationAction.NEXT).newState().index());
        assertEquals(0, clamp.apply(middle, PaginationAction.PREVIOUS).newState().index());
        assertEquals(2, wrap.apply(middle, PaginationAction.NEXT).newState().index());
        assertEquals(0, wrap.apply(middle, PaginationAction.PREVIOUS).newState().index());
    }

    @Test
    void skipActionsJumpToEndsUnderBothPolicies() {
        NavigationState middle = new NavigationState(2, 5);

        for (NavigationReducer reducer : new NavigationReducer[] { clamp, wrap }) {
            assertEquals(0, reducer.apply(middle, PaginationAction.SKIP_TO_FIRST).newState().index());
            assertEquals(4, reducer.apply(middle, PaginationAction.SKIP_TO_LAST).newState().index());
        }
    }

    @Test
    void skipToCurrentEndReportsUnchanged() {
        assertFalse(clamp.apply(NavigationState.initial(4), PaginationAction.SKIP_TO_FIRST).changed());
        assertFalse(wrap.apply(new NavigationState(3, 4), PaginationAction.SKIP_TO_LAST).changed());
    }

    @Test
    void stopLeavesStateUntouched() {
        NavigationState s = new NavigationState(1, 3);

        NavigationReducer.Result r = wrap.apply(s, PaginationAction.STOP);

        assertSame(s, r.newState());
        assertFalse(r.changed());
    }

    @ParameterizedTest
    @CsvSource({
        "1, 0",
        "1, 7",
        "3, 3",
        "3, 10",
        "4, 17",
        "7, 100"
    })
    void wrapAroundAdvancesLandOnCountModuloPages(int pages, int advances) {
        NavigationState s = NavigationState.initial(pages);
        for (int i = 0; i < advances; i++) {
            s = wrap.apply(s, PaginationAction.NEXT).newState();
        }
        assertEquals(advances % pages, s.index());
    }

    @Test
    void singlePageNeverMoves() {
        NavigationState only = NavigationState.initial(1);

        for (PaginationAction action : PaginationAction.values()) {
            assertEquals(0, clamp.apply(only, action).newState().index());
            assertEquals(0, wrap.apply(only, action).newState().index());
        }
    }

    @Test
    void stateRejectsIndexOutsideBounds() {
        assertThrows(IllegalArgumentException.class, () -> new NavigationState(3, 3));
        assertThrows(IllegalArgumentException.class, () -> new NavigationState(-1, 3));
        assertThrows(IllegalArgumentException.class, () -> new NavigationState(0, 0));
    }
}
