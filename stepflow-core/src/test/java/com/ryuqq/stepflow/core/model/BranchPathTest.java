package com.ryuqq.stepflow.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BranchPath / BranchSegment 테스트.
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
class BranchPathTest {

    @Test
    void enter_AppendsSegment() {
        // Given
        BranchPath root = BranchPath.root();

        // When
        BranchPath path = root.enter("start", 1, 2).enter("cross_validation", 3, 5);

        // Then
        assertEquals(2, path.depth());
        assertEquals(new BranchSegment("cross_validation", 3, 5), path.innermost());
        assertEquals("start[1/2]/cross_validation[3/5]", path.toString());
        assertTrue(root.isRoot());
    }

    @Test
    void leave_RemovesInnermostSegment() {
        BranchPath path = BranchPath.root().enter("start", 1, 2).enter("cross_validation", 3, 5);

        assertEquals(BranchPath.root().enter("start", 1, 2), path.leave());
        assertEquals(BranchPath.root(), path.leave().leave());
    }

    @Test
    void leave_Root_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> BranchPath.root().leave());
        assertThrows(IllegalStateException.class, () -> BranchPath.root().innermost());
    }

    @Test
    void of_EmptySegments_ReturnsRoot() {
        assertSame(BranchPath.root(), BranchPath.of(List.of()));
        assertEquals("root", BranchPath.root().toString());
    }

    @Test
    void segment_IndexOutOfRange_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new BranchSegment("split", 0, 3)
        );
        assertTrue(exception.getMessage().contains("index must be between 1 and 3"));
        assertThrows(IllegalArgumentException.class, () -> new BranchSegment("split", 4, 3));
        assertThrows(IllegalArgumentException.class, () -> new BranchSegment(" ", 1, 1));
    }

    @Test
    void equals_SameSegments_AreEqual() {
        BranchPath a = BranchPath.root().enter("split", 2, 4);
        BranchPath b = BranchPath.of(List.of(new BranchSegment("split", 2, 4)));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, BranchPath.root().enter("split", 3, 4));
    }
}
