package com.flagship.points_ledger.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PointBalanceTest {

    @Test
    @DisplayName("A negative balance cannot be constructed")
    void negativeBalanceIsRejected() {
        assertThrows(IllegalStateException.class,
            () -> new PointBalance("u", -1, 1, List.of(), Instant.now()));
    }

    @Test
    @DisplayName("Applying an operation keeps the version and remembers the key")
    void applyRemembersOperation() {
        PointBalance initial = PointBalance.initial("u");
        AppliedOperation credit = new AppliedOperation("k1", OperationType.CREDIT, 50, 50, Instant.now());

        PointBalance next = initial.apply(credit, 10);

        assertEquals(50L, next.getBalance());
        assertEquals(initial.getVersion(), next.getVersion());
        assertEquals(credit, next.findApplied("k1").orElseThrow());
        assertTrue(initial.findApplied("k1").isEmpty(), "Snapshots are immutable");
    }

    @Test
    @DisplayName("The recent list evicts the oldest entries first")
    void recentListIsBounded() {
        PointBalance balance = PointBalance.initial("u");
        for (int i = 1; i <= 4; i++) {
            balance = balance.apply(
                new AppliedOperation("k" + i, OperationType.CREDIT, 1, i, Instant.now()), 3);
        }

        assertEquals(3, balance.getRecentOperations().size());
        assertTrue(balance.findApplied("k1").isEmpty());
        assertTrue(balance.findApplied("k4").isPresent());
    }
}
