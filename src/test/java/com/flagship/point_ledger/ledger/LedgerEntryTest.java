package com.flagship.point_ledger.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Ledger entry and usage record state machines.
 *
 * These tests verify that:
 * - Valid transitions produce new immutable instances
 * - Invalid transitions are rejected with IllegalStateException
 * - Amount signs are enforced per kind
 */
class LedgerEntryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");
    private static final UUID USER = UUID.randomUUID();

    private LedgerEntry pending(long amount) {
        return LedgerEntry.grant(UUID.randomUUID(), USER, EntryKind.EARNED_SERVICE, amount, EntryStatus.PENDING,
            NOW.minus(Duration.ofDays(1)), NOW.plus(Duration.ofDays(364)), null, null, NOW.minus(Duration.ofDays(8)));
    }

    private LedgerEntry available(long amount) {
        return pending(amount).mature(NOW);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Nested
    @DisplayName("Grant lifecycle")
    class GrantLifecycle {

        @Test
        @DisplayName("PENDING -> AVAILABLE -> USED as points are drawn")
        void testMatureAndDrawToZero() {
            printTestHeader("Grant Lifecycle PENDING -> AVAILABLE -> USED");

            LedgerEntry grant = pending(100);
            LedgerEntry matured = grant.mature(NOW);
            LedgerEntry partlyDrawn = matured.draw(40, NOW);
            LedgerEntry drained = partlyDrawn.draw(60, NOW);

            assertEquals(EntryStatus.PENDING, grant.getStatus(), "Original instance is unchanged");
            assertEquals(EntryStatus.AVAILABLE, matured.getStatus());
            assertEquals(60, partlyDrawn.getRemainingAmount());
            assertEquals(EntryStatus.AVAILABLE, partlyDrawn.getStatus());
            assertEquals(0, drained.getRemainingAmount());
            assertEquals(EntryStatus.USED, drained.getStatus());
            assertEquals(100, drained.getAmount(), "Amount never changes");
            printSuccess("Each transition returned a new entry");
        }

        @Test
        @DisplayName("Maturing before availableFrom is rejected")
        void testMatureTooEarly() {
            LedgerEntry grant = LedgerEntry.grant(UUID.randomUUID(), USER, EntryKind.EARNED_SERVICE, 100,
                EntryStatus.PENDING, NOW.plus(Duration.ofDays(7)), NOW.plus(Duration.ofDays(372)), null, null, NOW);

            IllegalStateException e = assertThrows(IllegalStateException.class, () -> grant.mature(NOW));
            assertTrue(e.getMessage().contains("held until"));
        }

        @Test
        @DisplayName("Maturing an AVAILABLE grant is rejected")
        void testMatureTwice() {
            LedgerEntry grant = available(100);
            assertThrows(IllegalStateException.class, () -> grant.mature(NOW));
        }

        @Test
        @DisplayName("Drawing more than remains is rejected")
        void testOverdraw() {
            LedgerEntry grant = available(100);
            assertThrows(IllegalStateException.class, () -> grant.draw(101, NOW));
        }

        @Test
        @DisplayName("Drawing from an expired grant is rejected even while AVAILABLE")
        void testDrawAfterExpiry() {
            LedgerEntry grant = available(100);
            Instant afterExpiry = grant.getExpiresAt().plusSeconds(1);

            assertFalse(grant.isSpendableAt(afterExpiry));
            assertThrows(IllegalStateException.class, () -> grant.draw(10, afterExpiry));
        }

        @Test
        @DisplayName("Restore brings a USED grant back to AVAILABLE but never above its amount")
        void testRestore() {
            LedgerEntry drained = available(100).draw(100, NOW);

            LedgerEntry restored = drained.restore(30, NOW);
            assertEquals(EntryStatus.AVAILABLE, restored.getStatus());
            assertEquals(30, restored.getRemainingAmount());

            assertThrows(IllegalStateException.class, () -> restored.restore(71, NOW));
        }

        @Test
        @DisplayName("markExpired zeroes the remainder; PENDING grants cannot expire")
        void testMarkExpired() {
            LedgerEntry expired = available(100).markExpired(NOW);
            assertEquals(EntryStatus.EXPIRED, expired.getStatus());
            assertEquals(0, expired.getRemainingAmount());

            assertThrows(IllegalStateException.class, () -> pending(100).markExpired(NOW));
        }
    }

    @Nested
    @DisplayName("Amount sign rules")
    class AmountSigns {

        @Test
        @DisplayName("Earning kinds refuse non-positive amounts")
        void testEarningKindSign() {
            assertFalse(EntryKind.EARNED_REFERRAL.allowsAmount(0));
            assertThrows(IllegalArgumentException.class, () -> pending(0));
            assertThrows(IllegalArgumentException.class, () -> pending(-5));
        }

        @Test
        @DisplayName("Spend entries store the total negated and start USED")
        void testSpendEntry() {
            LedgerEntry spend = LedgerEntry.spend(UUID.randomUUID(), USER, EntryKind.USED_SERVICE, 250,
                UUID.randomUUID(), null, "spend", NOW);

            assertEquals(-250, spend.getAmount());
            assertEquals(EntryStatus.USED, spend.getStatus());
            assertTrue(spend.isSpend());
            assertFalse(spend.isGrant());

            LedgerEntry cancelled = spend.cancel(NOW);
            assertEquals(EntryStatus.CANCELLED, cancelled.getStatus());
            assertThrows(IllegalStateException.class, () -> cancelled.cancel(NOW));
        }

        @Test
        @DisplayName("EXPIRED kind cannot be granted")
        void testExpiredKindCannotGrant() {
            assertThrows(IllegalArgumentException.class, () -> LedgerEntry.grant(UUID.randomUUID(), USER,
                EntryKind.EXPIRED, 10, EntryStatus.AVAILABLE, NOW, null, null, null, NOW));
        }

        @Test
        @DisplayName("Forfeiture entries reference their grant")
        void testForfeiture() {
            LedgerEntry grant = available(100);
            LedgerEntry forfeiture = LedgerEntry.forfeiture(UUID.randomUUID(), grant, 70, NOW);

            assertEquals(EntryKind.EXPIRED, forfeiture.getKind());
            assertEquals(-70, forfeiture.getAmount());
            assertEquals(grant.getId(), forfeiture.getRelatedEntryId());
            assertFalse(forfeiture.isSpend(), "A forfeiture is not a spend");
        }
    }

    @Nested
    @DisplayName("Usage record lifecycle")
    class UsageLifecycle {

        @Test
        @DisplayName("Total is the sum of draws and ROLLED_BACK is terminal")
        void testCommitAndRollBack() {
            UsageRecord usage = UsageRecord.commit(UUID.randomUUID(), USER, UUID.randomUUID(),
                List.of(ConsumedDraw.of(UUID.randomUUID(), 300), ConsumedDraw.of(UUID.randomUUID(), 100)),
                UUID.randomUUID(), NOW);

            assertEquals(400, usage.getTotalAmount());
            assertTrue(usage.isCommitted());

            UsageRecord rolledBack = usage.rollBack("order cancelled", NOW);
            assertEquals(UsageStatus.ROLLED_BACK, rolledBack.getStatus());
            assertEquals("order cancelled", rolledBack.getRollbackReason());
            assertEquals(NOW, rolledBack.getRolledBackAt());

            assertThrows(IllegalStateException.class, () -> rolledBack.rollBack("again", NOW));
        }

        @Test
        @DisplayName("A usage without draws cannot be committed")
        void testEmptyDraws() {
            assertThrows(IllegalArgumentException.class, () -> UsageRecord.commit(UUID.randomUUID(), USER, null,
                List.of(), UUID.randomUUID(), NOW));
            assertThrows(IllegalArgumentException.class, () -> ConsumedDraw.of(UUID.randomUUID(), 0));
        }
    }
}
