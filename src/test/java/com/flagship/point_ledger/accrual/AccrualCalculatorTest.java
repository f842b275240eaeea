package com.flagship.point_ledger.accrual;

import com.flagship.point_ledger.ledger.EntryKind;
import com.flagship.point_ledger.ledger.EntryStatus;
import com.flagship.point_ledger.ledger.LedgerEntry;
import com.flagship.point_ledger.ledger.exception.InvalidAmountException;
import com.flagship.point_ledger.ledger.exception.LedgerErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Accrual rules: 2.5% of the purchase up to a 300,000 cap, tier and influencer multipliers,
 * a fixed referral bonus, a 7-day hold and a 365-day validity.
 */
class AccrualCalculatorTest {

    private static final Instant NOW = Instant.parse("2026-02-10T12:00:00Z");

    private final AccrualCalculator calculator = new AccrualCalculator(AccrualPolicy.defaults());

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    @Nested
    @DisplayName("Earned service points")
    class EarnedService {

        @ParameterizedTest(name = "purchase {0}, tier {1}, influencer {2} -> {3} points")
        @CsvSource({
            "40000,   1,    false, 1000",
            "39999,   1,    false, 999",
            "300000,  1,    false, 7500",
            "1000000, 1,    false, 7500",
            "40000,   1.5,  false, 1500",
            "40000,   1,    true,  2000",
            "12345,   1.25, true,  770"
        })
        void testEarnedServiceAmount(long purchase, BigDecimal tier, boolean influencer, long expected) {
            printTestHeader("Earned Service Accrual");
            printInput("Purchase", purchase);
            printInput("Tier", tier);
            printInput("Influencer", influencer);

            GrantContext context = GrantContext.builder().tierMultiplier(tier).influencer(influencer).build();
            GrantTerms terms = calculator.calculate(EntryKind.EARNED_SERVICE, purchase, context, NOW);

            printOutput("Points", terms.getAmount());
            assertEquals(expected, terms.getAmount());
        }

        @Test
        @DisplayName("Earned credits are held 7 days and valid 365 days after that")
        void testHoldAndValidity() {
            GrantTerms terms = calculator.calculate(EntryKind.EARNED_SERVICE, 40_000, GrantContext.none(), NOW);

            assertEquals(EntryStatus.PENDING, terms.getInitialStatus());
            assertEquals(NOW.plus(Duration.ofDays(7)), terms.getAvailableFrom());
            assertEquals(NOW.plus(Duration.ofDays(7 + 365)), terms.getExpiresAt());
        }

        @Test
        @DisplayName("A purchase too small to earn a point is an invalid amount")
        void testTooSmall() {
            InvalidAmountException e = assertThrows(InvalidAmountException.class,
                () -> calculator.calculate(EntryKind.EARNED_SERVICE, 39, GrantContext.none(), NOW));
            assertEquals(LedgerErrorCode.INVALID_AMOUNT, e.getErrorCode());
        }

        @Test
        @DisplayName("Non-positive purchase amounts are rejected")
        void testNonPositive() {
            assertThrows(InvalidAmountException.class,
                () -> calculator.calculate(EntryKind.EARNED_SERVICE, 0, GrantContext.none(), NOW));
            assertThrows(InvalidAmountException.class,
                () -> calculator.calculate(EntryKind.EARNED_SERVICE, -100, GrantContext.none(), NOW));
        }

        @Test
        @DisplayName("A non-positive tier multiplier is rejected")
        void testBadTier() {
            GrantContext context = GrantContext.builder().tierMultiplier(BigDecimal.ZERO).build();
            assertThrows(IllegalArgumentException.class,
                () -> calculator.calculate(EntryKind.EARNED_SERVICE, 40_000, context, NOW));
        }
    }

    @Nested
    @DisplayName("Bonus kinds")
    class Bonuses {

        @Test
        @DisplayName("Referral bonus is the fixed 1,000 regardless of base amount")
        void testReferral() {
            GrantTerms terms = calculator.calculate(EntryKind.EARNED_REFERRAL, 1, GrantContext.none(), NOW);

            assertEquals(1_000, terms.getAmount());
            assertEquals(EntryStatus.PENDING, terms.getInitialStatus());
        }

        @Test
        @DisplayName("Influencer bonus doubles only for influencers")
        void testInfluencerBonus() {
            GrantContext influencer = GrantContext.builder().influencer(true).build();

            assertEquals(1_000,
                calculator.calculate(EntryKind.INFLUENCER_BONUS, 500, influencer, NOW).getAmount());
            assertEquals(500,
                calculator.calculate(EntryKind.INFLUENCER_BONUS, 500, GrantContext.none(), NOW).getAmount());
        }

        @Test
        @DisplayName("Admin grants are available immediately and require a reason")
        void testAdminGrant() {
            GrantContext context = GrantContext.builder().reason("compensation for outage").build();
            GrantTerms terms = calculator.calculate(EntryKind.ADJUSTED_BY_ADMIN, 250, context, NOW);

            assertEquals(250, terms.getAmount());
            assertEquals(EntryStatus.AVAILABLE, terms.getInitialStatus());
            assertEquals(NOW, terms.getAvailableFrom());
            assertEquals(NOW.plus(Duration.ofDays(365)), terms.getExpiresAt());

            assertThrows(IllegalArgumentException.class,
                () -> calculator.calculate(EntryKind.ADJUSTED_BY_ADMIN, 250, GrantContext.none(), NOW));
        }
    }

    @Nested
    @DisplayName("Engine-recorded kinds")
    class EngineRecorded {

        @Test
        @DisplayName("A non-negative amount for USED_SERVICE or EXPIRED is an invalid amount")
        void testNonNegativeConsumption() {
            assertThrows(InvalidAmountException.class,
                () -> calculator.calculate(EntryKind.USED_SERVICE, 100, GrantContext.none(), NOW));
            assertThrows(InvalidAmountException.class,
                () -> calculator.calculate(EntryKind.EXPIRED, 0, GrantContext.none(), NOW));
        }

        @Test
        @DisplayName("Consumption entries cannot be created as grants at all")
        void testNegativeConsumption() {
            assertThrows(IllegalArgumentException.class,
                () -> calculator.calculate(EntryKind.USED_SERVICE, -100, GrantContext.none(), NOW));
        }
    }

    @Test
    @DisplayName("newGrant carries the computed terms and the context's reservation")
    void testNewGrant() {
        UUID userId = UUID.randomUUID();
        UUID reservationId = UUID.randomUUID();
        GrantContext context = GrantContext.builder().reservationId(reservationId).description("order 42").build();

        LedgerEntry grant = calculator.newGrant(userId, EntryKind.EARNED_SERVICE, 40_000, context, NOW);

        assertEquals(userId, grant.getUserId());
        assertEquals(1_000, grant.getAmount());
        assertEquals(1_000, grant.getRemainingAmount());
        assertEquals(reservationId, grant.getReservationId());
        assertEquals("order 42", grant.getDescription());
        assertEquals(NOW, grant.getCreatedAt());
        assertEquals(0, grant.getVersion());
    }
}
