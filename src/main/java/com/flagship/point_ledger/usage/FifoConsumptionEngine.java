package com.flagship.point_ledger.usage;

import com.flagship.point_ledger.ledger.ConsumedDraw;
import com.flagship.point_ledger.ledger.EntryKind;
import com.flagship.point_ledger.ledger.EntryStatus;
import com.flagship.point_ledger.ledger.LedgerEntry;
import com.flagship.point_ledger.ledger.UsageRecord;
import com.flagship.point_ledger.ledger.exception.InsufficientFundsException;
import com.flagship.point_ledger.ledger.exception.InvalidAmountException;
import com.flagship.point_ledger.store.EntryOrder;
import com.flagship.point_ledger.store.LedgerStore;
import com.flagship.point_ledger.store.OptimisticRetryExecutor;
import com.flagship.point_ledger.store.WriteBatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Spends a user's oldest spendable credits first.
 *
 * One attempt reads the user's AVAILABLE grants, checks the balance against that same read,
 * plans the draws and writes the grant decrements, the spend entry and the usage record as a
 * single batch. A version conflict restarts the attempt from the read.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FifoConsumptionEngine {

    private final LedgerStore store;
    private final OptimisticRetryExecutor retryExecutor;
    private final Clock clock;

    /**
     * Spends points against a reservation.
     *
     * @throws InvalidAmountException if amount is not positive
     * @throws InsufficientFundsException if the spendable balance is below amount
     */
    public UsageRecord spend(UUID userId, long amount, UUID reservationId) {
        return consume("spend", userId, amount, EntryKind.USED_SERVICE, reservationId,
            reservationId != null ? "Used for reservation " + reservationId : "Point usage");
    }

    /**
     * Takes points away on an operator's behalf, drawing FIFO like a spend.
     * The resulting usage record can be rolled back like any other.
     */
    public UsageRecord deduct(UUID userId, long amount, String reason) {
        return consume("adminDeduction", userId, amount, EntryKind.ADJUSTED_BY_ADMIN, null, reason);
    }

    private UsageRecord consume(String operation, UUID userId, long amount, EntryKind spendKind,
                                UUID reservationId, String description) {
        if (amount <= 0) {
            throw new InvalidAmountException("Spend amount must be positive, got " + amount);
        }
        return retryExecutor.execute(operation, () -> attempt(userId, amount, spendKind, reservationId, description));
    }

    private UsageRecord attempt(UUID userId, long amount, EntryKind spendKind, UUID reservationId,
                                String description) {
        Instant now = clock.instant();
        List<LedgerEntry> eligible = store.findByUser(userId, EntryStatus.AVAILABLE, EntryOrder.FIFO).stream()
            .filter(e -> e.isSpendableAt(now))
            .toList();

        long spendable = eligible.stream().mapToLong(LedgerEntry::getRemainingAmount).sum();
        if (spendable < amount) {
            throw new InsufficientFundsException(userId, amount, spendable);
        }

        List<ConsumedDraw> draws = planDraws(eligible, amount);
        Map<UUID, LedgerEntry> byId = new HashMap<>();
        eligible.forEach(e -> byId.put(e.getId(), e));

        UUID usageId = UUID.randomUUID();
        UUID spendEntryId = UUID.randomUUID();
        WriteBatch batch = new WriteBatch();
        for (ConsumedDraw draw : draws) {
            LedgerEntry grant = byId.get(draw.getGrantEntryId());
            batch.updateEntry(grant, grant.draw(draw.getAmountDrawn(), now));
        }
        LedgerEntry spendEntry = LedgerEntry.spend(spendEntryId, userId, spendKind, amount, usageId,
            reservationId, description, now);
        UsageRecord usage = UsageRecord.commit(usageId, userId, reservationId, draws, spendEntryId, now);
        batch.insertEntry(spendEntry).insertUsage(usage);

        store.atomicWrite(batch);
        log.debug("Consumed points: userId={}, usageRecordId={}, amount={}, grantsTouched={}",
            userId, usageId, amount, draws.size());
        return usage;
    }

    /**
     * Walks FIFO-ordered grants taking min(remaining, still needed) from each until amount is covered.
     *
     * @param fifoOrdered spendable grants, oldest first
     * @throws IllegalArgumentException if the grants cannot cover amount
     */
    public static List<ConsumedDraw> planDraws(List<LedgerEntry> fifoOrdered, long amount) {
        List<ConsumedDraw> draws = new ArrayList<>();
        long stillNeeded = amount;
        for (LedgerEntry grant : fifoOrdered) {
            if (stillNeeded == 0) {
                break;
            }
            long take = Math.min(grant.getRemainingAmount(), stillNeeded);
            if (take > 0) {
                draws.add(ConsumedDraw.of(grant.getId(), take));
                stillNeeded -= take;
            }
        }
        if (stillNeeded > 0) {
            throw new IllegalArgumentException(
                String.format("Grants cover only %d of %d points", amount - stillNeeded, amount));
        }
        return draws;
    }
}
