package com.flagship.point_ledger.store.jpa;

import com.flagship.point_ledger.accrual.GrantContext;
import com.flagship.point_ledger.ledger.ConsumedDraw;
import com.flagship.point_ledger.ledger.EntryKind;
import com.flagship.point_ledger.ledger.EntryStatus;
import com.flagship.point_ledger.ledger.LedgerEntry;
import com.flagship.point_ledger.ledger.PointLedgerService;
import com.flagship.point_ledger.ledger.UsageRecord;
import com.flagship.point_ledger.ledger.UsageStatus;
import com.flagship.point_ledger.store.EntryOrder;
import com.flagship.point_ledger.store.HistoryFilter;
import com.flagship.point_ledger.store.LedgerStore;
import com.flagship.point_ledger.store.VersionConflictException;
import com.flagship.point_ledger.store.WriteBatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tries to break the PostgreSQL store: stale writes, partial batches, rows the schema must refuse.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class JpaLedgerStoreTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("test_point_ledger")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("point-ledger.store", () -> "jpa");
    }

    @Autowired
    private LedgerStore store;

    @Autowired
    private PointLedgerService service;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private UUID userId;
    private Instant now;

    @BeforeEach
    void setUp() {
        userId = UUID.randomUUID();
        // Postgres keeps microseconds
        now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private LedgerEntry insertGrant(long amount, Instant availableFrom, EntryStatus status) {
        LedgerEntry grant = LedgerEntry.grant(UUID.randomUUID(), userId, EntryKind.EARNED_SERVICE, amount, status,
            availableFrom, availableFrom.plus(Duration.ofDays(365)), null, "grant " + amount, availableFrom);
        store.atomicWrite(new WriteBatch().insertEntry(grant));
        return store.getEntry(grant.getId()).orElseThrow();
    }

    @Test
    @DisplayName("Inserted rows start at version 0 and each conditional update bumps it")
    void testVersionIncrements() {
        LedgerEntry v0 = insertGrant(100, now.minus(Duration.ofDays(1)), EntryStatus.AVAILABLE);

        store.atomicWrite(new WriteBatch().updateEntry(v0, v0.draw(30, now)));
        LedgerEntry v1 = store.getEntry(v0.getId()).orElseThrow();

        assertEquals(0, v0.getVersion());
        assertEquals(1, v1.getVersion());
        assertEquals(70, v1.getRemainingAmount());
        assertEquals(EntryStatus.AVAILABLE, v1.getStatus());
    }

    @Test
    @DisplayName("A stale update rolls back the whole transaction, inserts included")
    void testStaleBatchRolledBack() {
        printTestHeader("Stale Batch Rolled Back");

        LedgerEntry stale = insertGrant(100, now.minus(Duration.ofDays(1)), EntryStatus.AVAILABLE);
        store.atomicWrite(new WriteBatch().updateEntry(stale, stale.draw(10, now)));

        LedgerEntry unrelated = LedgerEntry.grant(UUID.randomUUID(), userId, EntryKind.EARNED_SERVICE, 50,
            EntryStatus.AVAILABLE, now, now.plus(Duration.ofDays(365)), null, null, now);
        WriteBatch batch = new WriteBatch()
            .insertEntry(unrelated)
            .updateEntry(stale, stale.draw(20, now));

        VersionConflictException e = assertThrows(VersionConflictException.class, () -> store.atomicWrite(batch));
        printOutput("Conflict", e.getMessage());

        assertTrue(store.getEntry(unrelated.getId()).isEmpty(), "Insert of a failed batch must not be committed");
        assertEquals(90, store.getEntry(stale.getId()).orElseThrow().getRemainingAmount());
    }

    @Test
    @DisplayName("The schema refuses a remaining amount above the grant amount")
    void testSchemaRejectsOverRestore() {
        LedgerEntry grant = insertGrant(100, now.minus(Duration.ofDays(1)), EntryStatus.AVAILABLE);

        assertThrows(DataIntegrityViolationException.class, () -> jdbcTemplate.update(
            "UPDATE ledger_entries SET remaining_amount = 150 WHERE id = ?", grant.getId()));
    }

    @Test
    @DisplayName("Usage draws round-trip in FIFO order and rollback restores them")
    void testSpendAndRollbackEndToEnd() {
        printTestHeader("Spend And Rollback Against PostgreSQL");

        LedgerEntry first = insertGrant(300, now.minus(Duration.ofDays(10)), EntryStatus.AVAILABLE);
        LedgerEntry second = insertGrant(300, now.minus(Duration.ofDays(9)), EntryStatus.AVAILABLE);

        UsageRecord usage = service.spend(userId, 400, UUID.randomUUID());
        UsageRecord stored = store.getUsageRecord(usage.getId()).orElseThrow();
        printOutput("Stored usage", stored);

        assertEquals(List.of(ConsumedDraw.of(first.getId(), 300), ConsumedDraw.of(second.getId(), 100)),
            stored.getConsumedFrom());
        assertEquals(EntryStatus.USED, store.getEntry(first.getId()).orElseThrow().getStatus());
        assertEquals(200, service.getBalance(userId).getAvailableBalance());

        UsageRecord rolledBack = service.rollback(usage.getId(), "reservation cancelled");

        assertEquals(UsageStatus.ROLLED_BACK, rolledBack.getStatus());
        assertEquals(UsageStatus.ROLLED_BACK, store.getUsageRecord(usage.getId()).orElseThrow().getStatus());
        assertEquals(300, store.getEntry(first.getId()).orElseThrow().getRemainingAmount());
        assertEquals(300, store.getEntry(second.getId()).orElseThrow().getRemainingAmount());
        assertEquals(EntryStatus.CANCELLED, store.getEntry(usage.getSpendEntryId()).orElseThrow().getStatus());
        assertEquals(600, service.getBalance(userId).getAvailableBalance());
    }

    @Test
    @DisplayName("Due queries and history filters run in the database")
    void testQueries() {
        LedgerEntry due = insertGrant(100, now.minus(Duration.ofHours(1)), EntryStatus.PENDING);
        LedgerEntry held = insertGrant(200, now.plus(Duration.ofDays(3)), EntryStatus.PENDING);
        service.createGrant(userId, EntryKind.ADJUSTED_BY_ADMIN, 50,
            GrantContext.builder().reason("goodwill").build());

        List<UUID> dueIds = store.findDueForMaturation(now).stream().map(LedgerEntry::getId).toList();
        assertTrue(dueIds.contains(due.getId()));
        assertFalse(dueIds.contains(held.getId()));

        assertEquals(3, store.findByUser(userId, null, EntryOrder.FIFO).size());
        assertEquals(2, store.findByUser(userId, EntryStatus.PENDING, EntryOrder.FIFO).size());

        Page<LedgerEntry> firstPage = store.findHistory(userId, HistoryFilter.none(), PageRequest.of(0, 2));
        assertEquals(3, firstPage.getTotalElements());
        assertEquals(2, firstPage.getContent().size());

        Page<LedgerEntry> adminOnly = store.findHistory(userId,
            HistoryFilter.builder().kind(EntryKind.ADJUSTED_BY_ADMIN).build(), PageRequest.of(0, 10));
        assertEquals(1, adminOnly.getTotalElements());
        assertEquals(50, adminOnly.getContent().get(0).getAmount());
    }

    @Test
    @DisplayName("An unpaged history request returns every entry of the user newest first")
    void testUnpagedHistory() {
        insertGrant(100, now.minus(Duration.ofDays(2)), EntryStatus.AVAILABLE);
        insertGrant(200, now.minus(Duration.ofDays(1)), EntryStatus.AVAILABLE);
        insertGrant(300, now, EntryStatus.AVAILABLE);

        Page<LedgerEntry> all = store.findHistory(userId, HistoryFilter.none(), Pageable.unpaged());

        assertEquals(3, all.getTotalElements());
        assertEquals(List.of(300L, 200L, 100L),
            all.getContent().stream().map(LedgerEntry::getAmount).toList());
    }
}
