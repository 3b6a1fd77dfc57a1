package de.bsommerfeld.opencode.usage.collector;

import de.bsommerfeld.opencode.usage.core.domain.UsageMetrics;
import de.bsommerfeld.opencode.usage.core.event.ApplicationEventBus;
import de.bsommerfeld.opencode.usage.core.event.UsageEvents.SnapshotCollectedEvent;
import de.bsommerfeld.opencode.usage.db.DatabaseException;
import de.bsommerfeld.opencode.usage.db.SnapshotRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DataCollectorTest {

    private static final Instant NOW = Instant.parse("2026-10-17T12:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2026, 10, 17);

    @Mock
    private SnapshotRepository repository;

    @Mock
    private ApplicationEventBus eventBus;

    private MutableClock clock;
    private DataCollector collector;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW, ZoneOffset.UTC);
        collector = new DataCollector(repository, clock, eventBus);
    }

    @Test
    void collectAndSave_shouldSaveFirstSnapshotOfTheDay() throws Exception {
        UsageMetrics metrics = metrics();

        assertTrue(collector.collectAndSave(metrics));

        verify(repository).saveSnapshot(TODAY, metrics);
        verify(eventBus).post(new SnapshotCollectedEvent(TODAY, metrics));
        assertEquals(Optional.of(TODAY), collector.lastCollectionDate());
    }

    @Test
    void collectAndSave_shouldSkipSecondCallOnSameDay() throws Exception {
        collector.collectAndSave(metrics());
        clock.advance(Duration.ofHours(11));

        assertFalse(collector.collectAndSave(metrics()));

        verify(repository, times(1)).saveSnapshot(any(), any());
        verify(eventBus, times(1)).post(any());
    }

    @Test
    void collectAndSave_shouldSaveAgainAfterUtcMidnight() throws Exception {
        collector.collectAndSave(metrics());
        clock.advance(Duration.ofHours(12));

        assertTrue(collector.collectAndSave(metrics()));

        verify(repository).saveSnapshot(eq(TODAY.plusDays(1)), any());
        assertEquals(Optional.of(TODAY.plusDays(1)), collector.lastCollectionDate());
    }

    @Test
    void collectAndSave_shouldUseUtcDateRegardlessOfClockZone() throws Exception {
        // 01:30 on the 18th in Berlin is still the 17th in UTC
        MutableClock berlin = new MutableClock(Instant.parse("2026-10-17T23:30:00Z"), ZoneId.of("Europe/Berlin"));
        DataCollector zoned = new DataCollector(repository, berlin, eventBus);

        zoned.collectAndSave(metrics());

        verify(repository).saveSnapshot(eq(TODAY), any());
    }

    @Test
    void collectAndSave_shouldKeepMarkerOnDatabaseFailure() throws Exception {
        doThrow(new DatabaseException(DatabaseException.Kind.QUERY, "disk full"))
                .doNothing()
                .when(repository).saveSnapshot(any(), any());

        CollectorException e = assertThrows(CollectorException.class, () -> collector.collectAndSave(metrics()));

        assertEquals(CollectorException.Kind.DATABASE, e.getKind());
        assertInstanceOf(DatabaseException.class, e.getCause());
        assertEquals(Optional.empty(), collector.lastCollectionDate());
        verify(eventBus, never()).post(any());

        assertTrue(collector.collectAndSave(metrics()));
    }

    @Test
    void collectAndSave_shouldWriteOnceUnderConcurrentCalls() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Callable<Boolean>> calls = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            calls.add(() -> {
                start.await();
                return collector.collectAndSave(metrics());
            });
        }

        try {
            List<Future<Boolean>> futures = new ArrayList<>();
            for (Callable<Boolean> call : calls)
                futures.add(pool.submit(call));
            start.countDown();

            int saved = 0;
            for (Future<Boolean> future : futures) {
                if (future.get(10, TimeUnit.SECONDS))
                    saved++;
            }
            assertEquals(1, saved);
        } finally {
            pool.shutdownNow();
        }
        verify(repository, times(1)).saveSnapshot(any(), any());
    }

    @Test
    void collectAndSave_shouldFailWithLockKindWhenMarkerIsBusy() throws Exception {
        DataCollector impatient = new DataCollector(repository, clock, eventBus, Duration.ofMillis(50));
        CountDownLatch saving = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            saving.countDown();
            release.await(10, TimeUnit.SECONDS);
            return null;
        }).when(repository).saveSnapshot(any(), any());

        Thread holder = new Thread(() -> {
            try {
                impatient.collectAndSave(metrics());
            } catch (CollectorException e) {
                throw new IllegalStateException(e);
            }
        });
        holder.start();
        try {
            assertTrue(saving.await(5, TimeUnit.SECONDS));

            CollectorException e = assertThrows(CollectorException.class,
                    () -> impatient.collectAndSave(metrics()));
            assertEquals(CollectorException.Kind.LOCK, e.getKind());
            assertTrue(impatient.shouldCollect());
        } finally {
            release.countDown();
            holder.join();
        }
    }

    @Test
    void shouldCollect_shouldReflectMarkerWithoutSideEffects() throws Exception {
        assertTrue(collector.shouldCollect());
        verifyNoInteractions(repository);

        collector.collectAndSave(metrics());
        assertFalse(collector.shouldCollect());

        clock.advance(Duration.ofDays(1));
        assertTrue(collector.shouldCollect());
    }

    private static UsageMetrics metrics() {
        return new UsageMetrics(200, 100, 0, 0, 20, 0.02, 2, NOW);
    }
}
