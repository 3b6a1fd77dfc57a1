package de.bsommerfeld.opencode.usage.app;

import de.bsommerfeld.opencode.usage.collector.CollectorException;
import de.bsommerfeld.opencode.usage.collector.DataCollector;
import de.bsommerfeld.opencode.usage.core.config.TrackerConfig;
import de.bsommerfeld.opencode.usage.core.domain.DisplayMode;
import de.bsommerfeld.opencode.usage.core.domain.UsageMetrics;
import de.bsommerfeld.opencode.usage.core.event.ApplicationEventBus;
import de.bsommerfeld.opencode.usage.core.event.UsageEvents.UsageRefreshedEvent;
import de.bsommerfeld.opencode.usage.db.SnapshotRepository;
import de.bsommerfeld.opencode.usage.reader.ReaderException;
import de.bsommerfeld.opencode.usage.reader.UsageReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UsageServiceTest {

    private static final UsageMetrics METRICS =
            new UsageMetrics(200, 100, 0, 0, 20, 0.02, 2, Instant.parse("2026-10-17T12:00:00Z"));

    @Mock
    private UsageReader reader;

    @Mock
    private DataCollector collector;

    @Mock
    private SnapshotRepository repository;

    @Mock
    private ApplicationEventBus eventBus;

    private final TrackerConfig config = new TrackerConfig();

    @Test
    void fetch_shouldOfferMetricsToCollectorAndPostEvent() throws Exception {
        when(reader.getUsage(DisplayMode.TODAY)).thenReturn(METRICS);
        UsageService service = service(true);

        assertSame(METRICS, service.fetch(DisplayMode.TODAY));

        verify(collector).collectAndSave(METRICS);
        verify(eventBus).post(new UsageRefreshedEvent(DisplayMode.TODAY, METRICS));
    }

    @Test
    void fetch_shouldSucceedWhenCollectorFails() throws Exception {
        when(reader.getUsage(DisplayMode.ALL_TIME)).thenReturn(METRICS);
        when(collector.collectAndSave(any())).thenThrow(new CollectorException("busy"));
        UsageService service = service(true);

        assertSame(METRICS, service.fetch(DisplayMode.ALL_TIME));
        verify(eventBus).post(any(UsageRefreshedEvent.class));
    }

    @Test
    void fetch_shouldWorkWithoutPersistence() throws Exception {
        when(reader.getUsage(DisplayMode.MONTH)).thenReturn(METRICS);
        UsageService service = service(false);

        assertSame(METRICS, service.fetch(DisplayMode.MONTH));
        assertFalse(service.persistenceAvailable());
        verifyNoInteractions(collector);
    }

    @Test
    void fetch_shouldPropagateReaderFailureWithoutSnapshot() throws Exception {
        when(reader.getUsage(DisplayMode.ALL_TIME))
                .thenThrow(new ReaderException(ReaderException.Kind.NO_DATA, "No usage data found"));
        UsageService service = service(true);

        ReaderException e = assertThrows(ReaderException.class, () -> service.fetch(DisplayMode.ALL_TIME));

        assertEquals(ReaderException.Kind.NO_DATA, e.getKind());
        verifyNoInteractions(collector, eventBus);
    }

    @Test
    void history_shouldBeEmptyWithoutPersistence() throws Exception {
        UsageService service = service(false);

        assertTrue(service.history(LocalDate.of(2026, 10, 1), LocalDate.of(2026, 10, 31)).isEmpty());
        assertEquals(0, service.applyRetention());
    }

    @Test
    void applyRetention_shouldUseConfiguredRetention() throws Exception {
        config.setRetentionDays(90);
        when(repository.deleteOld(90)).thenReturn(4);

        assertEquals(4, service(true).applyRetention());
    }

    private UsageService service(boolean persistence) {
        return new UsageService(reader,
                persistence ? Optional.of(collector) : Optional.empty(),
                persistence ? Optional.of(repository) : Optional.empty(),
                eventBus, config);
    }
}
