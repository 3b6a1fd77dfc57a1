package de.bsommerfeld.opencode.usage.app;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import de.bsommerfeld.opencode.usage.core.domain.DisplayMode;
import de.bsommerfeld.opencode.usage.core.domain.UsageMetrics;
import de.bsommerfeld.opencode.usage.db.DatabaseException;
import de.bsommerfeld.opencode.usage.db.DatabaseManager;
import de.bsommerfeld.opencode.usage.reader.ReaderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * Headless launcher: runs one fetch cycle for the display mode given as the
 * first argument ({@code today}, {@code month}, {@code last_month},
 * {@code all_time}; default {@code all_time}) and logs the result.
 */
public final class UsageTrackerApp {

    private static final Logger LOG = LoggerFactory.getLogger(UsageTrackerApp.class);

    private UsageTrackerApp() {
    }

    public static void main(String[] args) {
        DisplayMode mode = args.length > 0
                ? DisplayMode.valueOf(args[0].toUpperCase(Locale.ROOT))
                : DisplayMode.ALL_TIME;

        Injector injector = Guice.createInjector(new UsageModule());
        UsageService service = injector.getInstance(UsageService.class);
        Optional<DatabaseManager> database = injector.getInstance(new Key<Optional<DatabaseManager>>() {
        });

        int exitCode = 0;
        try {
            UsageMetrics metrics = service.fetch(mode);
            LOG.info("{}: {} tokens ({} in, {} out, {} reasoning), cache {} write / {} read, ${}, {} interactions",
                    mode, metrics.totalTokens(), metrics.totalInputTokens(), metrics.totalOutputTokens(),
                    metrics.totalReasoningTokens(), metrics.totalCacheWriteTokens(),
                    metrics.totalCacheReadTokens(), String.format(Locale.ROOT, "%.4f", metrics.totalCost()),
                    metrics.totalInteractions());
            service.applyRetention();
        } catch (ReaderException e) {
            LOG.error("Could not read usage ({}): {}", e.getKind(), e.getMessage());
            exitCode = 1;
        } catch (DatabaseException e) {
            LOG.error("Retention cleanup failed", e);
        } finally {
            database.ifPresent(DatabaseManager::close);
        }
        if (exitCode != 0)
            System.exit(exitCode);
    }
}
