/*
* Copyright 2025 Taylor Ketterling
* Main application entry point for WeatherPredict, a historical point weather prediction service.
*
* Loads configuration, sets up the file cache and its compaction schedule, picks the
* historical data provider (synthetic climatology or the NASA POWER archive), and starts
* the API server. The program also handles a graceful shutdown.
*/

package space.ketterling.weatherpredict;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.weatherpredict.api.ApiServer;
import space.ketterling.weatherpredict.archive.ArchiveCredentials;
import space.ketterling.weatherpredict.cache.CacheCompactionScheduler;
import space.ketterling.weatherpredict.cache.FileCacheStore;
import space.ketterling.weatherpredict.climatology.ClimatologyEstimator;
import space.ketterling.weatherpredict.climatology.ClimatologyProvider;
import space.ketterling.weatherpredict.config.AppConfig;
import space.ketterling.weatherpredict.fetch.ConcurrentFetchOrchestrator;
import space.ketterling.weatherpredict.fetch.HistoricalDataProvider;
import space.ketterling.weatherpredict.power.PowerArchiveClient;
import space.ketterling.weatherpredict.predict.PredictionService;
import space.ketterling.weatherpredict.predict.StatisticalPredictionEngine;

import java.nio.file.Path;
import java.time.Clock;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        log.info("Starting application");
        AppConfig cfg = AppConfig.load();
        log.info("Loaded {}", cfg);

        ObjectMapper om = new ObjectMapper();
        Clock clock = Clock.system(cfg.clockZoneId());
        ClimatologyEstimator estimator = new ClimatologyEstimator();

        FileCacheStore cache = new FileCacheStore(Path.of(cfg.cacheDir()), om);
        CacheCompactionScheduler compaction = new CacheCompactionScheduler(cache, cfg.cacheMaxEntries(),
                cfg.cacheCompaction());
        compaction.start();

        final HistoricalDataProvider provider;
        final ConcurrentFetchOrchestrator orchestrator;
        if (cfg.useArchive()) {
            ArchiveCredentials creds = new ArchiveCredentials(cfg.archiveUsername(), cfg.archivePassword());
            PowerArchiveClient power = new PowerArchiveClient(cfg, om, creds);
            ConcurrentFetchOrchestrator.checkTimeoutBudget(cfg.archiveTimeout(), cfg.fetchDeadline());
            orchestrator = new ConcurrentFetchOrchestrator(cache, power, estimator, cfg.fetchDeadline(), clock);
            provider = orchestrator;
        } else {
            log.info("Archive disabled by config, serving synthetic climatology");
            orchestrator = null;
            provider = new ClimatologyProvider(estimator, clock);
        }

        PredictionService predictions = new PredictionService(
                new StatisticalPredictionEngine(cfg.confidencePolicy()), cfg.yearsBack());

        ApiServer api = new ApiServer(cfg, om, predictions, provider, cache);
        api.start();
        log.info("API server started on port {} using provider {}", cfg.apiPort(), provider.name());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down...");
                api.stop();
                compaction.stop();
                if (orchestrator != null)
                    orchestrator.close();
            } catch (Exception e) {
                log.error("Shutdown error", e);
            }
        }));
    }
}
