package space.ketterling.weatherpredict.climatology;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.weatherpredict.fetch.FetchRequests;
import space.ketterling.weatherpredict.fetch.HistoricalDataProvider;
import space.ketterling.weatherpredict.fetch.Sample;
import space.ketterling.weatherpredict.fetch.YearResult;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Fully synthetic provider for development and demos: every year comes from
 * the climatology estimator, no network involved.
 *
 * <p>
 * One generator is seeded per request from the point and day, so repeating a
 * request returns the same sample.
 * </p>
 */
public final class ClimatologyProvider implements HistoricalDataProvider {
    private static final Logger log = LoggerFactory.getLogger(ClimatologyProvider.class);
    static final String REASON = "synthetic provider";

    private final ClimatologyEstimator estimator;
    private final Clock clock;

    public ClimatologyProvider(ClimatologyEstimator estimator, Clock clock) {
        this.estimator = estimator;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "climatology";
    }

    @Override
    public Sample fetch(double lat, double lon, int month, int day, int yearsBack) {
        FetchRequests.validate(lat, lon, month, day, yearsBack);
        Random rnd = new Random(ClimatologyEstimator.seedFor(lat, lon, month, day));

        List<YearResult> out = new ArrayList<>(yearsBack);
        for (int year : FetchRequests.years(clock, yearsBack)) {
            out.add(YearResult.fallback(estimator.estimate(lat, lon, month, year, rnd), REASON));
        }
        log.debug("Synthesized {} years for ({}, {}) {}-{}", out.size(), lat, lon, month, day);
        return new Sample(out, yearsBack);
    }
}
