package space.ketterling.weatherpredict.fetch;

import space.ketterling.weatherpredict.model.ObservationRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Per-year records assembled for one prediction request, ordered by year.
 */
public final class Sample {
    private final List<YearResult> results;
    private final int yearsRequested;

    public Sample(List<YearResult> results, int yearsRequested) {
        List<YearResult> sorted = new ArrayList<>(results);
        sorted.sort(Comparator.comparingInt(YearResult::year));
        this.results = List.copyOf(sorted);
        this.yearsRequested = yearsRequested;
    }

    public List<YearResult> results() {
        return results;
    }

    public List<ObservationRecord> records() {
        return results.stream().map(YearResult::record).toList();
    }

    public List<Integer> years() {
        return results.stream().map(YearResult::year).toList();
    }

    /**
     * Years whose record was synthesized instead of observed.
     */
    public List<Integer> degradedYears() {
        return results.stream().filter(YearResult::isFallback).map(YearResult::year).toList();
    }

    public int yearsRequested() {
        return yearsRequested;
    }

    public int size() {
        return results.size();
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }
}
