package org.flutterjs.analyzer.api;

/**
 * A progress event emitted by the analyzer.
 *
 * @param phase     The phase the event belongs to.
 * @param current   Units of work done in this phase.
 * @param total     Units of work in this phase, {@code 0} when unknown.
 * @param message   A short human readable description.
 * @param timestamp Epoch milliseconds when the event was created.
 */
public record AnalysisProgress(AnalysisPhase phase, int current, int total, String message, long timestamp) {

    public static AnalysisProgress of(AnalysisPhase phase, int current, int total, String message) {
        return new AnalysisProgress(phase, current, total, message, System.currentTimeMillis());
    }

    /**
     * @return Completion of the phase in percent, {@code 100} when the total is unknown.
     */
    public double percentage() {
        return total <= 0 ? 100.0 : (current * 100.0) / total;
    }

    @Override
    public String toString() {
        return String.format("[%s] %d/%d (%.0f%%) %s", phase, current, total, percentage(), message);
    }
}
