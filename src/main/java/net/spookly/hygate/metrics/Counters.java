package net.spookly.hygate.metrics;

/**
 * Immutable request counters with a running average latency. Updated by swapping instances.
 */
final class Counters {
    static final Counters EMPTY = new Counters(0, 0, 0, 0);

    final long requests;
    final long successes;
    final long failures;
    final double averageMs;

    private Counters(long requests, long successes, long failures, double averageMs) {
        this.requests = requests;
        this.successes = successes;
        this.failures = failures;
        this.averageMs = averageMs;
    }

    Counters add(RequestOutcome outcome, long latencyMs) {
        long n = requests + 1;
        double average = (averageMs * (n - 1) + latencyMs) / n;
        if (outcome == RequestOutcome.SUCCESS) {
            return new Counters(n, successes + 1, failures, average);
        }
        return new Counters(n, successes, failures + 1, average);
    }

    static double failureRate(long failures, long requests) {
        return requests == 0 ? 0 : (double) failures / requests;
    }
}
