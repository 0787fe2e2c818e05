package net.spookly.hygate.routing;

import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Running average response time per instance: {@code newAvg = (oldAvg * (n - 1) + sample) / n}.
 */
public final class ResponseTimeTracker {
    private final Map<String, Average> averages = new ConcurrentHashMap<>();

    public void record(String instanceId, long responseTimeMs) {
        if (instanceId == null) {
            return;
        }
        averages.compute(instanceId, (key, current) -> (current == null ? Average.EMPTY : current).add(responseTimeMs));
    }

    /**
     * Average in milliseconds, 0 for instances without samples.
     */
    public double average(String instanceId) {
        Average average = instanceId == null ? null : averages.get(instanceId);
        return average == null ? 0 : average.value;
    }

    public long samples(String instanceId) {
        Average average = instanceId == null ? null : averages.get(instanceId);
        return average == null ? 0 : average.count;
    }

    public void retain(Collection<String> knownInstanceIds) {
        Set<String> known = new HashSet<>(knownInstanceIds);
        averages.keySet().removeIf(id -> !known.contains(id));
    }

    private static final class Average {
        private static final Average EMPTY = new Average(0, 0);

        private final long count;
        private final double value;

        private Average(long count, double value) {
            this.count = count;
            this.value = value;
        }

        private Average add(long sample) {
            long n = count + 1;
            return new Average(n, (value * (n - 1) + sample) / n);
        }
    }
}
