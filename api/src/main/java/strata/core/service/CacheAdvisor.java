package strata.core.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import strata.core.model.CacheRecommendation;
import strata.core.model.CacheRecommendation.Severity;
import strata.core.model.CacheStatistics;
import strata.core.model.EvictionReason;
import strata.core.model.RemoteHealth;

/**
 * Derives tuning recommendations from a statistics snapshot.
 *
 * <p>Each check has a warning and a critical threshold. Rate-based checks stay silent until
 * enough operations have been observed for the rate to mean something.
 */
public class CacheAdvisor {

    static final long MIN_LOOKUPS = 100;
    static final long MIN_OPERATIONS = 50;

    static final double HIT_RATE_WARN = 0.5;
    static final double HIT_RATE_CRITICAL = 0.2;
    static final double ERROR_RATE_WARN = 0.01;
    static final double ERROR_RATE_CRITICAL = 0.1;
    static final double LATENCY_WARN_MS = 50;
    static final double LATENCY_CRITICAL_MS = 250;
    static final double MEMORY_WARN = 0.85;
    static final double MEMORY_CRITICAL = 0.95;

    public List<CacheRecommendation> advise(CacheStatistics stats) {
        var advice = new ArrayList<CacheRecommendation>();
        checkHitRate(stats, advice);
        checkErrorRate(stats, advice);
        checkLatency(stats, advice);
        checkMemoryPressure(stats, advice);
        checkRemote(stats, advice);
        return advice;
    }

    private void checkHitRate(CacheStatistics stats, List<CacheRecommendation> advice) {
        if (stats.hits() + stats.misses() < MIN_LOOKUPS) {
            return;
        }
        var severity = below(stats.hitRate(), HIT_RATE_WARN, HIT_RATE_CRITICAL);
        if (severity != null) {
            advice.add(new CacheRecommendation("low-hit-rate", severity, String.format(Locale.ROOT,
                    "Hit rate is %.1f%%; review key design and TTLs, or warm frequently read keys",
                    stats.hitRate() * 100)));
        }
    }

    private void checkErrorRate(CacheStatistics stats, List<CacheRecommendation> advice) {
        long operations = stats.hits() + stats.misses() + stats.sets() + stats.deletes();
        if (operations < MIN_OPERATIONS) {
            return;
        }
        double rate = (double) stats.errors() / operations;
        var severity = above(rate, ERROR_RATE_WARN, ERROR_RATE_CRITICAL);
        if (severity != null) {
            advice.add(new CacheRecommendation("high-error-rate", severity, String.format(Locale.ROOT,
                    "%d tier errors over %d operations (%.1f%%); check remote tier connectivity and timeouts",
                    stats.errors(), operations, rate * 100)));
        }
    }

    private void checkLatency(CacheStatistics stats, List<CacheRecommendation> advice) {
        if (stats.latency().samples() == 0) {
            return;
        }
        var severity = above(stats.latency().averageMs(), LATENCY_WARN_MS, LATENCY_CRITICAL_MS);
        if (severity != null) {
            advice.add(new CacheRecommendation("slow-operations", severity, String.format(Locale.ROOT,
                    "Average operation latency is %.1f ms (max %.1f ms); prefer the memory tier for hot keys",
                    stats.latency().averageMs(), stats.latency().maxMs())));
        }
    }

    private void checkMemoryPressure(CacheStatistics stats, List<CacheRecommendation> advice) {
        if (stats.memoryBytesBudget() <= 0) {
            return;
        }
        double usage = (double) stats.memoryBytesUsed() / stats.memoryBytesBudget();
        long pressureEvictions = stats.evictions() - stats.evictionsByReason().getOrDefault(EvictionReason.EXPIRED, 0L);
        var severity = above(usage, MEMORY_WARN, MEMORY_CRITICAL);
        if (severity == null && pressureEvictions > 0) {
            severity = Severity.INFO;
        }
        if (severity != null) {
            advice.add(new CacheRecommendation("memory-pressure", severity, String.format(Locale.ROOT,
                    "Memory tier is %.0f%% full with %d eviction(s) under pressure; raise the byte budget or shorten TTLs",
                    usage * 100, pressureEvictions)));
        }
    }

    private void checkRemote(CacheStatistics stats, List<CacheRecommendation> advice) {
        var state = stats.remote().state();
        if (state == RemoteHealth.UNREACHABLE) {
            advice.add(new CacheRecommendation("remote-unavailable", Severity.CRITICAL,
                    "Remote tier is unreachable; reads and writes are served by the remaining tiers"
                            + lastError(stats)));
        } else if (state == RemoteHealth.DEGRADED) {
            advice.add(new CacheRecommendation("remote-unavailable", Severity.WARNING,
                    "Remote tier is recovering and not yet trusted" + lastError(stats)));
        }
    }

    private static String lastError(CacheStatistics stats) {
        var error = stats.remote().lastError();
        return error == null ? "" : " (last error: " + error + ")";
    }

    private static Severity above(double value, double warn, double critical) {
        if (value >= critical) {
            return Severity.CRITICAL;
        }
        return value >= warn ? Severity.WARNING : null;
    }

    private static Severity below(double value, double warn, double critical) {
        if (value <= critical) {
            return Severity.CRITICAL;
        }
        return value < warn ? Severity.WARNING : null;
    }
}
