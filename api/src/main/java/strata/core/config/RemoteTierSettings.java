package strata.core.config;

import java.time.Duration;
import java.util.Optional;

/**
 * Resolved remote tier settings.
 */
public record RemoteTierSettings(
        boolean enabled,
        Optional<String> provider,
        String keyPrefix,
        Duration defaultTtl,
        Duration commandTimeout,
        boolean compression,
        HealthSettings health,
        ReconnectSettings reconnect) {

    public static RemoteTierSettings from(CacheConfig.RemoteConfig config) {
        return new RemoteTierSettings(
                config.enabled(),
                config.provider(),
                config.keyPrefix(),
                config.defaultTtl(),
                config.commandTimeout(),
                config.compression(),
                HealthSettings.from(config.health()),
                ReconnectSettings.from(config.reconnect()));
    }

    public static RemoteTierSettings defaults() {
        return new RemoteTierSettings(
                true,
                Optional.empty(),
                "strata",
                Duration.ofHours(2),
                Duration.ofMillis(250),
                false,
                HealthSettings.defaults(),
                ReconnectSettings.defaults());
    }

    public RemoteTierSettings withCompression(boolean value) {
        return new RemoteTierSettings(
                enabled, provider, keyPrefix, defaultTtl, commandTimeout, value, health, reconnect);
    }

    public RemoteTierSettings withCommandTimeout(Duration timeout) {
        return new RemoteTierSettings(enabled, provider, keyPrefix, defaultTtl, timeout, compression, health, reconnect);
    }

    public RemoteTierSettings withHealth(HealthSettings value) {
        return new RemoteTierSettings(enabled, provider, keyPrefix, defaultTtl, commandTimeout, compression, value, reconnect);
    }

    public RemoteTierSettings withReconnect(ReconnectSettings value) {
        return new RemoteTierSettings(enabled, provider, keyPrefix, defaultTtl, commandTimeout, compression, health, value);
    }

    public RemoteTierSettings disabled() {
        return new RemoteTierSettings(
                false, provider, keyPrefix, defaultTtl, commandTimeout, compression, health, reconnect);
    }

    /**
     * Health monitor thresholds.
     */
    public record HealthSettings(Duration checkInterval, Duration timeout, int failureThreshold, int successThreshold) {

        public HealthSettings {
            if (failureThreshold < 1 || successThreshold < 1) {
                throw new IllegalArgumentException("Health thresholds must be at least 1");
            }
        }

        public static HealthSettings from(CacheConfig.HealthConfig config) {
            return new HealthSettings(
                    config.checkInterval(), config.timeout(), config.failureThreshold(), config.successThreshold());
        }

        public static HealthSettings defaults() {
            return new HealthSettings(Duration.ofSeconds(30), Duration.ofSeconds(5), 3, 2);
        }
    }

    /**
     * Exponential reconnect backoff.
     */
    public record ReconnectSettings(Duration initialDelay, double multiplier, Duration maxDelay, int maxAttempts) {

        public ReconnectSettings {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Reconnect multiplier must be at least 1.0: " + multiplier);
            }
        }

        public static ReconnectSettings from(CacheConfig.ReconnectConfig config) {
            return new ReconnectSettings(
                    config.initialDelay(), config.multiplier(), config.maxDelay(), config.maxAttempts());
        }

        public static ReconnectSettings defaults() {
            return new ReconnectSettings(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30), 10);
        }

        /**
         * Delay before the given attempt (1-based): {@code initialDelay * multiplier^(attempt-1)},
         * capped at {@code maxDelay}. Attempts past {@code maxAttempts} use {@code maxDelay}.
         */
        public Duration delayForAttempt(int attempt) {
            if (attempt > maxAttempts) {
                return maxDelay;
            }
            double millis = initialDelay.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
            if (millis >= maxDelay.toMillis()) {
                return maxDelay;
            }
            return Duration.ofMillis((long) millis);
        }
    }
}
