package com.redis.resilience.config;

import io.lettuce.core.RedisURI;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Configuration for the Redis resilience layer.
 * Holds connection settings, the operational switches that decide whether Redis is used at all,
 * and the timings of the circuit breaker, the reconnector and the health monitor.
 */
public class RedisResilienceConfig {

    public static final String DEVELOPMENT_ENVIRONMENT = "development";

    private final boolean disableRedis;
    private final RedisMode mode;
    private final boolean devModeEnabled;
    private final String environment;
    private final String host;
    private final int port;
    private final String username;
    private final String password;
    private final int database;
    private final boolean ssl;
    private final Duration connectionTimeout;
    private final Duration commandTimeout;
    private final int maxReconnectAttempts;
    private final Duration backoffFloor;
    private final Duration backoffCeiling;
    private final Duration reconnectPollInterval;
    private final Duration healthCheckInterval;
    private final Duration healthCheckTimeout;
    private final CircuitBreakerConfig circuitBreakerConfig;

    private RedisResilienceConfig(Builder builder) {
        this.disableRedis = builder.disableRedis;
        this.mode = builder.mode;
        this.devModeEnabled = builder.devModeEnabled;
        this.environment = builder.environment;
        this.host = builder.host;
        this.port = builder.port;
        this.username = builder.username;
        this.password = builder.password;
        this.database = builder.database;
        this.ssl = builder.ssl;
        this.connectionTimeout = builder.connectionTimeout;
        this.commandTimeout = builder.commandTimeout;
        this.maxReconnectAttempts = builder.maxReconnectAttempts;
        this.backoffFloor = builder.backoffFloor;
        this.backoffCeiling = builder.backoffCeiling;
        this.reconnectPollInterval = builder.reconnectPollInterval;
        this.healthCheckInterval = builder.healthCheckInterval;
        this.healthCheckTimeout = builder.healthCheckTimeout;
        this.circuitBreakerConfig = builder.circuitBreakerConfig;
    }

    /**
     * Whether the resilience layer should talk to Redis at all. Redis is used unless it is
     * explicitly disabled, the mode is {@link RedisMode#DISABLED}, or the process runs in the
     * development environment with the development Redis switched off.
     */
    public boolean isEnabled() {
        if (disableRedis || mode == RedisMode.DISABLED) {
            return false;
        }
        return !DEVELOPMENT_ENVIRONMENT.equalsIgnoreCase(environment) || devModeEnabled;
    }

    public boolean isDisableRedis() {
        return disableRedis;
    }

    public RedisMode getMode() {
        return mode;
    }

    public boolean isDevModeEnabled() {
        return devModeEnabled;
    }

    public String getEnvironment() {
        return environment;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public int getDatabase() {
        return database;
    }

    public boolean isSsl() {
        return ssl;
    }

    public Duration getConnectionTimeout() {
        return connectionTimeout;
    }

    public Duration getCommandTimeout() {
        return commandTimeout;
    }

    /**
     * Attempts after which the reconnector stops escalating and stays at the ceiling delay.
     * Zero means unbounded.
     */
    public int getMaxReconnectAttempts() {
        return maxReconnectAttempts;
    }

    public Duration getBackoffFloor() {
        return backoffFloor;
    }

    public Duration getBackoffCeiling() {
        return backoffCeiling;
    }

    public Duration getReconnectPollInterval() {
        return reconnectPollInterval;
    }

    public Duration getHealthCheckInterval() {
        return healthCheckInterval;
    }

    public Duration getHealthCheckTimeout() {
        return healthCheckTimeout;
    }

    public CircuitBreakerConfig getCircuitBreakerConfig() {
        return circuitBreakerConfig;
    }

    public static RedisResilienceConfig defaultConfig() {
        return builder().build();
    }

    /**
     * Creates a configuration that keeps Redis switched off.
     */
    public static RedisResilienceConfig disabledConfig() {
        return builder().disableRedis(true).build();
    }

    /**
     * Resolves a configuration from environment-style variables such as {@code REDIS_HOST},
     * {@code REDIS_MODE} or {@code DISABLE_REDIS}. Unknown keys are ignored, missing keys keep
     * their defaults.
     *
     * @param env variables, usually {@link System#getenv()}
     * @return the resolved configuration
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static RedisResilienceConfig fromEnvironment(Map<String, String> env) {
        Builder builder = builder();

        String url = env.get("REDIS_URL");
        if (url != null && !url.isBlank()) {
            builder.url(url);
        }

        ifPresent(env, "DISABLE_REDIS", v -> builder.disableRedis(parseBoolean("DISABLE_REDIS", v)));
        ifPresent(env, "REDIS_MODE", v -> builder.mode(RedisMode.fromString(v)));
        ifPresent(env, "DEV_MODE_REDIS_ENABLED", v -> builder.devModeEnabled(parseBoolean("DEV_MODE_REDIS_ENABLED", v)));
        ifPresent(env, "ENVIRONMENT", builder::environment);
        ifPresent(env, "REDIS_HOST", builder::host);
        ifPresent(env, "REDIS_PORT", v -> builder.port(parseInt("REDIS_PORT", v)));
        ifPresent(env, "REDIS_USERNAME", builder::username);
        ifPresent(env, "REDIS_PASSWORD", builder::password);
        ifPresent(env, "REDIS_DB", v -> builder.database(parseInt("REDIS_DB", v)));
        ifPresent(env, "REDIS_SSL", v -> builder.ssl(parseBoolean("REDIS_SSL", v)));
        ifPresent(env, "REDIS_CONNECT_TIMEOUT_MS", v -> builder.connectionTimeout(parseMillis("REDIS_CONNECT_TIMEOUT_MS", v)));
        ifPresent(env, "REDIS_COMMAND_TIMEOUT_MS", v -> builder.commandTimeout(parseMillis("REDIS_COMMAND_TIMEOUT_MS", v)));
        ifPresent(env, "REDIS_MAX_RECONNECT_ATTEMPTS", v -> builder.maxReconnectAttempts(parseInt("REDIS_MAX_RECONNECT_ATTEMPTS", v)));
        ifPresent(env, "REDIS_BACKOFF_FLOOR_MS", v -> builder.backoffFloor(parseMillis("REDIS_BACKOFF_FLOOR_MS", v)));
        ifPresent(env, "REDIS_BACKOFF_CEILING_MS", v -> builder.backoffCeiling(parseMillis("REDIS_BACKOFF_CEILING_MS", v)));
        ifPresent(env, "REDIS_RECONNECT_POLL_INTERVAL_MS", v -> builder.reconnectPollInterval(parseMillis("REDIS_RECONNECT_POLL_INTERVAL_MS", v)));
        ifPresent(env, "REDIS_HEALTH_CHECK_INTERVAL_MS", v -> builder.healthCheckInterval(parseMillis("REDIS_HEALTH_CHECK_INTERVAL_MS", v)));
        ifPresent(env, "REDIS_HEALTH_CHECK_TIMEOUT_MS", v -> builder.healthCheckTimeout(parseMillis("REDIS_HEALTH_CHECK_TIMEOUT_MS", v)));

        CircuitBreakerConfig.Builder breaker = CircuitBreakerConfig.builder();
        ifPresent(env, "REDIS_CIRCUIT_FAILURE_THRESHOLD", v -> breaker.failureThreshold(parseInt("REDIS_CIRCUIT_FAILURE_THRESHOLD", v)));
        ifPresent(env, "REDIS_CIRCUIT_RECOVERY_TIMEOUT_MS", v -> breaker.recoveryTimeout(parseMillis("REDIS_CIRCUIT_RECOVERY_TIMEOUT_MS", v)));
        builder.circuitBreaker(breaker.build());

        return builder.build();
    }

    private static void ifPresent(Map<String, String> env, String key, Consumer<String> action) {
        String value = env.get(key);
        if (value != null && !value.isBlank()) {
            action.accept(value.trim());
        }
    }

    private static boolean parseBoolean(String key, String value) {
        switch (value.toLowerCase(Locale.ROOT)) {
            case "true":
            case "1":
            case "yes":
            case "on":
                return true;
            case "false":
            case "0":
            case "no":
            case "off":
                return false;
            default:
                throw new IllegalArgumentException("Invalid boolean for " + key + ": " + value);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static Duration parseMillis(String key, String value) {
        try {
            return Duration.ofMillis(Long.parseLong(value));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid milliseconds for " + key + ": " + value, e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format("RedisResilienceConfig{enabled=%s, mode=%s, environment=%s, host=%s, port=%d, database=%d, ssl=%s, "
                + "maxReconnectAttempts=%d, backoff=%s..%s, healthCheck=%s/%s, %s}",
            isEnabled(), mode, environment, host, port, database, ssl,
            maxReconnectAttempts, backoffFloor, backoffCeiling, healthCheckInterval, healthCheckTimeout,
            circuitBreakerConfig);
    }

    public static class Builder {
        private boolean disableRedis = false;
        private RedisMode mode = RedisMode.SHARED;
        private boolean devModeEnabled = true;
        private String environment = DEVELOPMENT_ENVIRONMENT;
        private String host = "localhost";
        private int port = 6379;
        private String username;
        private String password;
        private int database = 0;
        private boolean ssl = false;
        private Duration connectionTimeout = Duration.ofSeconds(5);
        private Duration commandTimeout = Duration.ofSeconds(10);
        private int maxReconnectAttempts = 10;
        private Duration backoffFloor = Duration.ofSeconds(1);
        private Duration backoffCeiling = Duration.ofSeconds(60);
        private Duration reconnectPollInterval = Duration.ofSeconds(5);
        private Duration healthCheckInterval = Duration.ofSeconds(30);
        private Duration healthCheckTimeout = Duration.ofSeconds(5);
        private CircuitBreakerConfig circuitBreakerConfig = CircuitBreakerConfig.defaultConfig();

        public Builder disableRedis(boolean disableRedis) {
            this.disableRedis = disableRedis;
            return this;
        }

        public Builder mode(RedisMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder devModeEnabled(boolean devModeEnabled) {
            this.devModeEnabled = devModeEnabled;
            return this;
        }

        public Builder environment(String environment) {
            this.environment = environment;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder authentication(String username, String password) {
            this.username = username;
            this.password = password;
            return this;
        }

        public Builder database(int database) {
            this.database = database;
            return this;
        }

        public Builder ssl(boolean ssl) {
            this.ssl = ssl;
            return this;
        }

        /**
         * Takes host, port, credentials, database and SSL from a {@code redis://} or
         * {@code rediss://} URL.
         */
        public Builder url(String url) {
            RedisURI uri;
            try {
                uri = RedisURI.create(url);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid Redis URL: " + url, e);
            }
            this.host = uri.getHost();
            this.port = uri.getPort();
            this.database = uri.getDatabase();
            this.ssl = uri.isSsl();
            if (uri.getUsername() != null) {
                this.username = uri.getUsername();
            }
            if (uri.getPassword() != null && uri.getPassword().length > 0) {
                this.password = new String(uri.getPassword());
            }
            return this;
        }

        public Builder connectionTimeout(Duration connectionTimeout) {
            this.connectionTimeout = connectionTimeout;
            return this;
        }

        public Builder commandTimeout(Duration commandTimeout) {
            this.commandTimeout = commandTimeout;
            return this;
        }

        public Builder maxReconnectAttempts(int maxReconnectAttempts) {
            this.maxReconnectAttempts = maxReconnectAttempts;
            return this;
        }

        public Builder backoffFloor(Duration backoffFloor) {
            this.backoffFloor = backoffFloor;
            return this;
        }

        public Builder backoffCeiling(Duration backoffCeiling) {
            this.backoffCeiling = backoffCeiling;
            return this;
        }

        public Builder reconnectPollInterval(Duration reconnectPollInterval) {
            this.reconnectPollInterval = reconnectPollInterval;
            return this;
        }

        public Builder healthCheckInterval(Duration healthCheckInterval) {
            this.healthCheckInterval = healthCheckInterval;
            return this;
        }

        public Builder healthCheckTimeout(Duration healthCheckTimeout) {
            this.healthCheckTimeout = healthCheckTimeout;
            return this;
        }

        public Builder circuitBreaker(CircuitBreakerConfig circuitBreakerConfig) {
            this.circuitBreakerConfig = circuitBreakerConfig;
            return this;
        }

        /**
         * Convenience method to configure the circuit breaker with its two parameters.
         */
        public Builder circuitBreaker(int failureThreshold, Duration recoveryTimeout) {
            this.circuitBreakerConfig = CircuitBreakerConfig.builder()
                .failureThreshold(failureThreshold)
                .recoveryTimeout(recoveryTimeout)
                .build();
            return this;
        }

        public RedisResilienceConfig build() {
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("port must be between 1 and 65535, got " + port);
            }
            if (database < 0) {
                throw new IllegalArgumentException("database must not be negative, got " + database);
            }
            if (maxReconnectAttempts < 0) {
                throw new IllegalArgumentException("maxReconnectAttempts must not be negative, got " + maxReconnectAttempts);
            }
            requirePositive("connectionTimeout", connectionTimeout);
            requirePositive("commandTimeout", commandTimeout);
            requirePositive("backoffFloor", backoffFloor);
            requirePositive("backoffCeiling", backoffCeiling);
            requirePositive("reconnectPollInterval", reconnectPollInterval);
            requirePositive("healthCheckInterval", healthCheckInterval);
            requirePositive("healthCheckTimeout", healthCheckTimeout);
            if (backoffCeiling.compareTo(backoffFloor) < 0) {
                throw new IllegalArgumentException("backoffCeiling " + backoffCeiling
                    + " must not be shorter than backoffFloor " + backoffFloor);
            }
            // probes must not pile up
            if (healthCheckTimeout.compareTo(healthCheckInterval) >= 0) {
                throw new IllegalArgumentException("healthCheckTimeout " + healthCheckTimeout
                    + " must be shorter than healthCheckInterval " + healthCheckInterval);
            }
            if (mode == null) {
                throw new IllegalArgumentException("mode must not be null");
            }
            if (circuitBreakerConfig == null) {
                throw new IllegalArgumentException("circuitBreaker config must not be null");
            }
            return new RedisResilienceConfig(this);
        }

        private static void requirePositive(String name, Duration value) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be a positive duration, got " + value);
            }
        }
    }
}
