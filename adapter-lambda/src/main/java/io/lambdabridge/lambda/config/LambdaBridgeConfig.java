package io.lambdabridge.lambda.config;

import io.lambdabridge.core.config.BridgeConfig;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Everything the function handler needs at cold start: the translation settings plus the
 * logging setup.
 *
 * <p>
 * Use {@link #builder()} to construct instances.
 *
 * @param bridge        translation settings handed to the core
 * @param loggingFormat {@code json} or {@code text} (default {@code json})
 * @param loggingLevel  root log level (default {@code INFO})
 */
public record LambdaBridgeConfig(BridgeConfig bridge, String loggingFormat, String loggingLevel) {

    /** Accepted values for {@code logging.format}. */
    static final Set<String> LOGGING_FORMATS = Set.of("json", "text");

    /** Accepted values for {@code logging.level}. */
    static final Set<String> LOGGING_LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    public LambdaBridgeConfig {
        Objects.requireNonNull(bridge, "bridge must not be null");
        Objects.requireNonNull(loggingFormat, "loggingFormat must not be null");
        Objects.requireNonNull(loggingLevel, "loggingLevel must not be null");
    }

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link LambdaBridgeConfig}. Values are validated in {@link #build()}. */
    public static final class Builder {
        private BridgeConfig bridge = BridgeConfig.DEFAULTS;
        private String loggingFormat = "json";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder bridge(BridgeConfig bridge) {
            this.bridge = bridge;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * @throws ConfigLoadException if the logging format or level is not recognized
         */
        public LambdaBridgeConfig build() {
            String format = loggingFormat != null ? loggingFormat.trim().toLowerCase(Locale.ROOT) : "";
            if (!LOGGING_FORMATS.contains(format)) {
                throw new ConfigLoadException(
                        "Invalid logging format '" + loggingFormat + "', expected one of " + LOGGING_FORMATS);
            }
            String level = loggingLevel != null ? loggingLevel.trim().toUpperCase(Locale.ROOT) : "";
            if (!LOGGING_LEVELS.contains(level)) {
                throw new ConfigLoadException(
                        "Invalid logging level '" + loggingLevel + "', expected one of " + LOGGING_LEVELS);
            }
            return new LambdaBridgeConfig(bridge != null ? bridge : BridgeConfig.DEFAULTS, format, level);
        }
    }
}
