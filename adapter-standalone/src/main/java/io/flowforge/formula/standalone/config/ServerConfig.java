package io.flowforge.formula.standalone.config;

import io.flowforge.formula.core.parser.ExpressionLimits;

/**
 * Configuration of the standalone formula server. Every field has a default; use
 * {@link #builder()} to override some of them.
 *
 * @param host             bind address
 * @param port             listen port; {@code 0} picks a free port
 * @param maxBodyBytes     largest accepted request body
 * @param maxFormulaLength longest accepted formula, in characters
 * @param maxNodeCount     largest accepted syntax tree
 * @param maxDepth         deepest accepted nesting
 * @param healthEnabled    whether the liveness endpoint is registered
 * @param healthPath       liveness endpoint path
 * @param loggingFormat    {@code json} or {@code text}
 * @param loggingLevel     root log level
 */
public record ServerConfig(
        String host,
        int port,
        int maxBodyBytes,
        int maxFormulaLength,
        int maxNodeCount,
        int maxDepth,
        boolean healthEnabled,
        String healthPath,
        String loggingFormat,
        String loggingLevel) {

    public static Builder builder() {
        return new Builder();
    }

    /** Engine limits derived from the formula settings. */
    public ExpressionLimits limits() {
        return new ExpressionLimits(maxFormulaLength, maxNodeCount, maxDepth);
    }

    /** Builder for {@link ServerConfig}, pre-filled with defaults. */
    public static final class Builder {
        private String host = "0.0.0.0";
        private int port = 8080;
        private int maxBodyBytes = 1_048_576; // 1 MB
        private int maxFormulaLength = ExpressionLimits.DEFAULT.maxFormulaLength();
        private int maxNodeCount = ExpressionLimits.DEFAULT.maxNodeCount();
        private int maxDepth = ExpressionLimits.DEFAULT.maxDepth();
        private boolean healthEnabled = true;
        private String healthPath = "/health";
        private String loggingFormat = "json";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder maxBodyBytes(int maxBodyBytes) {
            this.maxBodyBytes = maxBodyBytes;
            return this;
        }

        public Builder maxFormulaLength(int maxFormulaLength) {
            this.maxFormulaLength = maxFormulaLength;
            return this;
        }

        public Builder maxNodeCount(int maxNodeCount) {
            this.maxNodeCount = maxNodeCount;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder healthEnabled(boolean healthEnabled) {
            this.healthEnabled = healthEnabled;
            return this;
        }

        public Builder healthPath(String healthPath) {
            this.healthPath = healthPath;
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

        public ServerConfig build() {
            return new ServerConfig(
                    host,
                    port,
                    maxBodyBytes,
                    maxFormulaLength,
                    maxNodeCount,
                    maxDepth,
                    healthEnabled,
                    healthPath,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
