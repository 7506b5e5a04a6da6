package com.turbosentinel.scan;

import java.io.Serializable;
import java.time.Duration;
import java.util.Objects;

/**
 * Typed, immutable configuration of the scan job.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the job is
 * configurable from a container definition or a shell. Detection tuning lives in the
 * engine YAML, not here.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder} for
 * tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScanJobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Inputs
    // ---------------------------------------------------------------
    private final String engineConfigPath;
    private final String seriesInputPath;
    private final int lookbackDays;

    // ---------------------------------------------------------------
    // Execution
    // ---------------------------------------------------------------
    private final int unitParallelism;
    private final int scanIntervalMinutes;

    // ---------------------------------------------------------------
    // Output
    // ---------------------------------------------------------------
    private final String reportOutputDir;

    private ScanJobConfig(Builder b) {
        this.engineConfigPath = b.engineConfigPath;
        this.seriesInputPath = b.seriesInputPath;
        this.lookbackDays = b.lookbackDays;
        this.unitParallelism = b.unitParallelism;
        this.scanIntervalMinutes = b.scanIntervalMinutes;
        this.reportOutputDir = b.reportOutputDir;
    }

    /**
     * Build a {@link ScanJobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if a numeric value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ScanJobConfig fromEnvironment() {
        try {
            return new Builder()
                    .engineConfigPath(env("ENGINE_CONFIG_PATH", ""))
                    .seriesInputPath(env("SERIES_INPUT_PATH", ""))
                    .lookbackDays(parseIntEnv("SCAN_LOOKBACK_DAYS", "90"))
                    .unitParallelism(parseIntEnv("SCAN_UNIT_PARALLELISM", "1"))
                    .scanIntervalMinutes(parseIntEnv("SCAN_INTERVAL_MINUTES", "0"))
                    .reportOutputDir(env("REPORT_OUTPUT_DIR", ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getEngineConfigPath() {
        return engineConfigPath;
    }

    public String getSeriesInputPath() {
        return seriesInputPath;
    }

    public int getLookbackDays() {
        return lookbackDays;
    }

    /**
     * @return history fetched per tag, ending at the scan instant
     */
    public Duration getLookback() {
        return Duration.ofDays(lookbackDays);
    }

    public int getUnitParallelism() {
        return unitParallelism;
    }

    /**
     * @return minutes between scans; {@code 0} runs a single scan
     */
    public int getScanIntervalMinutes() {
        return scanIntervalMinutes;
    }

    public String getReportOutputDir() {
        return reportOutputDir;
    }

    public boolean isRepeating() {
        return scanIntervalMinutes > 0;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ScanJobConfig}.
     *
     * <p>
     * {@link #build()} checks that the lookback and parallelism are positive
     * and that the scan interval is not negative.
     * </p>
     */
    public static class Builder {
        private String engineConfigPath = "";
        private String seriesInputPath = "";
        private int lookbackDays = 90;
        private int unitParallelism = 1;
        private int scanIntervalMinutes = 0;
        private String reportOutputDir = "";

        public Builder engineConfigPath(String v) {
            this.engineConfigPath = v;
            return this;
        }

        public Builder seriesInputPath(String v) {
            this.seriesInputPath = v;
            return this;
        }

        public Builder lookbackDays(int v) {
            this.lookbackDays = v;
            return this;
        }

        public Builder unitParallelism(int v) {
            this.unitParallelism = v;
            return this;
        }

        public Builder scanIntervalMinutes(int v) {
            this.scanIntervalMinutes = v;
            return this;
        }

        public Builder reportOutputDir(String v) {
            this.reportOutputDir = v;
            return this;
        }

        /**
         * @return a validated {@link ScanJobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ScanJobConfig build() {
            Objects.requireNonNull(engineConfigPath, "engineConfigPath must not be null");
            Objects.requireNonNull(seriesInputPath, "seriesInputPath must not be null");
            Objects.requireNonNull(reportOutputDir, "reportOutputDir must not be null");

            if (lookbackDays < 1) {
                throw new IllegalArgumentException("lookbackDays must be >= 1, got: " + lookbackDays);
            }
            if (unitParallelism < 1) {
                throw new IllegalArgumentException("unitParallelism must be >= 1, got: " + unitParallelism);
            }
            if (scanIntervalMinutes < 0) {
                throw new IllegalArgumentException(
                        "scanIntervalMinutes must be >= 0, got: " + scanIntervalMinutes);
            }
            return new ScanJobConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue).trim());
    }

    @Override
    public String toString() {
        return "ScanJobConfig{" +
                "engineConfigPath='" + engineConfigPath + '\'' +
                ", seriesInputPath='" + seriesInputPath + '\'' +
                ", lookbackDays=" + lookbackDays +
                ", unitParallelism=" + unitParallelism +
                ", scanIntervalMinutes=" + scanIntervalMinutes +
                ", reportOutputDir='" + reportOutputDir + '\'' +
                '}';
    }
}
