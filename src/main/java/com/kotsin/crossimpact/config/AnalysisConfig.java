package com.kotsin.crossimpact.config;

import com.kotsin.crossimpact.domain.model.ReturnConvention;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration for the OFI / cross-impact pipeline.
 * Every threshold used by the calculators lives here.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "analysis")
public class AnalysisConfig {

    /**
     * Forward return horizons. Each must be a positive multiple of grid.binWidth.
     */
    private List<Duration> horizons = new ArrayList<>(List.of(Duration.ofMinutes(1), Duration.ofMinutes(5)));

    private Grid grid = new Grid();

    private Returns returns = new Returns();

    private Reduction reduction = new Reduction();

    private Regression regression = new Regression();

    private Snapshots snapshots = new Snapshots();

    private Executor executor = new Executor();

    private Runner runner = new Runner();

    @Data
    public static class Grid {
        /**
         * Calendar bin width of the common grid (returns and gridded OFI)
         */
        private Duration binWidth = Duration.ofMinutes(1);

        /**
         * Sum per-event level OFI into grid bins before the reduction.
         * When false, composite OFI stays at snapshot timestamps.
         */
        private boolean aggregateOfi = true;
    }

    @Data
    public static class Returns {
        private ReturnConvention convention = ReturnConvention.PRICE_DIFFERENCE;
    }

    @Data
    public static class Reduction {
        /**
         * Minimum level OFI observations per symbol for a covariance estimate
         */
        private int minObservations = 3;

        /**
         * Explained-variance fraction below which a composite is flagged low-fidelity
         */
        private double lowFidelityThreshold = 0.5;

        /**
         * Standard deviations below this are treated as zero variance
         */
        private double zeroVarianceEpsilon = 1e-12;
    }

    @Data
    public static class Regression {
        /**
         * Rows required beyond the number of regressors
         */
        private int minResidualDof = 1;

        /**
         * Relative pivot size below which the design is reported singular
         */
        private double singularityTolerance = 1e-10;
    }

    @Data
    public static class Snapshots {
        private NonMonotonicPolicy nonMonotonicPolicy = NonMonotonicPolicy.REJECT;

        /**
         * Rejection reasons kept per symbol for the report
         */
        private int maxLoggedRejections = 5;
    }

    @Data
    public static class Executor {
        private int poolSize = 4;
        private int queueCapacity = 100;
        private String threadPrefix = "ofi-worker-";
    }

    @Data
    public static class Runner {
        private boolean enabled = false;
        private String inputDir = "data";
        private List<String> symbols = new ArrayList<>();
        private String outputFile = "results/cross_impact_report.json";
    }

    public enum NonMonotonicPolicy {
        /**
         * Drop any snapshot not strictly later than the last accepted one
         */
        REJECT,

        /**
         * Stable-sort by timestamp, keep the last snapshot of duplicate timestamps
         */
        SORT
    }
}
