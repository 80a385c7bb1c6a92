package io.github.yok.flexretire;

import com.google.common.base.Ticker;
import io.github.yok.flexretire.catalog.ExecutionLogRepository;
import io.github.yok.flexretire.catalog.JobCatalogRepository;
import io.github.yok.flexretire.config.RetireConfig;
import io.github.yok.flexretire.config.StoreConfig;
import io.github.yok.flexretire.core.BatchExecutor;
import io.github.yok.flexretire.core.BatchPause;
import io.github.yok.flexretire.core.ProcessingOrderAdvisor;
import io.github.yok.flexretire.core.RunOrchestrator;
import io.github.yok.flexretire.core.RunSummary;
import io.github.yok.flexretire.db.StoreConnectorFactory;
import io.github.yok.flexretire.util.ErrorHandler;
import java.time.Clock;
import java.util.Arrays;
import javax.sql.DataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Provides the application entry point.
 *
 * <p>
 * A scheduler starts the process without arguments. One invocation is one run: every enabled job
 * of the catalog is executed once and the process exits. Job outcomes go to the execution log
 * table; the exit code is non-zero only when the run failed as a whole (see {@link ErrorHandler}).
 * </p>
 *
 * <p>
 * Spring Boot binds {@link StoreConfig} and {@link RetireConfig} from {@code application.yml}; the
 * catalog, the log and the source tables are reached through the store named by
 * {@code retire.source-store}.
 * </p>
 *
 * @see RunOrchestrator
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({StoreConfig.class, RetireConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final RetireConfig retireConfig;
    private final StoreConnectorFactory connectorFactory;

    private int exitCode;

    /**
     * Bootstraps the application and hands the run's exit code to the process.
     *
     * @param args command-line arguments (none are expected)
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        int code = SpringApplication.exit(app.run(args));
        if (code != 0) {
            System.exit(code);
        }
    }

    /**
     * Runs all enabled jobs once.
     *
     * @param args command-line arguments array; ignored
     */
    @Override
    public void run(String... args) {
        if (args.length > 0) {
            log.warn("Arguments are ignored: {}", Arrays.toString(args));
        }
        try {
            DataSource metadataStore =
                    connectorFactory.createDataSource(retireConfig.getSourceStore());
            JdbcTemplate jdbc = new JdbcTemplate(metadataStore);

            JobCatalogRepository catalog = new JobCatalogRepository(jdbc, retireConfig);
            ExecutionLogRepository executionLog = new ExecutionLogRepository(jdbc, retireConfig);
            ProcessingOrderAdvisor advisor =
                    retireConfig.isVerifyProcessingOrder() ? new ProcessingOrderAdvisor(jdbc)
                            : null;
            BatchExecutor executor = new BatchExecutor(connectorFactory,
                    retireConfig.getSourceStore(), retireConfig.getBatchPause(),
                    BatchPause.sleeping());

            RunSummary summary = new RunOrchestrator(catalog, executionLog, executor,
                    connectorFactory, advisor, retireConfig, Clock.systemDefaultZone(),
                    Ticker.systemTicker()).runAll();

            log.info("Run {} completed: {} jobs, {} failed, {} rows affected",
                    summary.getRunNumber(), summary.getJobsProcessed(), summary.getJobsFailed(),
                    summary.getTotalRowsAffected());

        } catch (Exception e) {
            exitCode = ErrorHandler.reportFatal("Fatal error: " + e.getMessage(), e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
