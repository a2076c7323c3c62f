package com.nursingjobs.pipeline.ingest.service;

import com.nursingjobs.pipeline.config.PipelineProperties;
import com.nursingjobs.pipeline.ingest.model.RunRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class PipelineCliRunner implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(PipelineCliRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_SCRAPE_FAILED = 2;
    static final int EXIT_CLASSIFY_FAILED = 3;

    private final PipelineProperties properties;
    private final PipelineOrchestrator orchestrator;
    private final ConfigurableApplicationContext applicationContext;
    private volatile int exitCode = EXIT_OK;

    public PipelineCliRunner(
        PipelineProperties properties,
        PipelineOrchestrator orchestrator,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestrator = orchestrator;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        PipelineProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        exitCode = runOnce(cli);

        if (cli.isExitAfterRun()) {
            int code = SpringApplication.exit(applicationContext, this);
            System.exit(code);
        }
    }

    int runOnce(PipelineProperties.Cli cli) {
        String employer = cli.getEmployer();
        if (employer == null || employer.isBlank()) {
            log.error("pipeline.cli.employer is required when pipeline.cli.run=true");
            return EXIT_USAGE;
        }
        try {
            RunRecord record = orchestrator.run(employer.trim(), cli.getMaxPages(), cli.getMaxItems());
            log.info(
                "Pipeline run {} for {} finished in state {} (found={}, classified={}, failed={}, cost=${})",
                record.runId(),
                record.employerSlug(),
                record.finalState(),
                record.jobsFound(),
                record.classificationsSucceeded(),
                record.classificationsFailed(),
                record.estimatedCostUsd()
            );
            return exitCodeFor(record);
        } catch (UnknownEmployerException e) {
            log.error("{}; configured employers: {}", e.getMessage(), properties.getSources().stream()
                .map(PipelineProperties.SourceBinding::getSlug)
                .toList());
            return EXIT_USAGE;
        }
    }

    static int exitCodeFor(RunRecord record) {
        return switch (record.finalState()) {
            case DONE -> EXIT_OK;
            case SCRAPE_FAILED -> EXIT_SCRAPE_FAILED;
            case CLASSIFY_FAILED -> EXIT_CLASSIFY_FAILED;
            default -> throw new IllegalStateException("Run ended in non-terminal state " + record.finalState());
        };
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
