package com.compcollector.comps.service;

import com.compcollector.comps.model.CompJobView;
import com.compcollector.comps.model.EnqueueJobRequest;
import com.compcollector.config.CollectorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Enqueues one job from {@code collector.cli.*} and optionally exits, e.g.
 * {@code --collector.cli.enqueue=true --collector.cli.query="2020 Prizm Herbert PSA 10"}.
 */
@Component
public class EnqueueCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(EnqueueCliRunner.class);

    private final CollectorProperties properties;
    private final CompJobService jobService;
    private final ConfigurableApplicationContext applicationContext;

    public EnqueueCliRunner(
        CollectorProperties properties,
        CompJobService jobService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.jobService = jobService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        CollectorProperties.Cli cli = properties.getCli();
        if (!cli.isEnqueue()) {
            return;
        }

        CompJobView job = jobService.enqueue(toRequest(cli));
        log.info("Enqueued comp job {} with sources {}", job.id(), job.sources());

        if (cli.isExitAfterEnqueue()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    static EnqueueJobRequest toRequest(CollectorProperties.Cli cli) {
        if (cli.getQuery() == null || cli.getQuery().isBlank()) {
            throw new IllegalArgumentException("collector.cli.query is required to enqueue a comp job");
        }
        List<String> sources = cli.getSources() == null ? List.of() : Arrays.stream(cli.getSources().split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
        return new EnqueueJobRequest(
            cli.getQuery().trim(),
            sources,
            cli.getSubjectId(),
            cli.getMaxComps(),
            cli.getMaxAgeDays(),
            null
        );
    }
}
