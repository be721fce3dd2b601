package com.example.cruscotto.interfaces.scheduler;

import com.example.cruscotto.application.service.PipelineService;
import com.example.cruscotto.config.CruscottoProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the full pipeline on startup when enabled, and the monthly update on the configured cron.
 */
@Component
public class PipelineScheduler {

    private static final Logger log = LoggerFactory.getLogger(PipelineScheduler.class);

    private final PipelineService pipelineService;
    private final CruscottoProperties properties;

    public PipelineScheduler(PipelineService pipelineService, CruscottoProperties properties) {
        this.pipelineService = pipelineService;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (!properties.getPipeline().isRunOnStartup()) {
            log.info("Pipeline ready. Monthly update scheduled with cron '{}'", properties.getPipeline().getCron());
            return;
        }
        log.info("Running full pipeline on startup");
        try {
            pipelineService.runFull();
        } catch (RuntimeException ex) {
            log.error("Startup pipeline run failed: {}", ex.getMessage(), ex);
        }
    }

    @Scheduled(cron = "${cruscotto.pipeline.cron:0 0 3 5 * *}", zone = "Europe/Rome")
    public void scheduledUpdate() {
        log.info("Scheduled monthly update triggered");
        try {
            pipelineService.runMonthlyUpdate();
        } catch (RuntimeException ex) {
            log.error("Scheduled monthly update failed: {}", ex.getMessage(), ex);
        }
    }
}
