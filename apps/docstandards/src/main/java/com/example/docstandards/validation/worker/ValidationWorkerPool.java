package com.example.docstandards.validation.worker;

import com.example.docstandards.config.AppProperties;
import com.example.docstandards.validation.document.ValidationJobDoc;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Independent pollers, each claiming and processing one job at a time.
 * Workers share nothing in memory; they coordinate only through the job store.
 */
@Slf4j
@Component
public class ValidationWorkerPool {

    private final ValidationJobProcessor processor;
    private final AppProperties.Validation config;
    private final String instanceId;
    private final List<Disposable> pollers = new ArrayList<>();

    public ValidationWorkerPool(ValidationJobProcessor processor, AppProperties properties) {
        this.processor = processor;
        this.config = properties.getValidation();
        this.instanceId = getInstanceId();
    }

    @PostConstruct
    public void start() {
        if (!config.isEnabled()) {
            log.info("Validation workers disabled (app.validation.enabled=false)");
            return;
        }
        for (int i = 0; i < config.getWorkers(); i++) {
            String workerId = config.getWorkerIdPrefix() + "-" + instanceId + "-" + i;
            pollers.add(poll(workerId).subscribe(
                    job -> { },
                    error -> log.error("Validation worker stopped unexpectedly: {}", error.getMessage(), error),
                    () -> log.warn("Validation worker completed unexpectedly")));
        }
        log.info("Started {} validation workers: instance={}, pollInterval={}",
                config.getWorkers(), instanceId, config.getPollInterval());
    }

    @PreDestroy
    public void stop() {
        pollers.forEach(Disposable::dispose);
        if (!pollers.isEmpty()) {
            log.info("Stopped {} validation workers", pollers.size());
        }
        pollers.clear();
    }

    /**
     * Ticks that arrive while a job is still being processed are dropped, so a worker never
     * holds more than one claim.
     */
    Flux<ValidationJobDoc> poll(String workerId) {
        return Flux.interval(config.getPollInterval())
                .onBackpressureDrop()
                .concatMap(tick -> processor.processNext(workerId)
                        .onErrorResume(e -> {
                            log.error("Worker {} failed while processing a job", workerId, e);
                            return Mono.empty();
                        }), 1);
    }

    int activeWorkers() {
        return (int) pollers.stream().filter(p -> !p.isDisposed()).count();
    }

    private static String getInstanceId() {
        String hostname = System.getenv("HOSTNAME");
        if (hostname != null && !hostname.isBlank()) {
            return hostname;
        }
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
