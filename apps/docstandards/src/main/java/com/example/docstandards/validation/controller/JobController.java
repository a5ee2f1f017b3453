package com.example.docstandards.validation.controller;

import com.example.docstandards.security.annotation.RequiredRole;
import com.example.docstandards.security.annotation.ResolvedAuth;
import com.example.docstandards.security.context.Role;
import com.example.docstandards.validation.model.response.JobResponse;
import com.example.docstandards.validation.service.ValidationJobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1/jobs")
@RequiredArgsConstructor
public class JobController {

    private final ValidationJobService jobService;

    @GetMapping("/{jobId}")
    public Mono<JobResponse> getJob(@PathVariable String jobId) {
        log.debug("GET /jobs/{}", jobId);
        return jobService.getJob(jobId).map(JobResponse::from);
    }

    @PostMapping("/{jobId}/retry")
    @RequiredRole(Role.STANDARDS_ADMIN)
    public Mono<JobResponse> retry(
            @ResolvedAuth String actor,
            @PathVariable String jobId) {

        log.debug("POST /jobs/{}/retry - subject: {}", jobId, actor);
        return jobService.retry(jobId, actor).map(JobResponse::from);
    }
}
