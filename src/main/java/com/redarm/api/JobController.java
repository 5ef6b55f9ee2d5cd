package com.redarm.api;

import com.redarm.security.BearerTokenAuthenticator;
import com.redarm.security.Identity;
import com.redarm.shared.dto.JobStatusResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/jobs")
@Tag(name = "Jobs", description = "Job status polling")
public class JobController {

    private final BearerTokenAuthenticator authenticator;
    private final JobQueryService jobQueryService;

    public JobController(BearerTokenAuthenticator authenticator, JobQueryService jobQueryService) {
        this.authenticator = authenticator;
        this.jobQueryService = jobQueryService;
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Get job status", description = "Returns status, result URL and error of a job you own")
    public JobStatusResponse getJob(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "Job id") @PathVariable("jobId") String jobId) {
        Identity identity = authenticator.authenticate(authorization);
        return jobQueryService.getJob(identity, jobId);
    }
}
