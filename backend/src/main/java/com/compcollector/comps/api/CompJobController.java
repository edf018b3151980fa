package com.compcollector.comps.api;

import com.compcollector.comps.model.CompJobView;
import com.compcollector.comps.model.EnqueueJobRequest;
import com.compcollector.comps.service.CompJobService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/jobs")
public class CompJobController {
    private final CompJobService jobService;

    public CompJobController(CompJobService jobService) {
        this.jobService = jobService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public CompJobView enqueue(@RequestBody EnqueueJobRequest request) {
        return jobService.enqueue(request);
    }

    @GetMapping("/{jobId}")
    public CompJobView get(@PathVariable("jobId") String jobId) {
        return jobService.getJob(jobId);
    }

    @PostMapping("/{jobId}/reset")
    public CompJobView reset(@PathVariable("jobId") String jobId) {
        return jobService.reset(jobId);
    }
}
