package com.compcollector.comps.api;

import com.compcollector.comps.model.CompWorkerStatusResponse;
import com.compcollector.comps.service.CompWorkerService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/worker")
public class CompWorkerController {
    private final CompWorkerService workerService;

    public CompWorkerController(CompWorkerService workerService) {
        this.workerService = workerService;
    }

    @PostMapping("/start")
    public CompWorkerStatusResponse start() {
        workerService.start();
        return workerService.getStatus();
    }

    @PostMapping("/stop")
    public CompWorkerStatusResponse stop() {
        workerService.stop();
        return workerService.getStatus();
    }

    @GetMapping("/status")
    public CompWorkerStatusResponse status() {
        return workerService.getStatus();
    }
}
