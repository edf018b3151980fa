package com.compcollector.comps.api;

import com.compcollector.comps.model.CompQueueStats;
import com.compcollector.comps.model.CompWorkerStatusResponse;
import com.compcollector.comps.service.CompWorkerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class CompWorkerControllerTest {

    @Mock
    private CompWorkerService workerService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new CompWorkerController(workerService))
            .setControllerAdvice(new CompExceptionHandler())
            .build();
    }

    @Test
    void startReportsRunningWorker() throws Exception {
        when(workerService.getStatus()).thenReturn(new CompWorkerStatusResponse(true, 2, new CompQueueStats(4, 1, null, List.of())));

        mockMvc.perform(post("/api/worker/start"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.running").value(true))
            .andExpect(jsonPath("$.workerCount").value(2))
            .andExpect(jsonPath("$.queue.queuedCount").value(4));

        verify(workerService).start();
    }

    @Test
    void stopAndStatus() throws Exception {
        when(workerService.getStatus()).thenReturn(new CompWorkerStatusResponse(false, 0, new CompQueueStats(0, 0, null, List.of())));

        mockMvc.perform(post("/api/worker/stop")).andExpect(jsonPath("$.running").value(false));
        mockMvc.perform(get("/api/worker/status")).andExpect(status().isOk());

        verify(workerService).stop();
    }
}
