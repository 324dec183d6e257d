package com.reliabledownloader.controllers;

import com.reliabledownloader.models.DownloadProgress;
import com.reliabledownloader.models.DownloadRequest;
import com.reliabledownloader.services.DownloadJobService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DownloadController.class)
class DownloadControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DownloadJobService downloadJobService;

    @Test
    void startReturnsAcceptedWithId() throws Exception {
        when(downloadJobService.start(any(DownloadRequest.class)))
                .thenReturn(new DownloadJobService.Job("job-1", new CompletableFuture<>()));

        mockMvc.perform(post("/api/downloads")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"https://example.com/a.bin\",\"destinationPath\":\"a.bin\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.downloadId").value("job-1"))
                .andExpect(jsonPath("$.status").value("STARTED"));
    }

    @Test
    void invalidRequestIsBadRequest() throws Exception {
        when(downloadJobService.start(any(DownloadRequest.class)))
                .thenThrow(new IllegalArgumentException("url is required"));

        mockMvc.perform(post("/api/downloads")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"destinationPath\":\"a.bin\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("url is required"));
    }

    @Test
    void saturatedExecutorIsServiceUnavailable() throws Exception {
        when(downloadJobService.start(any(DownloadRequest.class)))
                .thenThrow(new TaskRejectedException("Executor did not accept task"));

        mockMvc.perform(post("/api/downloads")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"https://example.com/a.bin\",\"destinationPath\":\"a.bin\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void progressOfKnownDownload() throws Exception {
        DownloadProgress progress = new DownloadProgress("job-1", "https://example.com/a.bin", "/data/a.bin");
        when(downloadJobService.getProgress("job-1")).thenReturn(progress);
        when(downloadJobService.getAllProgress()).thenReturn(Map.of("job-1", progress));

        mockMvc.perform(get("/api/downloads/job-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.downloadId").value("job-1"))
                .andExpect(jsonPath("$.status").value(DownloadProgress.QUEUED));
        mockMvc.perform(get("/api/downloads"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['job-1'].url").value("https://example.com/a.bin"));
    }

    @Test
    void progressOfUnknownDownloadIsNotFound() throws Exception {
        mockMvc.perform(get("/api/downloads/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void cancelKnownAndUnknownDownloads() throws Exception {
        when(downloadJobService.cancel("job-1")).thenReturn(true);

        mockMvc.perform(delete("/api/downloads/job-1"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value(DownloadProgress.CANCELLING));
        mockMvc.perform(delete("/api/downloads/missing"))
                .andExpect(status().isNotFound());
    }
}
