package com.surveillance.engine.controller;

import com.surveillance.engine.dto.ManualTriggerRequest;
import com.surveillance.engine.entity.TrainingTrigger;
import com.surveillance.engine.entity.TriggerType;
import com.surveillance.engine.exception.InvalidRequestException;
import com.surveillance.engine.exception.StorageException;
import com.surveillance.engine.service.TrainingTriggerService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = TrainingController.class)
class TrainingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TrainingTriggerService trainingTriggerService;

    @Test
    void shouldTriggerTraining() throws Exception {
        when(trainingTriggerService.triggerManually(any(ManualTriggerRequest.class)))
                .thenReturn(trigger("habitat_predictor"));

        mockMvc.perform(post("/api/training/trigger")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"modelType\":\"habitat_predictor\",\"force\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Training triggered for habitat_predictor"))
                .andExpect(jsonPath("$.triggerId").value("trigger-1"));

        verify(trainingTriggerService).triggerManually(new ManualTriggerRequest("habitat_predictor", true));
    }

    @Test
    void shouldKeepJsonBodyForUnsupportedMethod() throws Exception {
        mockMvc.perform(get("/api/training/trigger"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void shouldAcceptEmptyBody() throws Exception {
        when(trainingTriggerService.triggerManually(isNull())).thenReturn(trigger("all"));

        mockMvc.perform(post("/api/training/trigger"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Training triggered for all"));
    }

    @Test
    void shouldRejectMalformedJson() throws Exception {
        mockMvc.perform(post("/api/training/trigger")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"modelType\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Malformed request payload"));
    }

    @Test
    void shouldRejectBlankModelType() throws Exception {
        when(trainingTriggerService.triggerManually(any()))
                .thenThrow(new InvalidRequestException("modelType must not be blank"));

        mockMvc.perform(post("/api/training/trigger")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"modelType\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("modelType must not be blank"));
    }

    @Test
    void shouldReportStorageFailure() throws Exception {
        when(trainingTriggerService.triggerManually(any()))
                .thenThrow(new StorageException("Failed to create training trigger for all: connection refused"));

        mockMvc.perform(post("/api/training/trigger")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Failed to create training trigger for all: connection refused"));
    }

    @Test
    void shouldAllowCrossOriginCalls() throws Exception {
        when(trainingTriggerService.triggerManually(any())).thenReturn(trigger("all"));

        mockMvc.perform(post("/api/training/trigger")
                        .header("Origin", "https://dashboard.example.org")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isOk())
                .andExpect(header().string("Access-Control-Allow-Origin", "https://dashboard.example.org"));
    }

    private static TrainingTrigger trigger(String modelType) {
        return TrainingTrigger.builder()
                .id("trigger-1")
                .type(TriggerType.SCHEDULED)
                .modelType(modelType)
                .build();
    }
}
