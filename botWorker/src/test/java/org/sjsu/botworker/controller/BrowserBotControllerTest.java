package org.sjsu.botworker.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.sjsu.botworker.exception.BotWorkerResponseException;
import org.sjsu.botworker.exception.BotWorkerUnreachableException;
import org.sjsu.botworker.service.client.BrowserBotClient;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class BrowserBotControllerTest {

    @Mock
    private BrowserBotClient browserBotClient;

    @InjectMocks
    private BrowserBotController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void shouldInitializeBot() throws Exception {
        when(browserBotClient.initializeBot("abc123")).thenReturn(true);

        mockMvc.perform(post("/api/browser-bots/participants/abc123/initialize"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.participantCode").value("abc123"))
                .andExpect(jsonPath("$.initialized").value(true));
    }

    @Test
    void shouldReturn503WhenBotWorkerIsDown() throws Exception {
        doThrow(new BotWorkerUnreachableException()).when(browserBotClient).ping("abc123");

        mockMvc.perform(get("/api/browser-bots/ping/abc123"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value(503));
    }

    @Test
    void shouldReturn502WithWorkerErrorWhenCommandFails() throws Exception {
        when(browserBotClient.initializeBot("ghost"))
                .thenThrow(new BotWorkerResponseException("ParticipantNotFoundException('Participant ghost does not exist')", "trace"));

        mockMvc.perform(post("/api/browser-bots/participants/ghost/initialize"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.message").value("ParticipantNotFoundException('Participant ghost does not exist')"));
    }

    @Test
    void shouldFlushChannelsOfRange() throws Exception {
        when(browserBotClient.flushBots("abc")).thenReturn(3);

        mockMvc.perform(delete("/api/browser-bots/channels").param("charRange", "abc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(3));
    }
}
