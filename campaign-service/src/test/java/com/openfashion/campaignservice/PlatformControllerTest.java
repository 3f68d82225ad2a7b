package com.openfashion.campaignservice;

import com.openfashion.campaignservice.controller.PlatformController;
import com.openfashion.campaignservice.core.exceptions.UnauthorizedException;
import com.openfashion.campaignservice.dto.PlatformSettingsView;
import com.openfashion.campaignservice.service.PlatformService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PlatformController.class)
class PlatformControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PlatformService platformService;

    private final UUID owner = UUID.randomUUID();

    @Test
    @DisplayName("GET /platform/settings - Returns pause flag and fee")
    void testGetSettings() throws Exception {
        when(platformService.getSettings()).thenReturn(new PlatformSettingsView(false, 250));

        mockMvc.perform(get("/platform/settings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paused").value(false))
                .andExpect(jsonPath("$.feeBasisPoints").value(250));
    }

    @Test
    @DisplayName("POST /platform/pause - Non-owner returns 403 Forbidden")
    void testPauseForbidden() throws Exception {
        UUID stranger = UUID.randomUUID();
        when(platformService.pause(stranger)).thenThrow(new UnauthorizedException(stranger));

        mockMvc.perform(post("/platform/pause").header("X-User-ID", stranger))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));
    }

    @Test
    @DisplayName("PUT /platform/fee-rate - Out of range body returns 400")
    void testFeeRateValidation() throws Exception {
        mockMvc.perform(put("/platform/fee-rate")
                        .header("X-User-ID", owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"basisPoints\": 20000}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(platformService);
    }
}
