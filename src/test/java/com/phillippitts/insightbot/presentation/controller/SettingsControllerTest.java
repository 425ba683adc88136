package com.phillippitts.insightbot.presentation.controller;

import com.phillippitts.insightbot.domain.AnalysisMode;
import com.phillippitts.insightbot.domain.GuildSettings;
import com.phillippitts.insightbot.exception.InvalidSettingException;
import com.phillippitts.insightbot.service.settings.GuildSettingsService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SettingsController.class)
class SettingsControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private GuildSettingsService settingsService;

    @Test
    void returnsCurrentSettings() throws Exception {
        when(settingsService.getSettings(1L)).thenReturn(new GuildSettings(1L, AnalysisMode.SUMMARY, 120));

        mvc.perform(get("/api/guilds/1/settings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("summary"))
                .andExpect(jsonPath("$.intervalSeconds").value(120));
    }

    @Test
    void updatesMode() throws Exception {
        when(settingsService.setMode(1L, "debate")).thenReturn(new GuildSettings(1L, AnalysisMode.DEBATE, 300));

        mvc.perform(put("/api/guilds/1/settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mode\":\"debate\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("debate"));
        verify(settingsService, never()).setInterval(anyLong(), anyLong());
    }

    @Test
    void invalidIntervalReturns400() throws Exception {
        when(settingsService.setInterval(1L, 5L))
                .thenThrow(new InvalidSettingException("intervalSeconds", "5", "must be between 60 and 3600 seconds"));

        mvc.perform(put("/api/guilds/1/settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"intervalSeconds\":5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("InvalidSettingException"));
    }

    @Test
    void emptyUpdateReturns400() throws Exception {
        mvc.perform(put("/api/guilds/1/settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
        verify(settingsService, never()).setMode(anyLong(), anyString());
    }
}
