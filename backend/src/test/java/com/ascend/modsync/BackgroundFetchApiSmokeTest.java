package com.ascend.modsync;

import com.ascend.modsync.sync.service.SyncController;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class BackgroundFetchApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private SyncController syncController;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @AfterEach
    void tearDown() {
        syncController.stop();
    }

    @Test
    void statusStartsStoppedWithConfiguredBucket() throws Exception {
        mockMvc.perform(get("/api/curseforge/background-fetch"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.data.isRunning").value(false))
            .andExpect(jsonPath("$.data.tokenBucket.capacity").value(5))
            .andExpect(jsonPath("$.data.tokenBucket.refillRatePerSecond").value(1.0));
    }

    @Test
    void invalidActionLeavesEngineStopped() throws Exception {
        mockMvc.perform(post("/api/curseforge/background-fetch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"action\":\"bogus\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false));

        mockMvc.perform(get("/api/curseforge/background-fetch"))
            .andExpect(jsonPath("$.data.isRunning").value(false));
    }

    @Test
    void startThenStopTogglesRunningFlag() throws Exception {
        mockMvc.perform(post("/api/curseforge/background-fetch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"action\":\"start\"}"))
            .andExpect(status().isOk());
        mockMvc.perform(get("/api/curseforge/background-fetch"))
            .andExpect(jsonPath("$.data.isRunning").value(true));

        mockMvc.perform(post("/api/curseforge/background-fetch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"action\":\"stop\"}"))
            .andExpect(status().isOk());
        mockMvc.perform(get("/api/curseforge/background-fetch"))
            .andExpect(jsonPath("$.data.isRunning").value(false));
    }

    @Test
    void deleteIsNotAllowed() throws Exception {
        mockMvc.perform(delete("/api/curseforge/background-fetch"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void seededModIdsAreTracked() throws Exception {
        mockMvc.perform(get("/api/curseforge/mods/100/record"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.key").value("100"));
        mockMvc.perform(get("/api/curseforge/mods/200/record"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.key").value("200"));
    }
}
