package com.clapgrow.mediarelay.worker;

import com.clapgrow.mediarelay.worker.enums.SessionState;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Boots the whole worker with session auto-start disabled (see test application.yml).
 */
@SpringBootTest
@AutoConfigureMockMvc
class MediaRelayWorkerApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void testContextLoads_StatusIsInitializing() throws Exception {
        mockMvc.perform(get("/api/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.state").value(SessionState.INITIALIZING.name()))
            .andExpect(jsonPath("$.reconnecting").value(false));
    }

    @Test
    void testConfigEndpoint_ServesRules() throws Exception {
        mockMvc.perform(get("/api/config"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.rules").isArray());
    }
}
