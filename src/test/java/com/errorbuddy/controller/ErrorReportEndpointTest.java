package com.errorbuddy.controller;

import com.errorbuddy.service.report.ErrorReportingPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Runs HTTP submissions through the real pipeline and stores.
 */
@SpringBootTest(properties = {
        "error-reporter.log-tail.enabled=false",
        "error-reporter.rate-limit.max-reports-per-window=2"
})
@AutoConfigureMockMvc
class ErrorReportEndpointTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ErrorReportingPipeline pipeline;

    @BeforeEach
    void setUp() {
        pipeline.clearTrackedErrors();
        pipeline.resetRateLimit();
    }

    @Test
    void shouldRateLimitPostedReportsThatClaimToBeCritical() throws Exception {
        // Given - two distinct reports fill the window
        submit(1, 202);
        submit(2, 202);

        // When / Then - the client supplied critical flag does not reset the window
        mockMvc.perform(post("/api/error-reports")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(3)))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.reason").value("rate_limited"));
    }

    @Test
    void shouldSkipPostedDuplicateDespiteBypassFlag() throws Exception {
        submit(1, 202);

        mockMvc.perform(post("/api/error-reports")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(1)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("SKIPPED"));
    }

    private void submit(int line, int expectedStatus) throws Exception {
        mockMvc.perform(post("/api/error-reports")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(line)))
                .andExpect(status().is(expectedStatus));
    }

    private static String body(int line) {
        return "{\"message\":\"Fatal: checkout failed\",\"code\":\"500\",\"file\":\"Cart.php\",\"line\":" + line
                + ",\"critical\":true,\"bypassDuplicateCheck\":true}";
    }
}
