package com.skillgraph.audit.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class AuditControllerTest {
    private static final String EXPORT = """
            @skill id="s1" name="mailer"
            @module id="m1" name="smtp" category="email"
            @module id="m2" name="bounce-tracker" category="email"
            @module_dep skill="s1" target="smtp" strength="R"
            @module_dep skill="s1" target="webhook-universal" strength="R"
            """;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void returnsStructuredReportByDefault() throws Exception {
        mockMvc.perform(post("/api/audit").contentType(MediaType.TEXT_PLAIN).content(EXPORT))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.summary.totalModules").value(2))
                .andExpect(jsonPath("$.summary.missingReferences").value(1))
                .andExpect(jsonPath("$.recommendations.wiringSuggestions[0].skillName").value("mailer"));
    }

    @Test
    void rendersTextOnRequest() throws Exception {
        mockMvc.perform(post("/api/audit").param("format", "text").contentType(MediaType.TEXT_PLAIN).content(EXPORT))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("== Orphan Modules ==")));
    }

    @Test
    void rejectsMalformedExportWithIssues() throws Exception {
        mockMvc.perform(post("/api/audit").contentType(MediaType.TEXT_PLAIN).content("@skill id=\"s1\"\n"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("MALFORMED_RECORD"))
                .andExpect(jsonPath("$.issues[0]").value(containsString("name")));
    }

    @Test
    void rejectsUnknownFormat() throws Exception {
        mockMvc.perform(post("/api/audit").param("format", "xml").contentType(MediaType.TEXT_PLAIN).content(EXPORT))
                .andExpect(status().isBadRequest());
    }
}
