package com.nursingjobs.pipeline.ingest.api;

import com.nursingjobs.pipeline.ingest.model.Classification;
import com.nursingjobs.pipeline.ingest.model.Employer;
import com.nursingjobs.pipeline.ingest.model.NormalizedJob;
import com.nursingjobs.pipeline.ingest.model.UpsertResult;
import com.nursingjobs.pipeline.ingest.persistence.ActivationStore;
import com.nursingjobs.pipeline.ingest.persistence.JdbcEmployerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.context.WebApplicationContext;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class PipelineApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private ActivationStore store;

    @Autowired
    private JdbcEmployerRepository employers;

    private MockMvc mockMvc;
    private String suffix;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
        this.suffix = UUID.randomUUID().toString().substring(0, 8);
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        mockMvc.perform(get("/api/jobs/missing-" + suffix))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("job_not_found"));
    }

    @Test
    void activeJobIsServedUntilRetired() throws Exception {
        String slug = activeJob();

        mockMvc.perform(get("/api/jobs/" + slug))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.specialty").value("ICU"))
            .andExpect(jsonPath("$.employerName").value("Api Hospital " + suffix));

        mockMvc.perform(delete("/api/jobs/" + slug).param("reason", "position filled"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.reason").value("position filled"));

        mockMvc.perform(get("/api/jobs/" + slug))
            .andExpect(status().isGone())
            .andExpect(jsonPath("$.error").value("job_gone"))
            .andExpect(jsonPath("$.reason").value("position filled"));
    }

    @Test
    void importedTombstonesAnswerGone() throws Exception {
        String slug = "imported-" + suffix;

        mockMvc.perform(post("/api/jobs/tombstones/import")
                .contentType(MediaType.valueOf("text/csv"))
                .content("slug_or_url,reason\nhttps://nursing.test/jobs/nursing/" + slug + ",expired\n"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.rowsRead").value(1))
            .andExpect(jsonPath("$.tombstoned").value(1));

        mockMvc.perform(get("/api/jobs/" + slug))
            .andExpect(status().isGone())
            .andExpect(jsonPath("$.reason").value("expired"));
    }

    @Test
    void sourcesListConfiguredEmployers() throws Exception {
        mockMvc.perform(get("/api/pipeline/sources"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].slug").value("test-employer"))
            .andExpect(jsonPath("$[0].strategy").value("PARAMETER"));
    }

    @Test
    void runForUnknownEmployerIsNotFound() throws Exception {
        mockMvc.perform(post("/api/pipeline/run/nowhere"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("unknown_employer"));
    }

    @Test
    void unreachableSourceEndsInScrapeFailure() throws Exception {
        mockMvc.perform(post("/api/pipeline/run/test-employer").param("maxPages", "1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.finalState").value("SCRAPE_FAILED"))
            .andExpect(jsonPath("$.classifyStatus").value("SKIPPED"))
            .andExpect(jsonPath("$.announceStatus").value("SKIPPED"));
    }

    @Test
    void cancelWithoutRunReportsFalse() throws Exception {
        mockMvc.perform(post("/api/pipeline/cancel/test-employer"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cancelled").value(false));
    }

    private String activeJob() {
        Employer employer = employers.getOrCreate("api-" + suffix, "Api Hospital " + suffix, null);
        UpsertResult inserted = store.upsert(new NormalizedJob(
            "api-key-" + suffix,
            employer.id(),
            employer.slug(),
            "Registered Nurse ICU",
            "registered-nurse-icu-" + suffix,
            "Albany",
            "NY",
            "ICU",
            "full-time",
            null,
            null,
            null,
            LocalDate.of(2026, 3, 1),
            "https://careers.example.org/jobs/" + suffix,
            null,
            "Critical care unit.",
            "hash-" + suffix
        ));
        store.markActive(List.of(inserted.record().id()), new Classification("ICU", null, null, null, null));
        return inserted.record().slug();
    }
}
