package com.nursingjobs.pipeline.ingest.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nursingjobs.pipeline.config.PipelineProperties;
import com.nursingjobs.pipeline.ingest.model.ListingPage;
import com.nursingjobs.pipeline.ingest.model.RawListing;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonListingPageParserTest {

    @Test
    void readsWorkdayStyleResponse() {
        PipelineProperties.Selectors selectors = new PipelineProperties.Selectors();
        selectors.setItemsPath("jobPostings");
        selectors.setIdField("bulletFields.0");
        selectors.setUrlField("externalPath");
        selectors.setLocationField("locationsText");
        selectors.setPostedDateField("postedOn");
        selectors.setUrlPrefix("https://uhs.wd5.myworkdayjobs.com/en-US/UHS_Careers");
        JsonListingPageParser parser = new JsonListingPageParser("uhs", selectors, new ObjectMapper());

        ListingPage page = parser.parse(
            """
                {"total": 1, "jobPostings": [{
                  "title": "Registered Nurse - Telemetry",
                  "externalPath": "/job/Binghamton-NY/RN-Telemetry_R-4411",
                  "locationsText": "Binghamton, NY",
                  "postedOn": "Posted 3 Days Ago",
                  "bulletFields": ["R-4411", "Full time"]
                }]}
                """,
            "https://uhs.wd5.myworkdayjobs.com/wday/cxs/uhs/UHS_Careers/jobs"
        );

        assertThat(page.listings()).hasSize(1);
        RawListing listing = page.listings().get(0);
        assertThat(listing.externalId()).isEqualTo("R-4411");
        assertThat(listing.title()).isEqualTo("Registered Nurse - Telemetry");
        assertThat(listing.location()).isEqualTo("Binghamton, NY");
        assertThat(listing.postedDateText()).isEqualTo("Posted 3 Days Ago");
        assertThat(listing.url())
            .isEqualTo("https://uhs.wd5.myworkdayjobs.com/en-US/UHS_Careers/job/Binghamton-NY/RN-Telemetry_R-4411");
        assertThat(page.nextReference()).isNull();
    }

    @Test
    void missingItemsArrayIsAStructuralFailure() {
        PipelineProperties.Selectors selectors = new PipelineProperties.Selectors();
        selectors.setItemsPath("jobPostings");
        JsonListingPageParser parser = new JsonListingPageParser("uhs", selectors, new ObjectMapper());

        assertThatThrownBy(() -> parser.parse("{\"errorCode\": \"HTTP_400\"}", "https://example.test/jobs"))
            .isInstanceOf(AdapterFetchException.class)
            .hasMessageContaining("jobPostings");
        assertThatThrownBy(() -> parser.parse("<html>maintenance</html>", "https://example.test/jobs"))
            .isInstanceOf(AdapterFetchException.class);
    }
}
