package com.nursingjobs.pipeline.ingest.source;

import com.nursingjobs.pipeline.config.PipelineProperties;
import com.nursingjobs.pipeline.config.PipelineProperties.SourceBinding;
import com.nursingjobs.pipeline.ingest.http.PoliteHttpClient;
import com.nursingjobs.pipeline.ingest.model.PageFormat;
import com.nursingjobs.pipeline.ingest.model.PaginationStrategy;
import com.nursingjobs.pipeline.ingest.model.RawListing;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;
import java.util.stream.Stream;

final class SourceTestSupport {
    private SourceTestSupport() {
    }

    static PipelineProperties fastProperties() {
        PipelineProperties properties = new PipelineProperties();
        properties.setPerHostDelayMs(1);
        properties.setRequestTimeoutSeconds(5);
        properties.setRequestMaxRetries(0);
        properties.setRequestRetryBaseDelayMs(1);
        properties.setRequestRetryMaxDelayMs(5);
        return properties;
    }

    static PoliteHttpClient httpClient(ExecutorService executor) {
        return new PoliteHttpClient(fastProperties(), executor);
    }

    static SourceBinding htmlBinding(PaginationStrategy strategy, String urlTemplate, String careerPageUrl) {
        SourceBinding binding = new SourceBinding();
        binding.setSlug("test-hospital");
        binding.setName("Test Hospital");
        binding.setStrategy(strategy);
        binding.setFormat(PageFormat.HTML);
        binding.setUrlTemplate(urlTemplate);
        binding.setCareerPageUrl(careerPageUrl);
        PipelineProperties.Selectors selectors = new PipelineProperties.Selectors();
        selectors.setContainer("#results");
        selectors.setItem(".job");
        selectors.setTitle("a.title");
        selectors.setLocation(".location");
        selectors.setExternalIdAttr("data-id");
        selectors.setNext("a.next");
        selectors.setPageLinks(".pagination a");
        binding.setSelectors(selectors);
        return binding;
    }

    static HtmlListingPageParser htmlParser(SourceBinding binding) {
        return new HtmlListingPageParser(binding.getSlug(), binding.getSelectors());
    }

    /**
     * A results page with one job per id and optional trailing markup (next link, pagination).
     */
    static String htmlPage(List<String> ids, String footer) {
        String jobs = ids.stream()
            .map(id -> "<div class=\"job\" data-id=\"" + id + "\">"
                + "<a class=\"title\" href=\"/jobs/" + id + "\">Registered Nurse " + id + "</a>"
                + "<span class=\"location\">Akron, OH</span></div>")
            .collect(Collectors.joining());
        return "<html><body><div id=\"results\">" + jobs + "</div>" + (footer == null ? "" : footer) + "</body></html>";
    }

    static List<String> ids(Stream<RawListing> listings) {
        try (listings) {
            return listings.map(RawListing::externalId).toList();
        }
    }
}
