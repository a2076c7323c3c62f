package com.nursingjobs.pipeline.ingest.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nursingjobs.pipeline.config.PipelineProperties;
import com.nursingjobs.pipeline.config.PipelineProperties.SourceBinding;
import com.nursingjobs.pipeline.ingest.http.PoliteHttpClient;
import com.nursingjobs.pipeline.ingest.model.PageFormat;
import com.nursingjobs.pipeline.ingest.service.UnknownEmployerException;
import org.springframework.stereotype.Component;

@Component
public class SourceAdapterFactory {
    private final PipelineProperties properties;
    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public SourceAdapterFactory(PipelineProperties properties, PoliteHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    public SourceBinding bindingFor(String employerSlug) {
        SourceBinding binding = properties.findSource(employerSlug);
        if (binding == null) {
            throw new UnknownEmployerException(employerSlug);
        }
        return binding;
    }

    public SourceAdapter forEmployer(String employerSlug) {
        return create(bindingFor(employerSlug));
    }

    public SourceAdapter create(SourceBinding binding) {
        ListingPageParser parser = binding.getFormat() == PageFormat.JSON
            ? new JsonListingPageParser(binding.getSlug(), binding.getSelectors(), objectMapper)
            : new HtmlListingPageParser(binding.getSlug(), binding.getSelectors());
        return switch (binding.getStrategy()) {
            case PARAMETER -> new ParameterPaginationAdapter(binding, httpClient, parser);
            case CURSOR -> new CursorPaginationAdapter(binding, httpClient, parser);
            case INDEXED -> new IndexedPagePaginationAdapter(binding, httpClient, parser);
        };
    }
}
