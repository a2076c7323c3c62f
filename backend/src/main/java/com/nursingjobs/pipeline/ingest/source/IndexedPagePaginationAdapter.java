package com.nursingjobs.pipeline.ingest.source;

import com.nursingjobs.pipeline.config.PipelineProperties.SourceBinding;
import com.nursingjobs.pipeline.ingest.http.PoliteHttpClient;
import com.nursingjobs.pipeline.ingest.model.ListingPage;
import com.nursingjobs.pipeline.ingest.model.PaginationStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Visits numbered page links in ascending order. Each page contributes the links it offers;
 * the traversal ends once no unvisited page with a higher number than the current one exists.
 */
public class IndexedPagePaginationAdapter extends AbstractPaginatedSourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(IndexedPagePaginationAdapter.class);

    public IndexedPagePaginationAdapter(SourceBinding binding, PoliteHttpClient httpClient, ListingPageParser parser) {
        super(binding, httpClient, parser);
        if (binding.getSelectors().getPageLinks() == null || binding.getSelectors().getPageLinks().isBlank()) {
            throw new IllegalArgumentException("indexed pagination for " + binding.getSlug() + " requires a page-links selector");
        }
    }

    @Override
    public PaginationStrategy strategy() {
        return PaginationStrategy.INDEXED;
    }

    @Override
    protected PageTraversal newTraversal() {
        return new PageTraversal() {
            private final TreeMap<Integer, String> known = new TreeMap<>();
            private final Set<String> visitedUrls = new HashSet<>();

            @Override
            public PageRequest first() {
                String url = startUrl();
                visitedUrls.add(url);
                return new PageRequest(Math.max(1, binding.getStartPage()), url, binding.getBodyTemplate());
            }

            @Override
            public PageRequest next(PageRequest request, ListingPage page) {
                for (Map.Entry<Integer, String> link : page.pageLinks().entrySet()) {
                    known.putIfAbsent(link.getKey(), link.getValue());
                }
                for (Map.Entry<Integer, String> candidate : known.tailMap(request.pageNumber(), false).entrySet()) {
                    String url = resolve(request.url(), candidate.getValue());
                    if (url != null && visitedUrls.add(url)) {
                        return new PageRequest(candidate.getKey(), url, binding.getBodyTemplate());
                    }
                }
                log.info("{} page {} offers no higher page number; source exhausted", employerSlug(), request.pageNumber());
                return null;
            }
        };
    }
}
