package com.nursingjobs.pipeline.ingest.source;

import com.nursingjobs.pipeline.config.PipelineProperties.SourceBinding;
import com.nursingjobs.pipeline.ingest.http.PoliteHttpClient;
import com.nursingjobs.pipeline.ingest.model.ListingPage;
import com.nursingjobs.pipeline.ingest.model.PaginationStrategy;
import com.nursingjobs.pipeline.ingest.model.RawListing;
import com.nursingjobs.pipeline.ingest.util.HashUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;

/**
 * Increments a page index (or offset) embedded in the request until a page comes back empty or
 * repeats a page already seen.
 */
public class ParameterPaginationAdapter extends AbstractPaginatedSourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(ParameterPaginationAdapter.class);

    public ParameterPaginationAdapter(SourceBinding binding, PoliteHttpClient httpClient, ListingPageParser parser) {
        super(binding, httpClient, parser);
        if (binding.getUrlTemplate() == null || binding.getUrlTemplate().isBlank()) {
            throw new IllegalArgumentException("parameter pagination for " + binding.getSlug() + " requires a url-template");
        }
    }

    @Override
    public PaginationStrategy strategy() {
        return PaginationStrategy.PARAMETER;
    }

    @Override
    protected PageTraversal newTraversal() {
        return new PageTraversal() {
            private final Set<String> seenFingerprints = new HashSet<>();

            @Override
            public PageRequest first() {
                return request(0);
            }

            @Override
            public boolean accept(PageRequest request, ListingPage page) {
                if (page.listings().isEmpty()) {
                    log.info("{} page {} returned no listings; source exhausted", employerSlug(), request.pageNumber());
                    return false;
                }
                if (!seenFingerprints.add(fingerprint(page))) {
                    log.info("{} page {} repeats earlier content; source exhausted", employerSlug(), request.pageNumber());
                    return false;
                }
                return true;
            }

            @Override
            public PageRequest next(PageRequest request, ListingPage page) {
                return request(request.pageNumber() - binding.getStartPage() + 1);
            }
        };
    }

    private PageRequest request(int index) {
        int page = binding.getStartPage() + index;
        int offset = index * binding.getPageSize();
        return new PageRequest(
            page,
            expand(binding.getUrlTemplate(), page, offset),
            expand(binding.getBodyTemplate(), page, offset)
        );
    }

    private String fingerprint(ListingPage page) {
        StringBuilder builder = new StringBuilder();
        for (RawListing listing : page.listings()) {
            builder.append(listing.externalId()).append('|')
                .append(listing.url()).append('|')
                .append(listing.title()).append('\n');
        }
        return HashUtils.sha256Hex(builder.toString());
    }
}
