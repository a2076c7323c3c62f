package com.nursingjobs.pipeline.ingest.source;

import com.nursingjobs.pipeline.config.PipelineProperties.SourceBinding;
import com.nursingjobs.pipeline.ingest.http.PoliteHttpClient;
import com.nursingjobs.pipeline.ingest.model.HttpFetchResult;
import com.nursingjobs.pipeline.ingest.model.ListingPage;
import com.nursingjobs.pipeline.ingest.model.RawListing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Shared page loop for the three pagination variants. Subclasses only decide which page comes
 * next; fetching, limits, cancellation and the hard page ceiling live here.
 */
public abstract class AbstractPaginatedSourceAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(AbstractPaginatedSourceAdapter.class);

    protected final SourceBinding binding;
    private final PoliteHttpClient httpClient;
    private final ListingPageParser parser;

    protected AbstractPaginatedSourceAdapter(
        SourceBinding binding,
        PoliteHttpClient httpClient,
        ListingPageParser parser
    ) {
        this.binding = binding;
        this.httpClient = httpClient;
        this.parser = parser;
    }

    @Override
    public String employerSlug() {
        return binding.getSlug();
    }

    @Override
    public Stream<RawListing> fetchListings(FetchLimits limits) {
        FetchLimits safeLimits = limits == null ? FetchLimits.unbounded() : limits;
        PageIterator iterator = new PageIterator(newTraversal(), safeLimits);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED), false);
    }

    /**
     * Per-call traversal state. A fresh instance is created for every {@link #fetchListings}.
     */
    protected abstract PageTraversal newTraversal();

    protected interface PageTraversal {
        PageRequest first();

        /**
         * Whether the listings of a freshly fetched page should be emitted. Returning false
         * also ends the traversal.
         */
        default boolean accept(PageRequest request, ListingPage page) {
            return true;
        }

        /**
         * The page to fetch after {@code page}, or null when the source is exhausted.
         */
        PageRequest next(PageRequest request, ListingPage page);
    }

    protected ListingPage fetchPage(PageRequest request) {
        HttpFetchResult result;
        if ("POST".equalsIgnoreCase(binding.getMethod())) {
            result = httpClient.postJson(request.url(), request.body(), parser.acceptHeader());
        } else {
            result = httpClient.get(request.url(), parser.acceptHeader());
        }
        if (!result.isSuccessful()) {
            throw new AdapterFetchException(
                employerSlug(),
                request.url(),
                "page " + request.pageNumber() + " failed after " + result.attempts() + " attempt(s): "
                    + result.describeFailure()
            );
        }
        return parser.parse(result.body(), result.finalUrlOrRequested());
    }

    protected String resolve(String baseUrl, String reference) {
        if (reference == null || reference.isBlank()) {
            return null;
        }
        try {
            URI resolved = baseUrl == null ? URI.create(reference.trim()) : URI.create(baseUrl).resolve(reference.trim());
            String value = resolved.normalize().toString();
            int hash = value.indexOf('#');
            return hash >= 0 ? value.substring(0, hash) : value;
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed page reference '{}' on {} for {}", reference, baseUrl, employerSlug());
            return null;
        }
    }

    protected String startUrl() {
        String template = binding.getUrlTemplate();
        if (template == null || template.isBlank()) {
            return binding.getCareerPageUrl();
        }
        return expand(template, binding.getStartPage(), 0);
    }

    protected String expand(String template, int page, int offset) {
        if (template == null) {
            return null;
        }
        return template
            .replace("{page}", Integer.toString(page))
            .replace("{offset}", Integer.toString(offset))
            .replace("{pageSize}", Integer.toString(binding.getPageSize()));
    }

    private final class PageIterator implements Iterator<RawListing> {
        private final PageTraversal traversal;
        private final FetchLimits limits;
        private final Deque<RawListing> buffer = new ArrayDeque<>();
        private PageRequest pending;
        private int pagesFetched;
        private int emitted;

        private PageIterator(PageTraversal traversal, FetchLimits limits) {
            this.traversal = traversal;
            this.limits = limits;
            this.pending = traversal.first();
        }

        @Override
        public boolean hasNext() {
            if (limits.itemLimitReached(emitted)) {
                return false;
            }
            while (buffer.isEmpty()) {
                if (pending == null) {
                    return false;
                }
                if (limits.cancelled().getAsBoolean()) {
                    log.info("Stopping {} before page {}: run cancelled", employerSlug(), pending.pageNumber());
                    pending = null;
                    return false;
                }
                if (limits.pageLimitReached(pagesFetched)) {
                    log.info("Stopping {} after {} page(s): page limit reached", employerSlug(), pagesFetched);
                    pending = null;
                    return false;
                }
                if (pagesFetched >= binding.getMaxPages()) {
                    log.warn("Stopping {} at configured ceiling of {} pages", employerSlug(), binding.getMaxPages());
                    pending = null;
                    return false;
                }
                PageRequest current = pending;
                ListingPage page = fetchPage(current);
                pagesFetched++;
                if (!traversal.accept(current, page)) {
                    pending = null;
                    return false;
                }
                log.info(
                    "Fetched {} page {} ({} listings) from {}",
                    employerSlug(),
                    current.pageNumber(),
                    page.listings().size(),
                    current.url()
                );
                buffer.addAll(page.listings());
                pending = traversal.next(current, page);
            }
            return true;
        }

        @Override
        public RawListing next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            emitted++;
            return buffer.removeFirst();
        }
    }
}
