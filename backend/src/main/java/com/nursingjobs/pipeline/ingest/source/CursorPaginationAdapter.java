package com.nursingjobs.pipeline.ingest.source;

import com.nursingjobs.pipeline.config.PipelineProperties.SourceBinding;
import com.nursingjobs.pipeline.ingest.http.PoliteHttpClient;
import com.nursingjobs.pipeline.ingest.model.ListingPage;
import com.nursingjobs.pipeline.ingest.model.PaginationStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Set;

/**
 * Follows the "next" reference of each page. When the url template carries a {@code {cursor}}
 * placeholder the reference is treated as an opaque token, otherwise as a link.
 */
public class CursorPaginationAdapter extends AbstractPaginatedSourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(CursorPaginationAdapter.class);
    private static final String CURSOR = "{cursor}";

    public CursorPaginationAdapter(SourceBinding binding, PoliteHttpClient httpClient, ListingPageParser parser) {
        super(binding, httpClient, parser);
    }

    @Override
    public PaginationStrategy strategy() {
        return PaginationStrategy.CURSOR;
    }

    @Override
    protected PageTraversal newTraversal() {
        return new PageTraversal() {
            private final Set<String> visited = new HashSet<>();

            @Override
            public PageRequest first() {
                String url = urlFor("");
                String body = bodyFor("");
                visited.add(visitKey(url, body));
                return new PageRequest(1, url, body);
            }

            @Override
            public PageRequest next(PageRequest request, ListingPage page) {
                String reference = page.nextReference();
                if (reference == null || reference.isBlank()) {
                    log.info("{} page {} has no next reference; source exhausted", employerSlug(), request.pageNumber());
                    return null;
                }
                if (page.nextDisabled()) {
                    log.info("{} page {} next reference is disabled; source exhausted", employerSlug(), request.pageNumber());
                    return null;
                }
                String url;
                String body;
                if (usesToken()) {
                    url = urlFor(reference.trim());
                    body = bodyFor(reference.trim());
                } else {
                    url = resolve(request.url(), reference);
                    body = request.body();
                }
                if (url == null) {
                    return null;
                }
                if (!visited.add(visitKey(url, body))) {
                    log.warn("{} next reference {} was already visited; stopping", employerSlug(), reference);
                    return null;
                }
                return new PageRequest(request.pageNumber() + 1, url, body);
            }
        };
    }

    private boolean usesToken() {
        return contains(binding.getUrlTemplate()) || contains(binding.getBodyTemplate());
    }

    private String urlFor(String token) {
        String template = binding.getUrlTemplate();
        if (template == null || template.isBlank()) {
            return binding.getCareerPageUrl();
        }
        String encoded = URLEncoder.encode(token, StandardCharsets.UTF_8);
        return expand(template.replace(CURSOR, encoded), binding.getStartPage(), 0);
    }

    private String bodyFor(String token) {
        String template = binding.getBodyTemplate();
        return template == null ? null : expand(template.replace(CURSOR, token), binding.getStartPage(), 0);
    }

    private static String visitKey(String url, String body) {
        return url + "\n" + (body == null ? "" : body);
    }

    private static boolean contains(String template) {
        return template != null && template.contains(CURSOR);
    }
}
