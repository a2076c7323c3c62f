package com.nursingjobs.pipeline.ingest.source;

import com.nursingjobs.pipeline.config.PipelineProperties.SourceBinding;
import com.nursingjobs.pipeline.ingest.model.PaginationStrategy;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IndexedPagePaginationAdapterTest {
    private MockWebServer server;
    private ExecutorService executor;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void visitsPageLinksDiscoveredAlongTheWay() {
        // Page links are windowed: page 1 only shows 1-3, page 3 reveals 4.
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String page = request.getRequestUrl().queryParameter("pg");
                String footer = switch (page) {
                    case "1", "2" -> pagination(1, 2, 3);
                    default -> pagination(2, 3, 4);
                };
                return new MockResponse().setBody(SourceTestSupport.htmlPage(List.of("P" + page), footer));
            }
        });

        List<String> ids = SourceTestSupport.ids(adapter().fetchListings(FetchLimits.unbounded()));

        assertThat(ids).containsExactly("P1", "P2", "P3", "P4");
        assertThat(server.getRequestCount()).isEqualTo(4);
    }

    @Test
    void pageLinksPointingBackwardsTerminate() {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String page = request.getRequestUrl().queryParameter("pg");
                String footer = "1".equals(page) ? pagination(1, 2) : pagination(1, 2, 1);
                return new MockResponse().setBody(SourceTestSupport.htmlPage(List.of("P" + page), footer));
            }
        });

        List<String> ids = SourceTestSupport.ids(adapter().fetchListings(FetchLimits.unbounded()));

        assertThat(ids).containsExactly("P1", "P2");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void singlePageWithoutPaginationStopsAfterFirstFetch() {
        server.enqueue(new MockResponse().setBody(SourceTestSupport.htmlPage(List.of("ONLY"), null)));

        assertThat(SourceTestSupport.ids(adapter().fetchListings(FetchLimits.unbounded()))).containsExactly("ONLY");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void requiresPageLinksSelector() {
        SourceBinding binding = binding();
        binding.getSelectors().setPageLinks(null);

        assertThatThrownBy(() -> new IndexedPagePaginationAdapter(
            binding,
            SourceTestSupport.httpClient(executor),
            SourceTestSupport.htmlParser(binding)
        )).isInstanceOf(IllegalArgumentException.class);
    }

    private IndexedPagePaginationAdapter adapter() {
        SourceBinding binding = binding();
        return new IndexedPagePaginationAdapter(binding, SourceTestSupport.httpClient(executor), SourceTestSupport.htmlParser(binding));
    }

    private SourceBinding binding() {
        return SourceTestSupport.htmlBinding(
            PaginationStrategy.INDEXED,
            server.url("/list").toString() + "?pg={page}",
            server.url("/list").toString()
        );
    }

    private static String pagination(int... pages) {
        StringBuilder builder = new StringBuilder("<div class=\"pagination\">");
        for (int page : pages) {
            builder.append("<a href=\"/list?pg=").append(page).append("\">").append(page).append("</a>");
        }
        builder.append("<a href=\"/list?pg=99\">Next &raquo;</a></div>");
        return builder.toString();
    }
}
