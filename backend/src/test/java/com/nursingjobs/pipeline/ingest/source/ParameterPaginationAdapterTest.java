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
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParameterPaginationAdapterTest {
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
    void stopsAtFirstEmptyPage() {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String page = request.getRequestUrl().queryParameter("page");
                return switch (page) {
                    case "1" -> html(List.of("A1", "A2"));
                    case "2" -> html(List.of("B1"));
                    default -> html(List.of());
                };
            }
        });

        List<String> ids = SourceTestSupport.ids(adapter().fetchListings(FetchLimits.unbounded()));

        assertThat(ids).containsExactly("A1", "A2", "B1");
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void stopsWhenSourceRepeatsThePreviousPage() {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                return html(List.of("SAME-1", "SAME-2"));
            }
        });

        List<String> ids = SourceTestSupport.ids(adapter().fetchListings(FetchLimits.unbounded()));

        assertThat(ids).containsExactly("SAME-1", "SAME-2");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void respectsItemAndPageLimits() {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String page = request.getRequestUrl().queryParameter("page");
                return html(List.of("P" + page + "-1", "P" + page + "-2"));
            }
        });

        assertThat(SourceTestSupport.ids(adapter().fetchListings(new FetchLimits(null, 3, null))))
            .containsExactly("P1-1", "P1-2", "P2-1");
        assertThat(SourceTestSupport.ids(adapter().fetchListings(new FetchLimits(1, null, null))))
            .containsExactly("P1-1", "P1-2");
    }

    @Test
    void stopsAtConfiguredPageCeiling() {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String page = request.getRequestUrl().queryParameter("page");
                return html(List.of("P" + page));
            }
        });
        SourceBinding binding = binding();
        binding.setMaxPages(4);

        List<String> ids = SourceTestSupport.ids(
            new ParameterPaginationAdapter(binding, SourceTestSupport.httpClient(executor), SourceTestSupport.htmlParser(binding))
                .fetchListings(FetchLimits.unbounded())
        );

        assertThat(ids).containsExactly("P1", "P2", "P3", "P4");
    }

    @Test
    void cancellationStopsBeforeNextPage() {
        AtomicBoolean cancelled = new AtomicBoolean(false);
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                cancelled.set(true);
                return html(List.of("C" + request.getRequestUrl().queryParameter("page")));
            }
        });

        List<String> ids = SourceTestSupport.ids(adapter().fetchListings(new FetchLimits(null, null, cancelled::get)));

        assertThat(ids).containsExactly("C1");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void missingContainerIsAStructuralFailure() {
        server.enqueue(new MockResponse().setBody("<html><body><p>We moved!</p></body></html>"));

        assertThatThrownBy(() -> SourceTestSupport.ids(adapter().fetchListings(FetchLimits.unbounded())))
            .isInstanceOf(AdapterFetchException.class)
            .hasMessageContaining("#results");
    }

    @Test
    void serverErrorBecomesAdapterFetchException() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("maintenance"));

        assertThatThrownBy(() -> SourceTestSupport.ids(adapter().fetchListings(FetchLimits.unbounded())))
            .isInstanceOf(AdapterFetchException.class)
            .hasMessageContaining("page 1 failed")
            .hasMessageContaining("503");
    }

    @Test
    void requiresUrlTemplate() {
        SourceBinding binding = SourceTestSupport.htmlBinding(PaginationStrategy.PARAMETER, null, server.url("/careers").toString());

        assertThatThrownBy(() -> new ParameterPaginationAdapter(
            binding,
            SourceTestSupport.httpClient(executor),
            SourceTestSupport.htmlParser(binding)
        )).isInstanceOf(IllegalArgumentException.class);
    }

    private ParameterPaginationAdapter adapter() {
        SourceBinding binding = binding();
        return new ParameterPaginationAdapter(binding, SourceTestSupport.httpClient(executor), SourceTestSupport.htmlParser(binding));
    }

    private SourceBinding binding() {
        return SourceTestSupport.htmlBinding(
            PaginationStrategy.PARAMETER,
            server.url("/careers").toString() + "?page={page}",
            server.url("/careers").toString()
        );
    }

    private static MockResponse html(List<String> ids) {
        return new MockResponse()
            .setHeader("Content-Type", "text/html; charset=utf-8")
            .setBody(SourceTestSupport.htmlPage(ids, null));
    }
}
