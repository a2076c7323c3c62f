package com.nursingjobs.pipeline.ingest.service;

import com.nursingjobs.pipeline.ingest.model.DeletedJobTombstone;
import com.nursingjobs.pipeline.ingest.model.TombstoneImportSummary;
import com.nursingjobs.pipeline.ingest.persistence.ActivationStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TombstoneImportServiceTest {
    private final ActivationStore store = mock(ActivationStore.class);
    private final TombstoneImportService service = new TombstoneImportService(store);

    @Test
    void retiresSlugsAndUrlsWithReasons() {
        when(store.retire(anyString(), anyString()))
            .thenAnswer(invocation -> new DeletedJobTombstone(invocation.getArgument(0), invocation.getArgument(1), Instant.EPOCH));
        String csv = """
            slug_or_url,reason
            rn-icu-binghamton-ny-r-1001,position filled
            https://nursing.test/jobs/nursing/rn-er-albany-ny-r-2002/,
            ,duplicate
            """;

        TombstoneImportSummary summary = service.importCsv(new StringReader(csv));

        assertEquals(3, summary.rowsRead());
        assertEquals(2, summary.tombstoned());
        assertEquals(1, summary.errors().size());
        assertTrue(summary.errors().get(0).contains("no slug or url"));
        verify(store).retire("rn-icu-binghamton-ny-r-1001", "position filled");
        verify(store).retire("rn-er-albany-ny-r-2002", "removed");
    }

    @Test
    void acceptsAlternateHeaderNames(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("tombstones.csv");
        Files.writeString(file, "URL,Reason\nhttps://nursing.test/jobs/nursing/rn-or-1,expired\n", StandardCharsets.UTF_8);

        TombstoneImportSummary summary = service.importFile(file);

        assertEquals(1, summary.tombstoned());
        verify(store).retire("rn-or-1", "expired");
    }

    @Test
    void missingFileIsReported(@TempDir Path dir) {
        assertThrows(UncheckedIOException.class, () -> service.importFile(dir.resolve("absent.csv")));
    }
}
