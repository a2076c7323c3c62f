package com.nursingjobs.pipeline.ingest.api;

import com.nursingjobs.pipeline.ingest.model.DeletedJobTombstone;
import com.nursingjobs.pipeline.ingest.model.JobView;
import com.nursingjobs.pipeline.ingest.model.TombstoneImportSummary;
import com.nursingjobs.pipeline.ingest.service.JobLookupService;
import com.nursingjobs.pipeline.ingest.service.TombstoneImportService;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.StringReader;

@RestController
@RequestMapping("/api/jobs")
public class JobController {
    private final JobLookupService lookupService;
    private final TombstoneImportService tombstoneImportService;

    public JobController(JobLookupService lookupService, TombstoneImportService tombstoneImportService) {
        this.lookupService = lookupService;
        this.tombstoneImportService = tombstoneImportService;
    }

    @GetMapping("/{slug}")
    public JobView job(@PathVariable("slug") String slug) {
        return lookupService.lookup(slug);
    }

    @DeleteMapping("/{slug}")
    public DeletedJobTombstone retire(
        @PathVariable("slug") String slug,
        @RequestParam(name = "reason", required = false) String reason
    ) {
        return lookupService.retire(slug, reason);
    }

    @PostMapping(value = "/tombstones/import", consumes = {"text/csv", "text/plain"})
    public TombstoneImportSummary importTombstones(@RequestBody String csv) {
        return tombstoneImportService.importCsv(new StringReader(csv));
    }
}
