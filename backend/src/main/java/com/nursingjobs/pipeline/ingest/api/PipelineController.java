package com.nursingjobs.pipeline.ingest.api;

import com.nursingjobs.pipeline.config.PipelineProperties;
import com.nursingjobs.pipeline.ingest.model.RunRecord;
import com.nursingjobs.pipeline.ingest.model.SourceBindingView;
import com.nursingjobs.pipeline.ingest.service.PipelineOrchestrator;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/pipeline")
public class PipelineController {
    private final PipelineOrchestrator orchestrator;
    private final PipelineProperties properties;

    public PipelineController(PipelineOrchestrator orchestrator, PipelineProperties properties) {
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    @PostMapping("/run/{employerSlug}")
    public RunRecord run(
        @PathVariable("employerSlug") String employerSlug,
        @RequestParam(name = "maxPages", required = false) Integer maxPages,
        @RequestParam(name = "maxItems", required = false) Integer maxItems
    ) {
        return orchestrator.run(employerSlug, maxPages, maxItems);
    }

    @PostMapping("/cancel/{employerSlug}")
    public Map<String, Object> cancel(@PathVariable("employerSlug") String employerSlug) {
        return Map.of("employer", employerSlug, "cancelled", orchestrator.cancel(employerSlug));
    }

    @GetMapping("/sources")
    public List<SourceBindingView> sources() {
        return properties.getSources().stream()
            .map(source -> new SourceBindingView(
                source.getSlug(),
                source.getName(),
                source.getCareerPageUrl(),
                source.getStrategy(),
                source.getFormat()
            ))
            .toList();
    }
}
