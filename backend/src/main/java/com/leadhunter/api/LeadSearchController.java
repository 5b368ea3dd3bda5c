package com.leadhunter.api;

import com.leadhunter.search.model.LeadSearchRequest;
import com.leadhunter.search.model.LeadSearchResult;
import com.leadhunter.search.service.LeadExportService;
import com.leadhunter.search.service.LeadPipelineService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.Map;

@RestController
@RequestMapping("/api/leads")
public class LeadSearchController {
    private final LeadPipelineService pipelineService;
    private final LeadExportService exportService;

    public LeadSearchController(LeadPipelineService pipelineService, LeadExportService exportService) {
        this.pipelineService = pipelineService;
        this.exportService = exportService;
    }

    @PostMapping("/search")
    public LeadSearchResponse search(
        @RequestBody LeadSearchRequest request,
        @RequestParam(name = "export", defaultValue = "true") boolean export
    ) {
        if (request == null || request.jobTitle() == null || request.jobTitle().isBlank()) {
            throw new IllegalArgumentException("jobTitle is required");
        }
        LeadSearchResult result = pipelineService.run(request);
        String outputFile = null;
        if (export) {
            Path written = exportService.export(result.leads());
            outputFile = written.toString();
        }
        return new LeadSearchResponse(outputFile, result);
    }

    @PostMapping("/cancel")
    public Map<String, Integer> cancel() {
        return Map.of("cancelledRuns", pipelineService.cancelAll());
    }
}
