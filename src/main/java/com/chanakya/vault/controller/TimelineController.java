package com.chanakya.vault.controller;

import com.chanakya.vault.model.dto.response.ReportResponse;
import com.chanakya.vault.service.TimelineService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/**
 * Viewer endpoint. The token in the path is the only credential.
 */
@RestController
@RequestMapping("/api/timeline")
public class TimelineController {

    private final TimelineService timelineService;

    public TimelineController(TimelineService timelineService) {
        this.timelineService = timelineService;
    }

    @GetMapping("/{token}")
    public Flux<ReportResponse> getTimeline(@PathVariable String token) {
        return timelineService.readTimeline(token).map(ReportResponse::from);
    }
}
