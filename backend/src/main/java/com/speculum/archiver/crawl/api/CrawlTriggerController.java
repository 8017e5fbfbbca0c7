package com.speculum.archiver.crawl.api;

import com.speculum.archiver.crawl.model.TriggerCycleSummary;
import com.speculum.archiver.crawl.model.TriggerStatusResponse;
import com.speculum.archiver.crawl.service.CrawlTriggerService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/trigger")
public class CrawlTriggerController {
    private final CrawlTriggerService triggerService;

    public CrawlTriggerController(CrawlTriggerService triggerService) {
        this.triggerService = triggerService;
    }

    @PostMapping("/start")
    public TriggerStatusResponse start() {
        triggerService.start();
        return triggerService.getStatus();
    }

    @PostMapping("/stop")
    public TriggerStatusResponse stop() {
        triggerService.stop();
        return triggerService.getStatus();
    }

    @GetMapping("/status")
    public TriggerStatusResponse status() {
        return triggerService.getStatus();
    }

    @PostMapping("/run-once")
    public TriggerCycleSummary runOnce() {
        return triggerService.runOnce();
    }
}
