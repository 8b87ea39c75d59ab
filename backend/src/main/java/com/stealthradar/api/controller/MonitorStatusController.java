package com.stealthradar.api.controller;

import com.stealthradar.api.dto.MonitorStatusResponse;
import com.stealthradar.monitor.MonitorService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /api/v1/monitor/status. Read-only view of the stealth monitor.
 */
@RestController
@RequestMapping("/api/v1/monitor")
@RequiredArgsConstructor
public class MonitorStatusController {

    private final MonitorService monitorService;

    @GetMapping("/status")
    public MonitorStatusResponse status() {
        return MonitorStatusResponse.from(monitorService.status());
    }
}
