package com.warden.engine.api;

import com.warden.engine.config.ServiceProperties;
import com.warden.engine.domain.recovery.RecoveryEngine;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Service identity and whether a recovery is running. Build metadata lives under
 * {@code /actuator/info}.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final ServiceProperties properties;
    private final RecoveryEngine recovery;
    private final Clock clock;

    public ServiceInfoController(ServiceProperties properties, RecoveryEngine recovery, Clock clock) {
        this.properties = properties;
        this.recovery = recovery;
        this.clock = clock;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", properties.name());
        info.put("environment", properties.environment());
        info.put("description", properties.description());
        info.put("status", "running");
        info.put("recoveryInProgress", recovery.isRecoveryInProgress());
        info.put("timestamp", clock.instant().toString());
        return info;
    }
}
