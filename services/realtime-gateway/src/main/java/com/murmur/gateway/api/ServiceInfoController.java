package com.murmur.gateway.api;

import com.murmur.eventbus.dispatch.DispatchTable;
import com.murmur.gateway.config.EventBackboneProperties;
import com.murmur.gateway.config.GatewayProperties;
import com.murmur.gateway.realtime.GatewayFanout;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Runtime information about this gateway instance and its event backbone. */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final GatewayProperties gateway;
    private final EventBackboneProperties events;
    private final DispatchTable dispatchTable;
    private final GatewayFanout fanout;

    public ServiceInfoController(
            GatewayProperties gateway, EventBackboneProperties events, DispatchTable dispatchTable,
            GatewayFanout fanout) {
        this.gateway = gateway;
        this.events = events;
        this.dispatchTable = dispatchTable;
        this.fanout = fanout;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", gateway.name());
        info.put("instanceId", gateway.instanceId());
        info.put("environment", gateway.environment());
        info.put("eventLog", events.eventLog().name().toLowerCase());
        info.put("idempotencyStore", events.idempotencyStore().name().toLowerCase());
        info.put("broker", events.broker().name().toLowerCase());
        info.put("listeners", dispatchTable.size());
        info.put("attachedSockets", fanout.attachedSockets());
        info.put("status", "running");
        info.put("timestamp", Instant.now().toString());
        return info;
    }
}
