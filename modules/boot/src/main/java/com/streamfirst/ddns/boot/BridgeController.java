package com.streamfirst.ddns.boot;

import com.streamfirst.ddns.application.ResolutionRouter;
import com.streamfirst.ddns.application.ResolveOptions;
import com.streamfirst.ddns.application.SyncOrchestrator;
import com.streamfirst.ddns.domain.BatchResolutionResult;
import com.streamfirst.ddns.domain.ResolutionResult;
import com.streamfirst.ddns.domain.ResolutionStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP surface of the bridge: engine statistics, ad-hoc resolution and a stop switch.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class BridgeController {

    private final SyncOrchestrator syncOrchestrator;
    private final ResolutionRouter resolutionRouter;

    @GetMapping("/stats")
    public Map<String, Object> stats() {
        ResolutionStats resolution = resolutionRouter.getStats();
        Map<String, Object> derived = new LinkedHashMap<>();
        derived.put("averageFastLatencyMs", resolution.averageFastLatency().toMillis());
        derived.put("averageAuthoritativeLatencyMs", resolution.averageAuthoritativeLatency().toMillis());
        derived.put("cacheHitRate", resolution.cacheHitRate());
        derived.put("latencyReduction", resolution.latencyReduction());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sync", syncOrchestrator.getStats());
        body.put("resolution", resolution);
        body.put("derived", derived);
        return body;
    }

    @GetMapping("/resolve/{name}/{type}")
    public ResolutionResult resolve(
            @PathVariable String name,
            @PathVariable String type,
            @RequestParam(defaultValue = "false") boolean forceAuthoritative,
            @RequestParam(defaultValue = "false") boolean forceFast,
            @RequestParam(defaultValue = "false") boolean skipCache,
            @RequestParam(required = false) Boolean verify) {
        return resolutionRouter.resolve(name, type,
                options(forceAuthoritative, forceFast, skipCache, verify));
    }

    @GetMapping("/resolve/{name}")
    public BatchResolutionResult resolveBatch(
            @PathVariable String name,
            @RequestParam List<String> types,
            @RequestParam(defaultValue = "false") boolean forceAuthoritative,
            @RequestParam(defaultValue = "false") boolean forceFast,
            @RequestParam(defaultValue = "false") boolean skipCache,
            @RequestParam(required = false) Boolean verify) {
        return resolutionRouter.resolveBatch(name, types,
                options(forceAuthoritative, forceFast, skipCache, verify));
    }

    @PostMapping("/bridge/stop")
    public Map<String, Object> stop() {
        log.info("Stop requested over HTTP");
        boolean stopped = syncOrchestrator.stop();
        return Map.of("stopped", stopped, "running", syncOrchestrator.isRunning());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> badRequest(IllegalArgumentException e) {
        return Map.of("error", e.getMessage());
    }

    private static ResolveOptions options(
            boolean forceAuthoritative, boolean forceFast, boolean skipCache, Boolean verify) {
        return ResolveOptions.builder()
                .forceAuthoritative(forceAuthoritative)
                .forceFast(forceFast)
                .skipCache(skipCache)
                .verify(verify)
                .build();
    }
}
