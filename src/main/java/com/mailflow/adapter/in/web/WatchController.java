package com.mailflow.adapter.in.web;

import com.mailflow.application.port.in.ManageWatchUseCase;
import com.mailflow.domain.model.WatchKey;
import com.mailflow.infrastructure.config.AppProperties;
import com.mailflow.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/watches")
@Tag(name = "Watches", description = "Persisted watch registrations")
public class WatchController {

    private final ManageWatchUseCase manageWatchUseCase;
    private final AppProperties appProperties;

    public WatchController(ManageWatchUseCase manageWatchUseCase, AppProperties appProperties) {
        this.manageWatchUseCase = manageWatchUseCase;
        this.appProperties = appProperties;
    }

    @GetMapping("/{serviceType}")
    @Operation(summary = "Get a watch registration", description = "Returns the persisted registration for the service and application")
    public ResponseEntity<?> getWatch(
            @Parameter(description = "Mail service type", example = "gmail")
            @PathVariable String serviceType,
            @Parameter(description = "Application name, defaults to the configured one")
            @RequestParam(required = false) String applicationName) {

        WatchKey key = keyFor(serviceType, applicationName);
        return manageWatchUseCase.getWatch(key)
            .<ResponseEntity<?>>map(registration -> ResponseEntity.ok(WatchResponse.from(registration)))
            .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("WATCH_NOT_FOUND",
                    "No watch registration for " + key.serviceType() + "/" + key.applicationName(),
                    RequestContext.getRequestId())));
    }

    @DeleteMapping("/{serviceType}")
    @Operation(summary = "Cancel a watch", description = "Stops the mailbox watch and clears its persisted registration")
    public ResponseEntity<Void> cancelWatch(
            @PathVariable String serviceType,
            @RequestParam(required = false) String applicationName) {

        manageWatchUseCase.cancelWatch(keyFor(serviceType, applicationName));
        return ResponseEntity.noContent().build();
    }

    private WatchKey keyFor(String serviceType, String applicationName) {
        String app = applicationName != null && !applicationName.isBlank()
            ? applicationName
            : appProperties.getSubscription().getApplicationName();
        return new WatchKey(serviceType, app);
    }
}
