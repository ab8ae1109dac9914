package com.phillippitts.livescribe.service.health;

import com.phillippitts.livescribe.service.model.ModelHealthReport;
import com.phillippitts.livescribe.service.model.ModelStatus;
import com.phillippitts.livescribe.service.model.ModelTranscriptionClient;
import com.phillippitts.livescribe.service.model.watchdog.ModelWatchdog;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for the speech model pool.
 *
 * <p>Maps the client's health verdict onto actuator statuses:
 * <ul>
 *   <li>UP: no model in error and latency within bounds</li>
 *   <li>DEGRADED: at least one model ready, but some are failing or slow</li>
 *   <li>DOWN: no model ready</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class ModelHealthIndicator implements HealthIndicator {

    private final ModelTranscriptionClient client;
    private final ObjectProvider<ModelWatchdog> watchdog;

    public ModelHealthIndicator(ModelTranscriptionClient client, ObjectProvider<ModelWatchdog> watchdog) {
        this.client = client;
        this.watchdog = watchdog;
    }

    @Override
    public Health health() {
        ModelHealthReport report = client.healthCheck();
        Health.Builder builder = switch (report.status()) {
            case HEALTHY -> Health.up();
            case DEGRADED -> Health.status("DEGRADED");
            case UNHEALTHY -> Health.down();
        };
        ModelWatchdog dog = watchdog.getIfAvailable();
        Map<String, String> models = new LinkedHashMap<>();
        for (Map.Entry<String, ModelStatus> e : report.models().entrySet()) {
            models.put(e.getKey(), describe(e.getValue(), dog == null || dog.isModelEnabled(e.getKey())));
        }
        return builder
                .withDetail("readyModels", report.readyModels())
                .withDetail("loadingModels", report.loadingModels())
                .withDetail("errorModels", report.errorModels())
                .withDetail("averageLatencyMs", report.averageLatencyMs())
                .withDetail("models", models)
                .build();
    }

    private static String describe(ModelStatus status, boolean enabled) {
        String text = status.state().name();
        if (status.errorMessage() != null) {
            text += " (" + status.errorMessage() + ")";
        }
        return enabled ? text : text + ", disabled by watchdog";
    }
}
