package com.phillippitts.livescribe.service.health;

import com.phillippitts.livescribe.config.properties.ModelClientProperties;
import com.phillippitts.livescribe.service.model.DefaultModelTranscriptionClient;
import com.phillippitts.livescribe.service.model.watchdog.ModelWatchdog;
import com.phillippitts.livescribe.testutil.EventCapturingPublisher;
import com.phillippitts.livescribe.testutil.FakeSpeechModelGateway;
import com.phillippitts.livescribe.testutil.MutableClock;
import com.phillippitts.livescribe.testutil.SyncExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ModelHealthIndicatorTest {

    private FakeSpeechModelGateway gateway;
    private DefaultModelTranscriptionClient client;
    private ModelHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        gateway = new FakeSpeechModelGateway();
        ModelClientProperties props = new ModelClientProperties();
        props.setModels(List.of("model-a", "model-b", "model-c"));
        props.setLoadRetryBackoffMs(0);
        client = new DefaultModelTranscriptionClient(gateway, props, new SyncExecutor(),
                new EventCapturingPublisher(), new MutableClock());
        ObjectProvider<ModelWatchdog> noWatchdog = mock();
        when(noWatchdog.getIfAvailable()).thenReturn(null);
        indicator = new ModelHealthIndicator(client, noWatchdog);
    }

    @Test
    void shouldReportDownWhenNoModelIsReady() {
        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("readyModels", 0);
    }

    @Test
    void shouldReportUpWhenLoadedModelsAreReady() {
        client.loadModel("model-a");

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("readyModels", 1);
        assertThat(health.getDetails().get("models")).isEqualTo(Map.of("model-a", "READY"));
    }

    @Test
    void shouldReportDegradedWhenMostModelsFail() {
        gateway.failLoads("model-b").failLoads("model-c");
        client.loadModel("model-a");
        client.loadModel("model-b");
        client.loadModel("model-c");

        Health health = indicator.health();

        assertThat(health.getStatus().getCode()).isEqualTo("DEGRADED");
        assertThat(health.getDetails()).containsEntry("errorModels", 2);
        assertThat(health.getDetails().get("models")).asString()
                .contains("model-b=ERROR");
    }
}
