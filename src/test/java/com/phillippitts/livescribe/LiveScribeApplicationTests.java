package com.phillippitts.livescribe;

import com.phillippitts.livescribe.domain.FullTranscript;
import com.phillippitts.livescribe.domain.SessionSnapshot;
import com.phillippitts.livescribe.domain.SessionStatus;
import com.phillippitts.livescribe.domain.TranscriptionConfig;
import com.phillippitts.livescribe.service.model.SpeechModelGateway;
import com.phillippitts.livescribe.service.session.TranscriptionSessionManager;
import com.phillippitts.livescribe.testutil.FakeSpeechModelGateway;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.actuate.observability.AutoConfigureObservability;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

@AutoConfigureObservability
@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        "livescribe.model.preload-on-startup=false", // no network calls during startup
        "livescribe.model.load-retry-backoff-ms=0"
    }
)
class LiveScribeApplicationTests {

    @TestConfiguration
    static class FakeGatewayConfiguration {
        @Bean
        @Primary
        SpeechModelGateway fakeSpeechModelGateway() {
            return new FakeSpeechModelGateway();
        }
    }

    @Autowired
    private TranscriptionSessionManager manager;

    @Autowired
    private TestRestTemplate rest;

    @Test
    void contextLoads() {
        assertThat(manager).isNotNull();
    }

    @Test
    void sessionRunsThroughWiredPipeline() {
        SessionSnapshot session = manager.startSession(null,
                TranscriptionConfig.builder().enableDiarization(false).build());
        assertThat(session.status()).isEqualTo(SessionStatus.ACTIVE);

        manager.processAudioChunk(session.id(), new byte[TranscriptionConfig.DEFAULT_CHUNK_SIZE]);
        FullTranscript transcript = manager.finalizeTranscript(session.id());

        assertThat(transcript.segments()).singleElement()
                .satisfies(s -> assertThat(s.text()).isEqualTo("hello world"));
        assertThat(manager.getActiveSessionIds()).doesNotContain(session.id());
    }

    @Test
    void actuatorExposesHealthAndPrometheus() {
        ResponseEntity<String> health = rest.getForEntity("/actuator/health", String.class);
        assertThat(health.getBody()).contains("\"status\"");

        ResponseEntity<String> prometheus = rest.getForEntity("/actuator/prometheus", String.class);
        assertThat(prometheus.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(prometheus.getBody()).contains("livescribe_pool_size");
    }
}
