package com.phillippitts.livescribe;

import com.phillippitts.livescribe.config.properties.AudioValidationProperties;
import com.phillippitts.livescribe.config.properties.DiarizationProperties;
import com.phillippitts.livescribe.config.properties.DistributionProperties;
import com.phillippitts.livescribe.config.properties.ModelClientProperties;
import com.phillippitts.livescribe.config.properties.ModelWatchdogProperties;
import com.phillippitts.livescribe.config.properties.PreprocessingProperties;
import com.phillippitts.livescribe.config.properties.TranscriptionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        TranscriptionProperties.class,
        ModelClientProperties.class,
        ModelWatchdogProperties.class,
        AudioValidationProperties.class,
        PreprocessingProperties.class,
        DiarizationProperties.class,
        DistributionProperties.class
})
@EnableScheduling
public class LiveScribeApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiveScribeApplication.class, args);
    }

}
