package com.phillippitts.ttsbatch;

import com.phillippitts.ttsbatch.config.properties.CacheProperties;
import com.phillippitts.ttsbatch.config.properties.ModelProperties;
import com.phillippitts.ttsbatch.config.properties.SynthesisProperties;
import com.phillippitts.ttsbatch.config.tts.PiperConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        PiperConfig.class,
        SynthesisProperties.class,
        ModelProperties.class,
        CacheProperties.class
})
public class TtsBatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(TtsBatchApplication.class, args);
    }

}
