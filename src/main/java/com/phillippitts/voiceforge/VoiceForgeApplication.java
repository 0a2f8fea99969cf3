package com.phillippitts.voiceforge;

import com.phillippitts.voiceforge.config.properties.GatewayProperties;
import com.phillippitts.voiceforge.config.properties.ThreadPoolProperties;
import com.phillippitts.voiceforge.config.properties.TurnMetricsProperties;
import com.phillippitts.voiceforge.config.properties.WorkerPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        WorkerPoolProperties.class,
        GatewayProperties.class,
        ThreadPoolProperties.class,
        TurnMetricsProperties.class
})
@EnableScheduling
public class VoiceForgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceForgeApplication.class, args);
    }

}
