package com.phillippitts.callpilot;

import com.phillippitts.callpilot.config.properties.AvailabilityProperties;
import com.phillippitts.callpilot.config.properties.OutreachProperties;
import com.phillippitts.callpilot.config.properties.PlacementProperties;
import com.phillippitts.callpilot.config.properties.RankingProperties;
import com.phillippitts.callpilot.config.properties.SinkProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        RankingProperties.class,
        OutreachProperties.class,
        PlacementProperties.class,
        SinkProperties.class,
        AvailabilityProperties.class
})
@EnableScheduling
public class CallPilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(CallPilotApplication.class, args);
    }

}
