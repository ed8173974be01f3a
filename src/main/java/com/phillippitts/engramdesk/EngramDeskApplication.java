package com.phillippitts.engramdesk;

import com.phillippitts.engramdesk.config.properties.SidecarProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        SidecarProperties.class
})
@EnableScheduling
public class EngramDeskApplication {

    public static void main(String[] args) {
        SpringApplication.run(EngramDeskApplication.class, args);
    }

}
