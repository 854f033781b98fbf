package com.example.cratebridge;

import com.example.cratebridge.common.config.AppAnalysisProperties;
import com.example.cratebridge.common.config.AppMigrationProperties;
import com.example.cratebridge.common.config.AppScanProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AppScanProperties.class,
        AppAnalysisProperties.class,
        AppMigrationProperties.class
})
public class CrateBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(CrateBridgeApplication.class, args);
    }
}
