package com.signalwatch.reference;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Reference service wiring the core, the REST and admin controllers and the configured registry. */
@EnableScheduling
@Slf4j
@SpringBootApplication(scanBasePackages = {"com.signalwatch"})
public class SignalwatchApplication {

    public static void main(String[] args) {
        long maxMemory = Runtime.getRuntime().maxMemory();
        log.info("Max memory: {} ({} bytes)", formatBytes(maxMemory), maxMemory);
        SpringApplication.run(SignalwatchApplication.class, args);
    }

    private static String formatBytes(long bytes) {
        if (bytes >= 1_073_741_824L) return String.format("%.2f GB", bytes / 1_073_741_824.0);
        if (bytes >= 1_048_576L) return String.format("%.2f MB", bytes / 1_048_576.0);
        return String.format("%d bytes", bytes);
    }
}
