package dev.jobdesk;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class JobDeskApplication implements CommandLineRunner {

    private final DashboardRunner dashboardRunner;
    private final ExitManager exitManager;

    public static void main(String[] args) {
        SpringApplication.run(JobDeskApplication.class, args);
    }

    @Override
    public void run(String... args) {
        try {
            dashboardRunner.execute();
            exitManager.exit(0);
        } catch (Exception e) {
            log.error("Job desk failed: {}", e.getMessage(), e);
            exitManager.exit(1);
        }
    }
}
