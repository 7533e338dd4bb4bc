package win.ixuni.quarry.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;
import win.ixuni.quarry.core.config.QuarryProperties;

/**
 * Quarry 服务器启动类
 * <p>
 * Driver factories live in the driver modules under {@code win.ixuni.quarry.driver}, hence the wider scan.
 */
@SpringBootApplication(scanBasePackages = "win.ixuni.quarry")
@EnableConfigurationProperties(QuarryProperties.class)
@EnableScheduling
public class QuarryServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuarryServerApplication.class, args);
    }
}
