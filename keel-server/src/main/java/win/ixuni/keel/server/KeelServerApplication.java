package win.ixuni.keel.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import win.ixuni.keel.core.config.KeelProperties;

/**
 * S3Keel 服务器启动类
 */
@SpringBootApplication(scanBasePackages = "win.ixuni.keel")
@EnableConfigurationProperties(KeelProperties.class)
public class KeelServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(KeelServerApplication.class, args);
    }
}
