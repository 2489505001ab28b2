package by.greenmobile.retainingwall;

import by.greenmobile.retainingwall.config.WallDesignProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@EnableConfigurationProperties(value = {WallDesignProperties.class})
@SpringBootApplication
public class RetainingWallApplication {

    public static void main(String[] args) {
        SpringApplication.run(RetainingWallApplication.class, args);
    }

}
