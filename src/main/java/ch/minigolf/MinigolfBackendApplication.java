package ch.minigolf;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the mini-golf room backend.
 *
 * <p>Enables:
 * <ul>
 *   <li>Spring Boot auto-configuration</li>
 *   <li>Component scanning for the entire application</li>
 *   <li>Scheduled task execution ({@code @EnableScheduling}) for the inactive room sweep</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
public class MinigolfBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(MinigolfBackendApplication.class, args);
    }

}
