/**
 * LeanEditApplication.java
 *
 * Main entry point of the collaborative Lean editor backend.
 * Starts the Spring Boot application that hosts the document room endpoint,
 * the per-session language server bridge and the metadata endpoint.
 */
package club.ppmc.leanedit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LeanEditApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeanEditApplication.class, args);
    }
}
