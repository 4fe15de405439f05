/**
 * WebConfig.java
 *
 * Global Spring Web MVC configuration.
 * Opens CORS so that an editor page served from another origin can query the
 * metadata and status endpoints.
 */
package club.ppmc.leanedit.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    /**
     * Global CORS mapping.
     *
     * <p>{@code allowedOriginPatterns("*")} reflects the request origin, which is
     * allowed together with credentials where a plain {@code "*"} is not.
     *
     * @param registry CORS registry
     */
    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOriginPatterns("*")
                .allowedMethods("GET", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(true);
    }
}
