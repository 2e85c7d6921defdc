package ch.minigolf.minigolfbackend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the OpenAPI / Swagger documentation of the room API.
 */
@Configuration
public class OpenApiConfig {

    /**
     * Creates the OpenAPI definition used by Swagger UI.
     *
     * @return configured {@link OpenAPI} instance with API metadata
     */
    @Bean
    public OpenAPI minigolfOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Mini-Golf Room API")
                        .description("Multiplayer rooms, turns and scores for the passkey mini-golf demo")
                        .version("v1.0.0"));
    }
}
