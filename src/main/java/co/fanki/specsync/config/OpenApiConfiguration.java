package co.fanki.specsync.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the Spec Sync Server.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    @Value("${server.port:8080}")
    private int serverPort;

    /**
     * Configures the OpenAPI specification.
     *
     * @return the OpenAPI configuration
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Spec Sync Server API")
                        .description("""
                                Spec Sync Server - mirrors the feature documents of a project
                                (`specs/NNN-name/*.md`) into a relational store.

                                ## Documents
                                - `spec.md` - feature metadata, user stories and requirements
                                - `tasks.md` - checkbox tasks grouped by phase
                                - `data-model.md` - entities, attributes and relationships
                                - `plan.md` - summary, tech stack, phases, dependencies and risks
                                - `research.md` - research decisions

                                ## Sync
                                - Full sync on registration, on demand and at startup
                                - Incremental sync of each changed document while a project is watched
                                """)
                        .version("0.0.1")
                        .contact(new Contact()
                                .name("Fanki")
                                .email("emiliano@fanki.co")
                                .url("https://fanki.co"))
                        .license(new License()
                                .name("Proprietary")
                                .url("https://fanki.co")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}
