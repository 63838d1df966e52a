package org.nowstart.tidepy.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SwaggerConfig {

    private static final String FALLBACK_VERSION = "dev";

    @Bean
    public OpenAPI customOpenAPI(ObjectProvider<BuildProperties> buildProperties) {
        BuildProperties build = buildProperties.getIfAvailable();
        return new OpenAPI()
                .info(new Info()
                        .title("tidepy API")
                        .description("Read-only dashboard for the tidepy short stat-arb engine.")
                        .version(build == null ? FALLBACK_VERSION : build.getVersion()));
    }
}
