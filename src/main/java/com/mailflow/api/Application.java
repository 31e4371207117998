package com.mailflow.api;

import com.fasterxml.jackson.databind.SerializationFeature;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.Banner;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.info.BuildProperties;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.time.Clock;

@SpringBootApplication
@EnableCaching
@ConfigurationPropertiesScan(basePackageClasses = Application.class)
public class Application {

    public static void main(String[] args) {
        new SpringApplicationBuilder(Application.class)
            .bannerMode(Banner.Mode.OFF)
            .run(args);
    }

    @NonNull
    @Bean
    Jackson2ObjectMapperBuilderCustomizer objectMapperBuilderCustomizer() {
        return builder -> builder.featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * The clock that all billing arithmetic reads "now" from, so that period boundaries and
     * proration can be pinned in tests.
     */
    @NonNull
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @NonNull
    @Bean
    OpenAPI openAPI(@NonNull ObjectProvider<BuildProperties> buildProperties) {
        val version = buildProperties.stream()
            .map(BuildProperties::getVersion)
            .findFirst()
            .orElse("dev");

        return new OpenAPI()
            .info(
                new Info()
                    .title("Mailflow Billing API")
                    .version(String.format("v%s", version)));
    }

    @Component
    @Slf4j
    static class ApplicationVersionLogger implements ApplicationRunner {

        @Autowired
        private ObjectProvider<BuildProperties> buildProperties;

        @Override
        public void run(ApplicationArguments args) {
            buildProperties.ifAvailable(p -> log.info("Running {} version: v{}", p.getName(), p.getVersion()));
        }
    }
}
