package com.solo.api;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Конфигурация Swagger/OpenAPI
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Solo Adventure API")
                .version("1.0.0")
                .description("""
                    API одиночного пошагового приключения.

                    ## Возможности:
                    - Выбор кампании и персонажа (новый или из реестра)
                    - Пошаговые действия: исследование и бой
                    - Отложенные решения после повышения уровня
                    - Повествование от локальной модели (Ollama) с заготовленной заменой
                    """)
                .license(new License()
                    .name("MIT")
                    .url("https://opensource.org/licenses/MIT")))
            .servers(List.of(
                new Server()
                    .url("http://localhost:8080")
                    .description("Локальный сервер")
            ));
    }
}
