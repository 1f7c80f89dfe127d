package com.roundtrip.server.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Collections;

/**
 * SpringDoc OpenAPI 文档配置：/v3/api-docs 与 /swagger-ui.html。
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI roundtripOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("RoundTrip 行程排期接口文档")
                        .description("环球多站行程的日期排期、锁定与冲突检测接口")
                        .version("v1"))
                .servers(Collections.singletonList(
                        new Server().url("/").description("默认服务端")
                ));
    }
}
