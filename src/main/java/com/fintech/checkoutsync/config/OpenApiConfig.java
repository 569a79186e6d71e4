package com.fintech.checkoutsync.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI checkoutReconciliationOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Checkout Reconciliation Service API")
                        .description("Reconciles gateway checkouts with the payment gateway and recovers orders whose payment failed locally but settled on the gateway.")
                        .version("1.0.0"));
    }
}
