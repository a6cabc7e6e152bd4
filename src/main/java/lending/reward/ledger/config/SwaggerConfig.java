package lending.reward.ledger.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation for the ledger endpoints
 */
@Configuration
public class SwaggerConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Reward Points Ledger API")
                        .description("Loan-event accrual, penalty debt, tier levels and points consumption. " +
                                     "Every mutating call carries the caller identity in the X-Caller-Id header.")
                        .version("1.0.0"))
                .servers(List.of(new Server()
                        .url("http://localhost:" + serverPort)
                        .description("Local Development Server")));
    }
}
