package org.erpsuite.currency.config;

import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.info.License;
import io.swagger.v3.oas.annotations.servers.Server;

@Configuration
@OpenAPIDefinition(
    info =
        @Info(
            title = "Currency Service",
            version = "1.0",
            description =
                "Tenant currency registry, exchange rates and amount conversion. Every endpoint"
                    + " except the predefined catalog requires the X-Tenant-Id header.",
            license = @License(name = "MIT", url = "https://opensource.org/licenses/MIT")),
    servers = {
      @Server(url = "http://localhost:8080/api", description = "Local environment (via gateway)"),
      @Server(
          url = "http://localhost:8084/currency-service",
          description = "Local environment (direct)")
    })
public class OpenApiConfig {}
