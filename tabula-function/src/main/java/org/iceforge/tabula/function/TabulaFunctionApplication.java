package org.iceforge.tabula.function;

import org.iceforge.tabula.function.config.WarehouseProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(WarehouseProperties.class)
public class TabulaFunctionApplication {
    public static void main(String[] args) {
        SpringApplication.run(TabulaFunctionApplication.class, args);
    }
}
