package dev.invox.invoiceparser;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot application entry point for the invoice processing service.
 */
@SpringBootApplication
public class InvoiceParserApplication {

    public static void main(String[] args) {
        SpringApplication.run(InvoiceParserApplication.class, args);
    }
}
