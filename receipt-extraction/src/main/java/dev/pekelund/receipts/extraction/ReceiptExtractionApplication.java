package dev.pekelund.receipts.extraction;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot application entry point for the receipt extraction service.
 */
@SpringBootApplication
public class ReceiptExtractionApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReceiptExtractionApplication.class, args);
    }
}
