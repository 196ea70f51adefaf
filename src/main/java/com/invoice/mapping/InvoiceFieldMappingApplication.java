package com.invoice.mapping;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

@SpringBootApplication
@EnableCaching
public class InvoiceFieldMappingApplication {

    public static void main(String[] args) {
        SpringApplication.run(InvoiceFieldMappingApplication.class, args);
    }
}
