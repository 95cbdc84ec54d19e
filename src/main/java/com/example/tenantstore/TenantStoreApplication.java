package com.example.tenantstore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TenantStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(TenantStoreApplication.class, args);
    }
}
