package org.example.inventory_photos;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class InventoryPhotosApplication {

    public static void main(String[] args) {
        SpringApplication.run(InventoryPhotosApplication.class, args);
    }
}
