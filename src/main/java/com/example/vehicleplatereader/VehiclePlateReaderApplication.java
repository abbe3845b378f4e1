package com.example.vehicleplatereader;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import com.example.vehicleplatereader.config.PlateReaderProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@OpenAPIDefinition(
        info = @Info(
                title = "Vehicle License Plate Recognition API",
                version = "1.0.0",
                description = "REST API that locates a license plate in a vehicle photo and extracts its three text segments through a vision model.",
                contact = @Contact(name = "Vehicle Plate Reader")))
@SpringBootApplication
@EnableConfigurationProperties(PlateReaderProperties.class)
public class VehiclePlateReaderApplication {

    public static void main(String[] args) {
        SpringApplication.run(VehiclePlateReaderApplication.class, args);
    }
}
