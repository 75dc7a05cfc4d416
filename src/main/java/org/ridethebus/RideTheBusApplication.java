package org.ridethebus;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RideTheBusApplication {
    public static void main(String[] args) {
        SpringApplication.run(RideTheBusApplication.class, args);
    }
}
