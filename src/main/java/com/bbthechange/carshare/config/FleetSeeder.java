package com.bbthechange.carshare.config;

import com.bbthechange.carshare.model.Car;
import com.bbthechange.carshare.model.Location;
import com.bbthechange.carshare.repository.CarRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Loads the configured fleet at startup. Cars that already exist are left untouched.
 */
@Component
public class FleetSeeder implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(FleetSeeder.class);

    private final CarRepository carRepository;
    private final CarShareProperties properties;

    public FleetSeeder(CarRepository carRepository, CarShareProperties properties) {
        this.carRepository = carRepository;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getFleet().isSeedEnabled()) {
            logger.info("Fleet seeding disabled");
            return;
        }

        int seeded = 0;
        for (CarShareProperties.SeedCar seed : properties.getFleet().getCars()) {
            if (seed.getVin() == null || seed.getVin().isBlank()) {
                logger.warn("Skipping seed car without VIN (model {})", seed.getModel());
                continue;
            }
            if (carRepository.findByVin(seed.getVin()).isPresent()) {
                continue;
            }
            carRepository.save(new Car(seed.getVin(), seed.getModel(), new Location(seed.getLat(), seed.getLon())));
            seeded++;
        }
        logger.info("Seeded {} cars ({} in fleet)", seeded, carRepository.count());
    }
}
