package com.bbthechange.carshare.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "carshare")
public class CarShareProperties {

    private final Auth auth = new Auth();
    private final Rental rental = new Rental();
    private final Fleet fleet = new Fleet();

    public Auth getAuth() {
        return auth;
    }

    public Rental getRental() {
        return rental;
    }

    public Fleet getFleet() {
        return fleet;
    }

    public static class Auth {

        @DurationUnit(ChronoUnit.HOURS)
        private Duration riderSessionTtl = Duration.ofHours(12);

        @DurationUnit(ChronoUnit.DAYS)
        private Duration carSessionTtl = Duration.ofDays(30);

        /**
         * Shared key every telematics client presents on /car/register and CAR_CONNECT.
         */
        private String carApiKey = "car-lab-key";

        public Duration getRiderSessionTtl() {
            return riderSessionTtl;
        }

        public void setRiderSessionTtl(Duration riderSessionTtl) {
            this.riderSessionTtl = riderSessionTtl;
        }

        public Duration getCarSessionTtl() {
            return carSessionTtl;
        }

        public void setCarSessionTtl(Duration carSessionTtl) {
            this.carSessionTtl = carSessionTtl;
        }

        public String getCarApiKey() {
            return carApiKey;
        }

        public void setCarApiKey(String carApiKey) {
            this.carApiKey = carApiKey;
        }
    }

    public static class Rental {

        private double maxStartDistanceKm = 2.0;

        public double getMaxStartDistanceKm() {
            return maxStartDistanceKm;
        }

        public void setMaxStartDistanceKm(double maxStartDistanceKm) {
            this.maxStartDistanceKm = maxStartDistanceKm;
        }
    }

    public static class Fleet {

        private boolean seedEnabled = true;
        private List<SeedCar> cars = new ArrayList<>();

        public boolean isSeedEnabled() {
            return seedEnabled;
        }

        public void setSeedEnabled(boolean seedEnabled) {
            this.seedEnabled = seedEnabled;
        }

        public List<SeedCar> getCars() {
            return cars;
        }

        public void setCars(List<SeedCar> cars) {
            this.cars = cars;
        }
    }

    public static class SeedCar {

        private String vin;
        private String model;
        private double lat;
        private double lon;

        public String getVin() {
            return vin;
        }

        public void setVin(String vin) {
            this.vin = vin;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public double getLat() {
            return lat;
        }

        public void setLat(double lat) {
            this.lat = lat;
        }

        public double getLon() {
            return lon;
        }

        public void setLon(double lon) {
            this.lon = lon;
        }
    }
}
