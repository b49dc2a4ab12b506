package com.safejob.matching.dto;

public record GeoPoint(double latitude, double longitude) {

    public boolean isValid() {
        return !Double.isNaN(latitude) && !Double.isNaN(longitude)
                && latitude >= -90.0 && latitude <= 90.0
                && longitude >= -180.0 && longitude <= 180.0;
    }
}
