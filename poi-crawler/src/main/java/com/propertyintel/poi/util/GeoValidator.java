package com.propertyintel.poi.util;

public final class GeoValidator {

    private GeoValidator() {
    }

    public static boolean isValidLatitude(double lat) {
        return lat >= -90 && lat <= 90;
    }

    public static boolean isValidLongitude(double lng) {
        return lng >= -180 && lng <= 180;
    }

    public static boolean isValidRadius(int radiusM, int maxRadiusM) {
        return radiusM >= 1 && radiusM <= maxRadiusM;
    }
}
