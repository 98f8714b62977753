package com.quarry.formula.functions;

/** A latitude/longitude pair in decimal degrees. */
public final class Coordinates {
    public final double latitude;
    public final double longitude;

    public Coordinates(double latitude, double longitude) {
        if (latitude < -90 || latitude > 90) throw new IllegalArgumentException("latitude out of range: " + latitude);
        if (longitude < -180 || longitude > 180) throw new IllegalArgumentException("longitude out of range: " + longitude);
        this.latitude = latitude;
        this.longitude = longitude;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Coordinates)) return false;
        Coordinates c = (Coordinates) o;
        return Double.compare(latitude, c.latitude) == 0 && Double.compare(longitude, c.longitude) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(latitude) + Double.hashCode(longitude);
    }

    @Override
    public String toString() {
        return "(" + latitude + ", " + longitude + ")";
    }
}
