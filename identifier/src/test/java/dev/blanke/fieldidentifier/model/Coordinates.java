package dev.blanke.fieldidentifier.model;

public record Coordinates(double latitude, double longitude) {

    public double getAltitude() {
        return 0.0;
    }
}
