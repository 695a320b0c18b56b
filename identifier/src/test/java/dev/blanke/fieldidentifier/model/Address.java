package dev.blanke.fieldidentifier.model;

public final class Address {

    public String city;

    public Address(final String city) {
        this.city = city;
    }

    public String getCity() {
        return city;
    }
}
