package dev.blanke.fieldidentifier.model;

import java.io.IOException;

/**
 * A mutable model object exposing its state through public fields as well as through getters.
 */
public final class Person {

    public static final Person ANONYMOUS = new Person("anonymous", 0);

    // Deliberately not a compile-time constant, so that reads are not inlined by javac.
    public static int population;

    public String name;

    public int age;

    public Object tag;

    public Address address = new Address("Berlin");

    public Address[] previousAddresses = { new Address("Hamburg") };

    public String[] nicknames = { "Pete" };

    public Box<Address> boxedAddress = new Box<>(new Address("Munich"));

    private int addressReads;

    public Person(final String name, final int age) {
        this.name = name;
        this.age  = age;
    }

    public String getName() {
        return name;
    }

    /**
     * Counts its invocations, see {@link #addressReads()}.
     */
    public Address getAddress() {
        ++addressReads;
        return address;
    }

    public boolean isAdult() {
        return age >= 18;
    }

    public String getFailing() {
        throw new UnsupportedOperationException("failing getter");
    }

    public String getChecked() throws IOException {
        throw new IOException("checked getter");
    }

    public String describe() {
        return name + " (" + age + ')';
    }

    public String greet(final String greeting) {
        return greeting + ", " + name;
    }

    public static int population() {
        return population;
    }

    public int addressReads() {
        return addressReads;
    }
}
