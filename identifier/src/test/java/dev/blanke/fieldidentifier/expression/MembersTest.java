package dev.blanke.fieldidentifier.expression;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import dev.blanke.fieldidentifier.model.Box;
import dev.blanke.fieldidentifier.model.Coordinates;
import dev.blanke.fieldidentifier.model.Person;

import static org.junit.jupiter.api.Assertions.*;

final class MembersTest {

    public static class Flags {

        public Boolean isWrapped() {
            return Boolean.TRUE;
        }

        public void getNothing() {
        }

        public String getURL() {
            return "";
        }

        public String get() {
            return "";
        }
    }

    public static class Base {

        public String label;
    }

    public static final class Subclass extends Base {
    }

    @Test
    void testPropertyNameOfGetters() throws ReflectiveOperationException {
        assertEquals(Optional.of("name"), Members.propertyName(Person.class.getMethod("getName")));
        assertEquals(Optional.of("adult"), Members.propertyName(Person.class.getMethod("isAdult")));
        // Names starting with two capitals are not decapitalized.
        assertEquals(Optional.of("URL"), Members.propertyName(Flags.class.getMethod("getURL")));
    }

    @Test
    void testPropertyNameOfRecordComponents() throws ReflectiveOperationException {
        assertEquals(Optional.of("latitude"), Members.propertyName(Coordinates.class.getMethod("latitude")));
        assertEquals(Optional.of("altitude"), Members.propertyName(Coordinates.class.getMethod("getAltitude")));
    }

    @Test
    void testPropertyNameOfNonGetters() throws ReflectiveOperationException {
        assertEquals(Optional.empty(), Members.propertyName(Person.class.getMethod("describe")));
        assertEquals(Optional.empty(), Members.propertyName(Person.class.getMethod("greet", String.class)));
        assertEquals(Optional.empty(), Members.propertyName(Person.class.getMethod("population")));
        assertEquals(Optional.empty(), Members.propertyName(Person.class.getMethod("getClass")));
        assertEquals(Optional.empty(), Members.propertyName(Flags.class.getMethod("isWrapped")));
        assertEquals(Optional.empty(), Members.propertyName(Flags.class.getMethod("getNothing")));
        assertEquals(Optional.empty(), Members.propertyName(Flags.class.getMethod("get")));
    }

    @Test
    void testOf() throws ReflectiveOperationException {
        assertInstanceOf(PropertyMember.class, Members.of(Person.class.getMethod("getName")));
        assertInstanceOf(MethodMember.class, Members.of(Person.class.getMethod("describe")));
    }

    @Test
    void testFindFieldInSuperclass() {
        final var label = Members.findField(Subclass.class, "label");

        assertEquals(Base.class, label.getDeclaringClass());
        assertThrows(IllegalArgumentException.class, () -> Members.findField(Subclass.class, "missing"));
    }

    @Test
    void testFindGetter() {
        assertEquals("getName", Members.findGetter(Person.class, "name").getName());
        assertEquals("isAdult", Members.findGetter(Person.class, "adult").getName());
        assertEquals("latitude", Members.findGetter(Coordinates.class, "latitude").getName());
        assertThrows(IllegalArgumentException.class, () -> Members.findGetter(Person.class, "class"));
        assertThrows(IllegalArgumentException.class, () -> Members.findGetter(Person.class, ""));
    }

    @Test
    void testTypeVariableType() throws ReflectiveOperationException {
        assertTrue(new FieldMember(Box.class.getField("value")).hasTypeVariableType());
        assertFalse(new FieldMember(Person.class.getField("boxedAddress")).hasTypeVariableType());
    }
}
