package dev.blanke.fieldidentifier;

import java.util.HashMap;
import java.util.HashSet;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import dev.blanke.fieldidentifier.model.Coordinates;
import dev.blanke.fieldidentifier.model.Person;

import static org.junit.jupiter.api.Assertions.*;

final class FieldIdentifierTest {

    private Person person;

    @BeforeEach
    void setUp() {
        person = new Person("Peter", 42);
    }

    @Nested
    final class Create {

        @Test
        void testCreateRetainsOwnerAndFieldName() {
            final var identifier = FieldIdentifier.create(person, "name");

            assertSame(person, identifier.getOwner());
            assertEquals("name", identifier.getFieldName());
        }

        @Test
        void testCreateAcceptsArbitraryFieldNames() {
            // The name does not have to denote an actual member of the owner.
            final var identifier = FieldIdentifier.create(person, "not a member");

            assertEquals("not a member", identifier.getFieldName());
        }

        @Test
        void testCreateNullOwner() {
            assertThrows(IllegalArgumentException.class, () -> FieldIdentifier.create((Object) null, "name"));
        }

        @Test
        void testCreateNullFieldName() {
            assertThrows(IllegalArgumentException.class, () -> FieldIdentifier.create(person, null));
        }

        @Test
        void testCreateEmptyFieldName() {
            assertThrows(IllegalArgumentException.class, () -> FieldIdentifier.create(person, ""));
        }

        @Test
        void testCreatePrimitiveWrapperOwner() {
            assertThrows(IllegalArgumentException.class, () -> FieldIdentifier.create(Integer.valueOf(4711), "x"));
            assertThrows(IllegalArgumentException.class, () -> FieldIdentifier.create(Boolean.TRUE, "x"));
        }
    }

    @Nested
    final class Equality {

        @Test
        void testEqualsSameOwnerAndFieldName() {
            final var first  = FieldIdentifier.create(person, "name");
            final var second = FieldIdentifier.create(person, "name");

            assertEquals(first, second);
            assertEquals(second, first);
            assertEquals(first.hashCode(), second.hashCode());
        }

        @Test
        void testEqualsAcrossCreationPaths() {
            final var direct = FieldIdentifier.create(person, "name");

            assertEquals(direct, FieldIdentifier.create(() -> person.name));
            assertEquals(direct, FieldIdentifier.create(() -> person.getName()));
            assertEquals(direct, FieldIdentifier.create(person::getName));
        }

        @Test
        void testNotEqualsForDistinctButEqualOwners() {
            final var first  = new Coordinates(52.5, 13.4);
            final var second = new Coordinates(52.5, 13.4);
            assertEquals(first, second);

            assertNotEquals(FieldIdentifier.create(first, "latitude"), FieldIdentifier.create(second, "latitude"));
        }

        @Test
        void testNotEqualsForFieldNamesDifferingInCase() {
            assertNotEquals(FieldIdentifier.create(person, "name"), FieldIdentifier.create(person, "Name"));
        }

        @Test
        void testNotEqualsForOtherTypes() {
            final var identifier = FieldIdentifier.create(person, "name");

            assertFalse(identifier.equals(null));
            assertFalse(identifier.equals("name"));
        }

        @Test
        void testUsableAsHashKey() {
            final var messages = new HashMap<FieldIdentifier, String>();
            messages.put(FieldIdentifier.create(person, "name"), "Name is required.");

            assertEquals("Name is required.", messages.get(FieldIdentifier.create(() -> person.name)));
            assertNull(messages.get(FieldIdentifier.create(new Person("Peter", 42), "name")));

            final var identifiers = new HashSet<FieldIdentifier>();
            identifiers.add(FieldIdentifier.create(person, "age"));
            identifiers.add(FieldIdentifier.create(() -> person.age));
            assertEquals(1, identifiers.size());
        }

        @Test
        void testEqualityIgnoresOwnerMutation() {
            final var before = FieldIdentifier.create(person, "name");
            final var hash   = before.hashCode();
            person.name = "Paul";

            assertEquals(before, FieldIdentifier.create(person, "name"));
            assertEquals(hash, FieldIdentifier.create(person, "name").hashCode());
        }
    }

    @Test
    void testToStringDoesNotInvokeOwnerToString() {
        final var owner = new Object() {
            @Override
            public String toString() {
                throw new AssertionError("Owner's toString() must not be invoked.");
            }
        };
        final var string = FieldIdentifier.create(owner, "field").toString();

        assertTrue(string.contains("fieldName=field"));
    }
}
