package dev.blanke.fieldidentifier;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import dev.blanke.fieldidentifier.lambda.Accessor;
import dev.blanke.fieldidentifier.model.Address;
import dev.blanke.fieldidentifier.model.Coordinates;
import dev.blanke.fieldidentifier.model.Node;
import dev.blanke.fieldidentifier.model.Person;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests {@link FieldIdentifier#create(Accessor)} with lambdas and method references compiled by javac.
 */
final class FieldIdentifierLambdaTest {

    private static void assertIdentifies(final Object owner, final String fieldName, final FieldIdentifier actual) {
        assertSame(owner, actual.getOwner());
        assertEquals(fieldName, actual.getFieldName());
    }

    @Nested
    final class CapturedLocals {

        @Test
        void testCreateField() {
            final var person = new Person("Peter", 42);

            assertIdentifies(person, "name", FieldIdentifier.create(() -> person.name));
        }

        @Test
        void testCreateGetter() {
            final var person = new Person("Peter", 42);

            assertIdentifies(person, "name", FieldIdentifier.create(() -> person.getName()));
            assertIdentifies(person, "adult", FieldIdentifier.create(() -> person.isAdult()));
        }

        @Test
        void testCreateMethodReference() {
            final var person = new Person("Peter", 42);

            assertIdentifies(person, "name", FieldIdentifier.create(person::getName));
        }

        @Test
        void testCreateRecordComponent() {
            final var coordinates = new Coordinates(52.5, 13.4);

            assertIdentifies(coordinates, "latitude", FieldIdentifier.create(() -> coordinates.latitude()));
            assertIdentifies(coordinates, "altitude", FieldIdentifier.create(coordinates::getAltitude));
        }

        @Test
        void testCreatePrimitiveField() {
            final var person = new Person("Peter", 42);

            final var boxed = FieldIdentifier.create(() -> person.age);
            assertIdentifies(person, "age", boxed);
            assertEquals(boxed, FieldIdentifier.create(() -> (Object) person.age));
        }

        @Test
        void testCreateNestedField() {
            final var person = new Person("Peter", 42);

            assertIdentifies(person.address, "city", FieldIdentifier.create(() -> person.address.city));
        }

        @Test
        void testCreateNestedGetterEvaluatedOnce() {
            final var person = new Person("Peter", 42);

            final var identifier = FieldIdentifier.create(() -> person.getAddress().getCity());
            assertEquals(1, person.addressReads());
            assertSame(person.address, identifier.getOwner());
            assertEquals("city", identifier.getFieldName());
        }

        @Test
        void testCreateDeepChain() {
            final var root = Node.chain("a", "b", "c", "d", "e");

            final var identifier = FieldIdentifier.create(() -> root.next.next.next.next.label);
            assertIdentifies(root.next.next.next.next, "label", identifier);
        }

        @Test
        void testCreateChainThroughTypeVariable() {
            final var person = new Person("Peter", 42);

            assertIdentifies(person.boxedAddress.value, "city",
                FieldIdentifier.create(() -> person.boxedAddress.value.city));
        }

        @Test
        void testCreateChainThroughStaticField() {
            assertIdentifies(Person.ANONYMOUS, "name", FieldIdentifier.create(() -> Person.ANONYMOUS.name));
        }

        @Test
        void testCreateReevaluatesOwnerOnEachCall() {
            final var person = new Person("Peter", 42);
            final Accessor<String> city = () -> person.address.city;

            final var before = FieldIdentifier.create(city);
            person.address = new Address("Cologne");
            final var after = FieldIdentifier.create(city);

            assertNotEquals(before, after);
            assertSame(person.address, after.getOwner());
        }
    }

    @Nested
    final class CapturedThis {

        private final Person fixture = new Person("Paula", 23);

        @Test
        void testCreateFieldOfCapturedThis() {
            assertIdentifies(fixture, "name", FieldIdentifier.create(() -> fixture.name));
        }

        @Test
        void testCreateFieldOfThis() {
            assertIdentifies(this, "fixture", FieldIdentifier.create(() -> this.fixture));
        }
    }

    @Nested
    final class Unsupported {

        private final Person person = new Person("Peter", 42);

        @Test
        void testCreateMethodCall() {
            assertThrows(UnsupportedExpressionShapeException.class,
                () -> FieldIdentifier.create(() -> person.describe()));
        }

        @Test
        void testCreateMethodReferenceToNonGetter() {
            assertThrows(UnsupportedExpressionShapeException.class, () -> FieldIdentifier.create(person::describe));
        }

        @Test
        void testCreateLiteral() {
            assertThrows(UnsupportedExpressionShapeException.class, () -> FieldIdentifier.create(() -> "literal"));
        }

        @Test
        void testCreateArithmetic() {
            assertThrows(UnsupportedExpressionShapeException.class,
                () -> FieldIdentifier.create(() -> person.age + 1));
        }

        @Test
        void testCreateCallOnField() {
            assertThrows(UnsupportedExpressionShapeException.class,
                () -> FieldIdentifier.create(() -> person.name.length()));
        }

        @Test
        void testCreateArrayElement() {
            assertThrows(UnsupportedExpressionShapeException.class,
                () -> FieldIdentifier.create(() -> person.nicknames[0]));
        }

        @Test
        void testCreateArrayElementOwner() {
            assertThrows(UnsupportedOwnerExpressionShapeException.class,
                () -> FieldIdentifier.create(() -> person.previousAddresses[0].city));
        }

        @Test
        void testCreateStaticField() {
            assertThrows(UnsupportedOwnerExpressionShapeException.class,
                () -> FieldIdentifier.create(() -> Person.population));
        }

        @Test
        void testCreateAnonymousClass() {
            final var accessor = new Accessor<String>() {
                @Override
                public String get() {
                    return person.name;
                }
            };
            assertThrows(UnsupportedExpressionShapeException.class, () -> FieldIdentifier.create(accessor));
        }

        @Test
        void testCreateNullIntermediateOwner() {
            person.address = null;

            assertThrows(IllegalArgumentException.class, () -> FieldIdentifier.create(() -> person.address.city));
        }

        @Test
        void testCreateNullDeeperInOwnerChain() {
            final var root = Node.chain("a", "b");

            final var exception = assertThrows(IllegalArgumentException.class,
                () -> FieldIdentifier.create(() -> root.next.next.next.label));
            assertInstanceOf(NullPointerException.class, exception.getCause());
        }
    }
}
