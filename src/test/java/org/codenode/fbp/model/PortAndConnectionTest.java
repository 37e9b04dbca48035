package org.codenode.fbp.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class PortAndConnectionTest {

    private final Port intOut = Port.output("a", "out", Integer.class);
    private final Port numberIn = Port.input("b", "in", Number.class);
    private final Port stringIn = Port.input("b", "text", String.class);
    private final Port anyIn = Port.input("b", "any", Object.class);

    @Test
    void subtypeFeedsSupertype() {
        assertTrue(intOut.isCompatibleWith(numberIn));
        assertTrue(numberIn.isCompatibleWith(intOut));
        assertFalse(Port.output("a", "n", Number.class).isCompatibleWith(Port.input("b", "i", Integer.class)));
    }

    @Test
    void objectPortsAcceptAnything() {
        assertTrue(intOut.isCompatibleWith(anyIn));
        assertTrue(Port.output("a", "raw", Object.class).isCompatibleWith(stringIn));
    }

    @Test
    void sameDirectionIsNeverCompatible() {
        assertFalse(intOut.isCompatibleWith(Port.output("b", "out", Integer.class)));
        assertFalse(numberIn.isCompatibleWith(anyIn));
    }

    @Test
    void validConnectionPassesPortChecks() {
        Connection connection = Connection.between("c1", intOut, numberIn, 4);

        assertTrue(connection.validateWithPorts(intOut, numberIn).success());
        assertThat(connection.findTypeTag()).isEmpty();
        assertThat(connection.withTypeTag("ip_int").findTypeTag()).contains("ip_int");
    }

    @Test
    void incompatibleTypesAreReported() {
        Connection connection = Connection.between("c1", intOut, stringIn, 1);

        ValidationResult result = connection.validateWithPorts(intOut, stringIn);

        assertFalse(result.success());
        assertThat(result.errorMessage()).contains("Incompatible port types", "Integer", "String");
    }

    @Test
    void reversedDirectionsAreReported() {
        Connection connection = Connection.between("c1", numberIn, intOut, 1);

        ValidationResult result = connection.validateWithPorts(numberIn, intOut);

        assertThat(result.errors())
            .anyMatch(e -> e.startsWith("Source port 'in' must be OUT"))
            .anyMatch(e -> e.startsWith("Target port 'out' must be IN"));
    }

    @Test
    void selfLoopOnSamePortIsRejected() {
        Connection loop = new Connection("c1", "a", "a:p", "a", "a:p", 1, null);

        assertThat(loop.validate().errors()).contains("Cannot create self-loop connection on same port");
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 0, 1, 1000})
    void acceptedCapacities(int capacity) {
        assertTrue(Connection.between("c", intOut, numberIn, capacity).validate().success());
    }

    @Test
    void capacityBelowUnlimitedIsRejected() {
        ValidationResult result = Connection.between("c", intOut, numberIn, -2).validate();

        assertThat(result.errorMessage()).contains("Channel capacity must be -1 (unlimited), 0 (rendezvous) or positive");
    }
}
