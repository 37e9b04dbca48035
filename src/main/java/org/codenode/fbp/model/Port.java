package org.codenode.fbp.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A typed entry or exit point of a node.
 *
 * @param id           unique within the owning node.
 * @param name         human-readable name, also used by graph port mappings.
 * @param direction    {@link Direction#IN} for ports that receive, {@link Direction#OUT} for ports that send.
 * @param dataType     type of the values flowing through the port; {@code Object.class} accepts anything.
 * @param required     whether the port must be connected for the graph to be complete.
 * @param owningNodeId id of the node the port belongs to.
 */
public record Port(String id, String name, Direction direction, Class<?> dataType, boolean required, String owningNodeId) {

    public enum Direction {
        IN,
        OUT
    }

    public Port {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(dataType, "dataType");
        Objects.requireNonNull(owningNodeId, "owningNodeId");
    }

    public static Port input(String owningNodeId, String name, Class<?> dataType) {
        return new Port(owningNodeId + ":" + name, name, Direction.IN, dataType, true, owningNodeId);
    }

    public static Port output(String owningNodeId, String name, Class<?> dataType) {
        return new Port(owningNodeId + ":" + name, name, Direction.OUT, dataType, false, owningNodeId);
    }

    public String typeName() {
        return dataType.getSimpleName();
    }

    public boolean isInput() {
        return direction == Direction.IN;
    }

    public boolean isOutput() {
        return direction == Direction.OUT;
    }

    /**
     * Checks whether this port can be connected to {@code other}: one must be OUT, the other IN, and the
     * source type must be assignable to the target type.
     */
    public boolean isCompatibleWith(Port other) {
        if (isOutput() && other.isInput()) {
            return typesCompatible(dataType, other.dataType);
        }
        if (isInput() && other.isOutput()) {
            return typesCompatible(other.dataType, dataType);
        }
        return false;
    }

    static boolean typesCompatible(Class<?> sourceType, Class<?> targetType) {
        return targetType == Object.class
                || sourceType == Object.class
                || targetType.isAssignableFrom(sourceType);
    }

    public ValidationResult validate() {
        List<String> errors = new ArrayList<>();
        if (id.isBlank()) {
            errors.add("Port id cannot be blank");
        }
        if (name.isBlank()) {
            errors.add("Port name cannot be blank");
        }
        if (owningNodeId.isBlank()) {
            errors.add("Port '" + name + "' has a blank owningNodeId");
        }
        return ValidationResult.of(errors);
    }

    public Port withOwner(String newOwningNodeId) {
        return new Port(id, name, direction, dataType, required, newOwningNodeId);
    }
}
