package org.codenode.fbp.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A point-to-point edge from an OUT port of one node to an IN port of another. Fan-out and fan-in are
 * expressed with several connections.
 *
 * @param channelCapacity {@link #RENDEZVOUS} for an unbuffered hand-off, a positive buffer size, or
 *                        {@link #UNLIMITED}.
 * @param typeTag         optional label of the information packet type carried, may be {@code null}.
 */
public record Connection(String id,
                         String sourceNodeId,
                         String sourcePortId,
                         String targetNodeId,
                         String targetPortId,
                         int channelCapacity,
                         String typeTag) {

    public static final int RENDEZVOUS = 0;
    public static final int UNLIMITED = -1;

    public Connection {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sourceNodeId, "sourceNodeId");
        Objects.requireNonNull(sourcePortId, "sourcePortId");
        Objects.requireNonNull(targetNodeId, "targetNodeId");
        Objects.requireNonNull(targetPortId, "targetPortId");
    }

    public static Connection between(String id, Port source, Port target, int channelCapacity) {
        return new Connection(id, source.owningNodeId(), source.id(), target.owningNodeId(), target.id(), channelCapacity, null);
    }

    public Optional<String> findTypeTag() {
        return Optional.ofNullable(typeTag);
    }

    public Connection withChannelCapacity(int capacity) {
        return new Connection(id, sourceNodeId, sourcePortId, targetNodeId, targetPortId, capacity, typeTag);
    }

    public Connection withTypeTag(String tag) {
        return new Connection(id, sourceNodeId, sourcePortId, targetNodeId, targetPortId, channelCapacity, tag);
    }

    public boolean touches(String nodeId) {
        return sourceNodeId.equals(nodeId) || targetNodeId.equals(nodeId);
    }

    /**
     * Checks the connection on its own, without looking up the referenced ports.
     */
    public ValidationResult validate() {
        List<String> errors = new ArrayList<>();
        if (id.isBlank()) {
            errors.add("Connection ID cannot be blank");
        }
        if (sourceNodeId.isBlank() || sourcePortId.isBlank()) {
            errors.add("Connection '" + id + "' has a blank source");
        }
        if (targetNodeId.isBlank() || targetPortId.isBlank()) {
            errors.add("Connection '" + id + "' has a blank target");
        }
        if (channelCapacity < UNLIMITED) {
            errors.add("Channel capacity must be -1 (unlimited), 0 (rendezvous) or positive, got " + channelCapacity);
        }
        if (sourceNodeId.equals(targetNodeId) && sourcePortId.equals(targetPortId)) {
            errors.add("Cannot create self-loop connection on same port");
        }
        return ValidationResult.of(errors);
    }

    /**
     * Checks the connection against the ports it claims to join.
     */
    public ValidationResult validateWithPorts(Port sourcePort, Port targetPort) {
        List<String> errors = new ArrayList<>(validate().errors());
        if (!sourcePort.id().equals(sourcePortId) || !sourcePort.owningNodeId().equals(sourceNodeId)) {
            errors.add("Connection '" + id + "' source port mismatch: expected '" + sourcePortId + "', got '" + sourcePort.id() + "'");
        }
        if (!targetPort.id().equals(targetPortId) || !targetPort.owningNodeId().equals(targetNodeId)) {
            errors.add("Connection '" + id + "' target port mismatch: expected '" + targetPortId + "', got '" + targetPort.id() + "'");
        }
        if (!sourcePort.isOutput()) {
            errors.add("Source port '" + sourcePort.name() + "' must be OUT, got " + sourcePort.direction());
        }
        if (!targetPort.isInput()) {
            errors.add("Target port '" + targetPort.name() + "' must be IN, got " + targetPort.direction());
        }
        if (sourcePort.isOutput() && targetPort.isInput() && !sourcePort.isCompatibleWith(targetPort)) {
            errors.add(String.format("Incompatible port types: '%s' (%s) cannot feed '%s' (%s)",
                    sourcePort.name(), sourcePort.typeName(), targetPort.name(), targetPort.typeName()));
        }
        return ValidationResult.of(errors);
    }
}
