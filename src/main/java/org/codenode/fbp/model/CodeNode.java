package org.codenode.fbp.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A leaf processing unit with typed ports.
 *
 * @param configuration free-form key/value settings of the node's processing logic.
 */
public record CodeNode(String id,
                       String name,
                       String description,
                       List<Port> inputPorts,
                       List<Port> outputPorts,
                       ControlConfig controlConfig,
                       ExecutionState executionState,
                       Map<String, String> configuration) implements Node {

    public CodeNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        inputPorts = List.copyOf(inputPorts);
        outputPorts = List.copyOf(outputPorts);
        controlConfig = controlConfig == null ? ControlConfig.defaults() : controlConfig;
        executionState = executionState == null ? ExecutionState.IDLE : executionState;
        configuration = Map.copyOf(configuration);
    }

    public static Builder builder(String id, String name) {
        return new Builder(id, name);
    }

    /**
     * Generates a node id of the form {@code prefix_<uuid>}.
     */
    public static String generateId(String prefix) {
        return prefix + "_" + UUID.randomUUID();
    }

    @Override
    public CodeNode withExecutionState(ExecutionState newState, boolean propagate) {
        return withExecutionState(newState);
    }

    public CodeNode withExecutionState(ExecutionState newState) {
        return new CodeNode(id, name, description, inputPorts, outputPorts, controlConfig, newState, configuration);
    }

    @Override
    public CodeNode withControlConfig(ControlConfig newConfig, boolean propagate) {
        return withControlConfig(newConfig);
    }

    public CodeNode withControlConfig(ControlConfig newConfig) {
        return new CodeNode(id, name, description, inputPorts, outputPorts, newConfig, executionState, configuration);
    }

    public CodeNode withConfiguration(String key, String value) {
        Map<String, String> updated = new LinkedHashMap<>(configuration);
        updated.put(key, value);
        return new CodeNode(id, name, description, inputPorts, outputPorts, controlConfig, executionState, updated);
    }

    public Optional<String> getConfig(String key) {
        return Optional.ofNullable(configuration.get(key));
    }

    @Override
    public ValidationResult validate() {
        List<String> errors = Node.validateCommon(this);
        if (inputPorts.isEmpty() && outputPorts.isEmpty()) {
            errors.add("CodeNode '" + name + "' must have at least one port (input or output)");
        }
        return ValidationResult.of(errors);
    }

    public static final class Builder {
        private final String id;
        private final String name;
        private String description;
        private final List<Port> inputPorts = new ArrayList<>();
        private final List<Port> outputPorts = new ArrayList<>();
        private ControlConfig controlConfig = ControlConfig.defaults();
        private ExecutionState executionState = ExecutionState.IDLE;
        private final Map<String, String> configuration = new LinkedHashMap<>();

        private Builder(String id, String name) {
            this.id = id;
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder input(String portName, Class<?> dataType) {
            inputPorts.add(Port.input(id, portName, dataType));
            return this;
        }

        public Builder output(String portName, Class<?> dataType) {
            outputPorts.add(Port.output(id, portName, dataType));
            return this;
        }

        public Builder controlConfig(ControlConfig controlConfig) {
            this.controlConfig = controlConfig;
            return this;
        }

        public Builder executionState(ExecutionState executionState) {
            this.executionState = executionState;
            return this;
        }

        public Builder configuration(String key, String value) {
            configuration.put(key, value);
            return this;
        }

        public CodeNode build() {
            return new CodeNode(id, name, description, inputPorts, outputPorts, controlConfig, executionState, configuration);
        }
    }
}
