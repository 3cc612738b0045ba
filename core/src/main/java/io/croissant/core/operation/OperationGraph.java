package io.croissant.core.operation;

import io.croissant.core.error.OperationGraphException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Directed acyclic graph of operations. Iteration follows insertion order, so execution order is
 * deterministic for a given document.
 */
public final class OperationGraph {

    private final Map<Operation, Set<Operation>> successors = new LinkedHashMap<>();
    private final Map<Operation, Set<Operation>> predecessors = new LinkedHashMap<>();
    private final Map<String, Operation> outputs = new LinkedHashMap<>();

    /** Adds an operation; adding it twice is a no-op. */
    public Operation add(Operation operation) {
        successors.putIfAbsent(operation, new LinkedHashSet<>());
        predecessors.putIfAbsent(operation, new LinkedHashSet<>());
        return operation;
    }

    /** Feeds the output of {@code from} into {@code to}, after the inputs already connected to it. */
    public void connect(Operation from, Operation to) {
        add(from);
        add(to);
        successors.get(from).add(to);
        predecessors.get(to).add(from);
    }

    public Set<Operation> operations() {
        return Collections.unmodifiableSet(successors.keySet());
    }

    public int size() {
        return successors.size();
    }

    public List<Operation> predecessors(Operation operation) {
        return List.copyOf(predecessors.getOrDefault(operation, Set.of()));
    }

    public List<Operation> successors(Operation operation) {
        return List.copyOf(successors.getOrDefault(operation, Set.of()));
    }

    /** Marks the operation whose output holds the records of a record set. */
    void setOutput(String recordSetUid, Operation operation) {
        outputs.put(recordSetUid, operation);
    }

    public Optional<Operation> output(String recordSetUid) {
        return Optional.ofNullable(outputs.get(recordSetUid));
    }

    /** {@code operation} and everything it transitively depends on. */
    public Set<Operation> ancestorsOf(Operation operation) {
        Set<Operation> seen = new LinkedHashSet<>();
        Deque<Operation> pending = new ArrayDeque<>();
        pending.add(operation);
        while (!pending.isEmpty()) {
            Operation current = pending.removeFirst();
            if (seen.add(current)) {
                pending.addAll(predecessors.getOrDefault(current, Set.of()));
            }
        }
        return seen;
    }

    /**
     * Orders the operations so that every operation comes after all its predecessors. Ties are
     * broken by insertion order.
     *
     * @throws OperationGraphException if the graph contains a cycle
     */
    public List<Operation> topologicalOrder() {
        Map<Operation, Integer> inDegree = new LinkedHashMap<>();
        predecessors.forEach((operation, inputs) -> inDegree.put(operation, inputs.size()));
        List<Operation> order = new ArrayList<>(inDegree.size());
        boolean progressed = true;
        while (progressed) {
            progressed = false;
            for (Map.Entry<Operation, Integer> entry : inDegree.entrySet()) {
                if (entry.getValue() != 0) {
                    continue;
                }
                Operation ready = entry.getKey();
                entry.setValue(-1);
                order.add(ready);
                for (Operation next : successors.get(ready)) {
                    inDegree.computeIfPresent(next, (k, degree) -> degree - 1);
                }
                progressed = true;
                break;
            }
        }
        if (order.size() != inDegree.size()) {
            List<String> stuck = inDegree.entrySet().stream()
                    .filter(entry -> entry.getValue() > 0)
                    .map(entry -> entry.getKey().name())
                    .toList();
            throw new OperationGraphException(
                    "The operation graph contains a cycle through " + stuck + ".", null, null);
        }
        return order;
    }

    /** One line per operation with its inputs, in topological order. */
    public String describe() {
        StringBuilder text = new StringBuilder();
        for (Operation operation : topologicalOrder()) {
            text.append(operation.name());
            List<Operation> inputs = predecessors(operation);
            if (!inputs.isEmpty()) {
                text.append(" <- ")
                        .append(String.join(", ", inputs.stream().map(Operation::name).toList()));
            }
            text.append('\n');
        }
        return text.toString();
    }
}
