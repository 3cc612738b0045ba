package io.croissant.core.operation;

import io.croissant.core.error.CroissantException;
import io.croissant.core.error.OperationGraphException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the part of an operation graph a target operation depends on, in topological order, and
 * returns the target's output. Each operation runs once per execution; its output is handed to
 * all its successors.
 */
public final class OperationExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(OperationExecutor.class);

    /**
     * @throws io.croissant.core.error.CroissantExecutionException if any operation fails; the
     *         failure aborts the execution
     */
    public Object execute(OperationGraph graph, Operation target) {
        Set<Operation> needed = graph.ancestorsOf(target);
        Map<Operation, Object> outputs = new HashMap<>();
        long start = System.nanoTime();
        int executed = 0;
        for (Operation operation : graph.topologicalOrder()) {
            if (!needed.contains(operation)) {
                continue;
            }
            List<Object> inputs = new ArrayList<>();
            for (Operation predecessor : graph.predecessors(operation)) {
                inputs.add(outputs.get(predecessor));
            }
            outputs.put(operation, run(operation, inputs));
            executed++;
        }
        LOG.debug(
                "Executed: target={}, operations={}, duration_ms={}",
                target.name(),
                executed,
                (System.nanoTime() - start) / 1_000_000);
        return outputs.get(target);
    }

    private static Object run(Operation operation, List<Object> inputs) {
        long start = System.nanoTime();
        Object output;
        try {
            output = operation.call(inputs);
        } catch (CroissantException e) {
            LOG.debug("Operation failed: operation={}, error={}", operation.name(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            throw new OperationGraphException(
                    "Operation " + operation.name() + " failed: " + e.getMessage(),
                    e,
                    operation.node().uid(),
                    operation.name());
        }
        LOG.debug(
                "Operation done: operation={}, duration_ms={}",
                operation.name(),
                (System.nanoTime() - start) / 1_000_000);
        return output;
    }
}
