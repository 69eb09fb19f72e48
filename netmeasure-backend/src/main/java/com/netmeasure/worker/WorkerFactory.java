package com.netmeasure.worker;

/**
 * Creates a worker of one kind.
 */
@FunctionalInterface
public interface WorkerFactory {
    Worker create(WorkerContext context);
}
