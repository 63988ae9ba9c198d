/**
 * Executor factories for pipeline worker pools.
 * <p><strong>Role:</strong> Infrastructure utilities configuring the intake fan-out pool.</p>
 * <p><strong>Concurrency:</strong> Provides thread-safe factory methods that return managed executors.</p>
 * <p><strong>Security:</strong> Thread names carry only the configured prefix and an index.</p>
 */
package org.smae.infrastructure.exec;
