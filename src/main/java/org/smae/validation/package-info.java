/**
 * <strong>Purpose:</strong> Validation helpers used by domain records and configuration bootstrap.
 * <p><strong>Pipeline role:</strong> Domain support; rejects blank identifiers and non-finite readings before
 * events enter the analytical stages.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package org.smae.validation;
