/**
 * Threshold metrics, crossings, and the fixed threshold catalog.
 * <p><strong>Concurrency:</strong> Records and the catalog are immutable; safe to share across threads.</p>
 *
 * @since 0.1.0
 */
package org.smae.domain.threshold;
