/**
 * Cross-network convergence scoring.
 *
 * @since 0.1.0
 */
package org.smae.domain.convergence;
