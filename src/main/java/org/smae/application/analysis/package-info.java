/**
 * Synchronous analysis stages applied after intake: tag validation, threshold evaluation, convergence scoring,
 * resistance linking, triage and source verification.
 * <p>Every stage takes an immutable list and returns a new one; inputs are never modified.</p>
 */
package org.smae.application.analysis;
