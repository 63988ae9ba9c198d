/**
 * Controlled vocabularies of the SMAE ontology: networks, layers, ontology nodes, and coupling patterns.
 * <p><strong>Concurrency:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
package org.smae.domain.ontology;
