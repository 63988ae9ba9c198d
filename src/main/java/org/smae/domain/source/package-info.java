/**
 * Source provenance: citations and the seven-tier source hierarchy used for triangulation.
 *
 * @since 0.1.0
 */
package org.smae.domain.source;
