/**
 * ASCII MDL Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> for the textual
 * variant of the MDL model format. The codec turns ASCII MDL text into the
 * canonical node graph in {@code com.questrail.mdl.model} and back.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   text
 *     → header lines           (model name, classification, bounds)
 *     → node blocks            (payloads picked from the node keyword,
 *                               controllers resolved by namespace)
 *     → geometry tree builder  (parent references → tree)
 *     → animation blocks       (parallel trees, controllers only)
 *     → Model
 * </pre>
 *
 * <p>Writing runs the same steps in reverse. Rules shared with the binary
 * format (node-type flags, controller ids, material packing, rotation
 * conversion) live in {@code com.questrail.mdl.core} and
 * {@code com.questrail.mdl.mapping}, not here.</p>
 *
 * <h2>Round Trips</h2>
 * <p>Reading the writer's output yields a graph equal, field by field, to the
 * graph that was written. Lines the reader does not understand are kept on
 * the node and written back verbatim.</p>
 */
package com.questrail.mdl.format.ascii.codec;
