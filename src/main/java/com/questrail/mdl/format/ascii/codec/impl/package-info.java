/**
 * ASCII MDL Codec, Line-Level Implementation
 * =============================================================================
 *
 * <p>Concrete reader and writer for ASCII MDL text.</p>
 *
 * <h2>Reading</h2>
 * <pre>
 *   Reader
 *        → AsciiLine.readAll            (tokens, 1-based line numbers)
 *        → DefaultMdlAsciiReader        (header keywords)
 *        → NodeBlockParser              (one node block at a time)
 *            → ControllerLines / StaticPropertyBindings
 *            → PayloadSection.standard(sink)
 *        → GeometryTreeBuilder
 *        → AnimationTreeBuilder         (per animation, after geometry)
 * </pre>
 *
 * <h2>Writing</h2>
 * <pre>
 *   Model
 *        → DefaultMdlAsciiWriter        (header, bounds, animations)
 *            → PayloadSection.write     (fields of the written node type)
 *            → ControllerLines.writeKeyed
 *        → AsciiLineWriter              (two-space indent, '\n' endings)
 * </pre>
 *
 * <p>A malformed line inside a node block truncates that node only; the
 * anomaly goes to the configured
 * {@link com.questrail.mdl.format.ascii.observability.MdlObservabilitySink}.</p>
 */
package com.questrail.mdl.format.ascii.codec.impl;
