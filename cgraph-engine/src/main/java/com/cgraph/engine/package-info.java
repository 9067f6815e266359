/**
 * Engine: notation selection and the conversion / rendering pipeline.
 *
 * <ul>
 *   <li>{@link com.cgraph.engine.NotationFormat} – {@code .graph}, {@code .par}, {@code .fk} extensions</li>
 *   <li>{@link com.cgraph.engine.NotationDocument} – parsed graph tagged with its notation</li>
 *   <li>{@link com.cgraph.engine.GraphPipeline} – convert, validate, build and render execution graphs</li>
 *   <li>{@link com.cgraph.engine.config} – environment configuration ({@link com.cgraph.engine.config.CgraphConfig})</li>
 * </ul>
 */
package com.cgraph.engine;
