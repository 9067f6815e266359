/**
 * Notation models for concurrent task graphs.
 *
 * <ul>
 *   <li>{@link com.cgraph.model.ir} – structured IR nodes (pivot of all conversions), canonical writer and JSON interchange</li>
 *   <li>{@link com.cgraph.model.par} – Par nodes, canonical writer and {@link com.cgraph.model.par.ParMapping} to and from IR</li>
 *   <li>{@link com.cgraph.model.forkjoin} – Fork-Join statements and canonical writer</li>
 *   <li>{@link com.cgraph.model.ConversionException} / {@link com.cgraph.model.NotationParseException} – model failures</li>
 * </ul>
 */
package com.cgraph.model;
