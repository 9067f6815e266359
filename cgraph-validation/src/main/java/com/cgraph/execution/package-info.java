/**
 * Execution graph: flat nodes and edges built from a {@link com.cgraph.validation.ValidatedGraph}
 * and handed to external renderers as JSON ({@link com.cgraph.execution.ExecutionGraphJson}) or
 * DOT ({@link com.cgraph.execution.ExecutionGraphDot}).
 */
package com.cgraph.execution;
