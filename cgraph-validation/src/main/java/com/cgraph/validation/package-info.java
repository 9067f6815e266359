/**
 * Dependency validation of IR graphs. {@link com.cgraph.validation.DependencyValidator} flattens the
 * graph into a {@link com.cgraph.validation.DependencyMap}, reports missing and circular
 * dependencies, and on success yields the only way to obtain a
 * {@link com.cgraph.validation.ValidatedGraph}.
 */
package com.cgraph.validation;
