/**
 * Fork-Join conversions.
 *
 * <ul>
 *   <li>{@link com.cgraph.forkjoin.cfg} – statement-index control-flow graph</li>
 *   <li>{@link com.cgraph.forkjoin.structure} – region structuring back to nested sequence/parallel form</li>
 *   <li>{@link com.cgraph.forkjoin.lowering} – IR to linear fork/join/goto code</li>
 *   <li>{@link com.cgraph.forkjoin.ForkJoinConversions} – both directions over whole graphs</li>
 * </ul>
 */
package com.cgraph.forkjoin;
