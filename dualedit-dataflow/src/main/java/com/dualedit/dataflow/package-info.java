/**
 * Wires timing, conversion, mapping and the sync state machine into one editing session.
 * {@link com.dualedit.dataflow.DataFlowOrchestrator} is the entry point for editor collaborators.
 */
package com.dualedit.dataflow;
