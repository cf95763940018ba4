/**
 * Synchronization state machine for two editable representations of the same data.
 * <ul>
 *   <li>{@link com.dualedit.sync.SyncController}: states, edit permissions, sync timeout, failure recovery,
 *   pending edits and version history for one editing session.</li>
 *   <li>{@link com.dualedit.sync.ErrorType} and {@link com.dualedit.sync.ErrorClassification}: failure codes
 *   and the recovery policy of each class.</li>
 *   <li>{@link com.dualedit.sync.StateTransitionRules}: the allowed transitions.</li>
 * </ul>
 * The controller holds no representation data; its owner reacts to state changes and failure events.
 */
package com.dualedit.sync;
