/**
 * Timing control for edit notifications.
 * <ul>
 *   <li>{@link com.dualedit.timing.Scheduler} – delayed execution and time source; {@link com.dualedit.timing.ExecutorScheduler}
 *       for a live session, {@link com.dualedit.timing.VirtualScheduler} for deterministic tests</li>
 *   <li>{@link com.dualedit.timing.TimingController} – debounce ({@link com.dualedit.timing.DebounceController}) or
 *       throttle ({@link com.dualedit.timing.ThrottleController}) wrapper around a callback</li>
 *   <li>{@link com.dualedit.timing.TimingManager} – named controllers of one session</li>
 * </ul>
 */
package com.dualedit.timing;
