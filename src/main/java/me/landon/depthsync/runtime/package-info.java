/**
 * Playback-driven scheduling and the runtime that hosts it.
 *
 * <ol>
 *   <li>{@code PrefetchScheduler} turns the playback position into a bounded batch of requests
 *   <li>{@code AdaptiveTuner} retunes in-flight capacity and lead time from server statistics
 *   <li>{@code DepthSyncRuntime} wires the buffer, transport and ticks onto one event loop
 * </ol>
 *
 * <p>Nothing here blocks playback: a tick that cannot request anything simply issues nothing.
 */
package me.landon.depthsync.runtime;
