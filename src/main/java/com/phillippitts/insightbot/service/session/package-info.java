/**
 * Guild session lifecycle.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.insightbot.service.session.SessionRegistry} - at most one live
 *       session per guild, atomic check-and-insert</li>
 *   <li>{@link com.phillippitts.insightbot.service.session.GuildSession} - per-guild state behind a
 *       session-scoped read/write lock</li>
 *   <li>{@link com.phillippitts.insightbot.service.session.SessionScheduler} - cancellable
 *       periodic analysis loop</li>
 *   <li>{@link com.phillippitts.insightbot.service.session.GuildSessionManager} - start, manual
 *       analysis and stop sequence</li>
 * </ul>
 *
 * <p>No lock is shared between guilds; sessions of different guilds proceed in parallel.
 */
package com.phillippitts.insightbot.service.session;
