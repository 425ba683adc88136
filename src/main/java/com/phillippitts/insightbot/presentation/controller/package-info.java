/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code SessionController} - start, inspect and stop a guild session, run a manual
 *       analysis ({@code /api/guilds/{guildId}/session})</li>
 *   <li>{@code SettingsController} - analysis mode and interval
 *       ({@code /api/guilds/{guildId}/settings})</li>
 *   <li>{@code VoiceBridgeController} - audio fragments and speaker names pushed by the
 *       capture bridge ({@code /api/guilds/{guildId}/voice})</li>
 * </ul>
 *
 * <p>Controllers are thin adapters; exceptions are translated by
 * {@link com.phillippitts.insightbot.presentation.exception.GlobalExceptionHandler}.
 */
package com.phillippitts.insightbot.presentation.controller;
