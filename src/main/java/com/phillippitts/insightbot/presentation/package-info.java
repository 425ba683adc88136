/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Presentation depends on the service layer, never the other way around.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers</li>
 *   <li>{@code presentation.dto} - request and response records</li>
 *   <li>{@code presentation.exception} - global exception handling</li>
 * </ul>
 */
package com.phillippitts.insightbot.presentation;
