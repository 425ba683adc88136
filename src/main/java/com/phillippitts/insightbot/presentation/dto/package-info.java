/**
 * Request and response records of the REST surface.
 */
package com.phillippitts.insightbot.presentation.dto;
