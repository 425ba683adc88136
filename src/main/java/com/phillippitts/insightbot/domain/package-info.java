/**
 * Immutable domain types shared by the session, analysis and settings services.
 */
package com.phillippitts.insightbot.domain;
