/**
 * Logging support: request correlation via Log4j2 ThreadContext.
 */
package com.phillippitts.insightbot.config.logging;
