/**
 * Spring configuration: typed properties, executors, HTTP clients and logging filters.
 */
package com.phillippitts.insightbot.config;
