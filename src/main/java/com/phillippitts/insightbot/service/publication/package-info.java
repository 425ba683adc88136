/**
 * Report publication: messaging API client and size-limit chunking.
 */
package com.phillippitts.insightbot.service.publication;
