/**
 * Translation of domain exceptions into HTTP responses.
 */
package com.phillippitts.insightbot.presentation.exception;
