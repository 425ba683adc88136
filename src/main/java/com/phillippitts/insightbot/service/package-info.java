/**
 * Business services: audio buffering, voice capture, analysis, publication, settings and the
 * guild session lifecycle that ties them together.
 */
package com.phillippitts.insightbot.service;
