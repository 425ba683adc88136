package com.phillippitts.insightbot.service.analysis;

import com.phillippitts.insightbot.domain.AnalysisMode;
import com.phillippitts.insightbot.exception.AnalysisServiceException;

import java.util.List;

/**
 * Client of the remote service that turns speaker audio into a discussion report.
 *
 * <p>All network calls are bounded by timeouts. Failures are reported as
 * {@link AnalysisServiceException} carrying a {@link AnalysisServiceException.Kind}.
 */
public interface AnalysisClient {

    /**
     * Uploads one speaker's file and waits until the service can use it.
     *
     * @throws AnalysisServiceException if the upload or processing fails
     */
    UploadedAudio upload(AudioUpload upload);

    /**
     * Requests one report over the uploaded files.
     *
     * @param files   successfully uploaded files, at least one
     * @param mode    prompt mode
     * @param context trailing excerpt of the previous report, may be empty
     * @return report text, never blank
     * @throws AnalysisServiceException if the service rejects or fails the request
     */
    String generateReport(List<UploadedAudio> files, AnalysisMode mode, String context);

    /**
     * Removes an uploaded file from the service. Best effort; never throws.
     */
    void delete(UploadedAudio file);

    /**
     * @return true if credentials for the service are present
     */
    boolean isConfigured();
}
