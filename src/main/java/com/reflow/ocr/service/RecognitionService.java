package com.reflow.ocr.service;

import java.util.UUID;

public interface RecognitionService {

    String TASK_KIND = "recognition";

    /**
     * Marks the session as processing and starts recognition in the background.
     *
     * @return id of the recognition task
     */
    UUID startRecognition(UUID sessionId);
}
