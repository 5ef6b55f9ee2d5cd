package com.redarm.shared.model;

/**
 * Kinds of asynchronous work a job can carry.
 */
public final class JobType {

    public static final String EXPORT = "export";
    public static final String OCR = "ocr";

    private JobType() {
    }
}
