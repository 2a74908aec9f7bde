package com.reflow.ocr.exception;

import lombok.experimental.StandardException;

@StandardException
public class RecognitionException extends RuntimeException {
}
