package com.reflow.ocr.exception;

import lombok.experimental.StandardException;

@StandardException
public class StorageException extends RuntimeException {
}
