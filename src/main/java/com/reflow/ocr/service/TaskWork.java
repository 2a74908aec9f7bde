package com.reflow.ocr.service;

@FunctionalInterface
public interface TaskWork {
    void run() throws Exception;
}
