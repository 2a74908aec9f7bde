package com.reflow.ocr.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reflow.ocr.model.Document;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;

@Component
@RequiredArgsConstructor
public class JsonExporter implements DocumentExporter {

    private final ObjectMapper objectMapper;

    @Override
    public ExportFormat format() {
        return ExportFormat.JSON;
    }

    @Override
    public ExportResult export(Document document, String filenameBase) {
        try {
            byte[] content = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document);
            return new ExportResult(filenameBase + format().extension(), format().mediaType(), content);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize document", e);
        }
    }
}
