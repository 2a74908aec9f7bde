package com.reflow.ocr.export;

import com.reflow.ocr.exception.DocumentNotReadyException;
import com.reflow.ocr.exception.UnsupportedExportFormatException;
import com.reflow.ocr.model.Session;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Resolves an exporter by format. Every {@link DocumentExporter} bean registers itself.
 */
@Slf4j
@Component
public class ExporterRegistry {

    static final String DEFAULT_FILENAME = "document";

    private final Map<ExportFormat, DocumentExporter> exporters = new EnumMap<>(ExportFormat.class);

    public ExporterRegistry(List<DocumentExporter> exporters) {
        for (DocumentExporter exporter : exporters) {
            DocumentExporter previous = this.exporters.put(exporter.format(), exporter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate exporter for " + exporter.format().wireName()
                    + ": " + previous.getClass().getSimpleName() + ", " + exporter.getClass().getSimpleName());
            }
        }
    }

    public Set<ExportFormat> supportedFormats() {
        return exporters.keySet();
    }

    public ExportResult export(Session session, ExportFormat format) {
        if (session.document() == null) {
            throw new DocumentNotReadyException(session.id());
        }
        DocumentExporter exporter = exporters.get(format);
        if (exporter == null) {
            throw new UnsupportedExportFormatException(format.wireName());
        }
        ExportResult result = exporter.export(session.document(), filenameBase(session.name()));
        log.info("Session {}: exported document as {} ({} bytes)", session.id(), format.wireName(), result.content().length);
        return result;
    }

    static String filenameBase(String sessionName) {
        if (sessionName == null) {
            return DEFAULT_FILENAME;
        }
        String base = sessionName.strip().replace(' ', '_').replaceAll("[\\\\/:*?\"<>|]", "").toLowerCase(Locale.ROOT);
        return base.isEmpty() ? DEFAULT_FILENAME : base;
    }
}
