package com.redarm.processing;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Clock;
import java.util.Calendar;
import java.util.GregorianCalendar;
import java.util.TimeZone;

/**
 * Produces the exported PDF from the source document.
 */
@Service
public class PdfExportRenderer {

    private static final Logger logger = LoggerFactory.getLogger(PdfExportRenderer.class);
    static final String PRODUCER = "redarm-jobs";

    private final Clock clock;

    public PdfExportRenderer(Clock clock) {
        this.clock = clock;
    }

    /**
     * @throws IOException if the source is not a readable PDF
     */
    public byte[] render(byte[] source) throws IOException {
        try (PDDocument document = Loader.loadPDF(source)) {
            PDDocumentInformation info = document.getDocumentInformation();
            info.setProducer(PRODUCER);
            Calendar now = new GregorianCalendar(TimeZone.getTimeZone("UTC"));
            now.setTimeInMillis(clock.millis());
            info.setModificationDate(now);

            ByteArrayOutputStream out = new ByteArrayOutputStream(source.length);
            document.save(out);
            logger.debug("Rendered export PDF ({} pages, {} bytes)", document.getNumberOfPages(), out.size());
            return out.toByteArray();
        }
    }
}
