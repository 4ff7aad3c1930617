package com.example.cusplitter.infrastructure.pdf;

import com.example.cusplitter.application.port.TextPageSource;
import com.example.cusplitter.domain.model.PageText;
import com.example.cusplitter.infrastructure.exception.PdfProcessingException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;

/**
 * {@link TextPageSource} backed by a PDFBox document loaded once from memory.
 * Not thread-safe; one instance serves one split.
 */
public final class PdfBoxTextPageSource implements TextPageSource, AutoCloseable {

    private final PDDocument document;
    private final PDFTextStripper stripper;

    private PdfBoxTextPageSource(PDDocument document) {
        this.document = document;
        this.stripper = new PDFTextStripper();
        configureStripper(stripper);
    }

    /**
     * Loads a PDF from its bytes.
     *
     * @param bytes PDF content
     * @return open page source, to be closed by the caller
     * @throws PdfProcessingException when PDFBox cannot parse the bytes
     */
    public static PdfBoxTextPageSource open(byte[] bytes) {
        try {
            return new PdfBoxTextPageSource(Loader.loadPDF(bytes));
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to read the uploaded PDF file.", e);
        }
    }

    @Override
    public int pageCount() {
        return document.getNumberOfPages();
    }

    @Override
    public PageText pageText(int index) {
        if (index < 0 || index >= pageCount()) {
            throw new IllegalArgumentException("Page " + index + " is outside the document");
        }
        stripper.setStartPage(index + 1);
        stripper.setEndPage(index + 1);
        try {
            return new PageText(index, stripper.getText(document));
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to read the text of page " + (index + 1) + ".", e);
        }
    }

    /**
     * @return the underlying document, for metadata reads while the source is open
     */
    public PDDocument document() {
        return document;
    }

    @Override
    public void close() {
        try {
            document.close();
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to release the PDF document.", e);
        }
    }

    private static void configureStripper(PDFTextStripper stripper) {
        stripper.setSortByPosition(true);
        stripper.setShouldSeparateByBeads(true);
        stripper.setSuppressDuplicateOverlappingText(false);
        stripper.setLineSeparator("\n");
        stripper.setWordSeparator(" ");
        stripper.setParagraphEnd("\n");
    }
}
