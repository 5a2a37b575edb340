package com.example.reportmerge.application.service;

import com.example.reportmerge.domain.exception.PdfFileRequiredException;
import com.example.reportmerge.domain.exception.PdfNotFoundException;
import com.example.reportmerge.domain.exception.PdfPathRequiredException;
import com.example.reportmerge.domain.exception.UnsupportedPdfFormatException;
import com.example.reportmerge.domain.model.ExtractedTable;
import com.example.reportmerge.domain.model.PageTable;
import com.example.reportmerge.domain.model.PageWarning;
import com.example.reportmerge.domain.model.PdfExtractionResult;
import com.example.reportmerge.infrastructure.exception.PdfProcessingException;
import com.example.reportmerge.infrastructure.pdf.TabulaTableReader;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Application-layer service that turns a PDF into filtered body text plus its tables.
 * Pages are read one at a time; a page that cannot be read is skipped with a warning
 * instead of aborting the document.
 */
@Service
public class PdfTextService {

    private static final Logger log = LoggerFactory.getLogger(PdfTextService.class);
    private static final String LINE_SEPARATOR = "\n";
    private static final String PAGE_SEPARATOR = "\n\n";

    private final PageFilter pageFilter;
    private final TabulaTableReader tableReader;

    /**
     * Creates the service with its page-level collaborators.
     *
     * @param pageFilter  removes table echoes, captions and attribution lines
     * @param tableReader finds the tables of a page
     */
    public PdfTextService(PageFilter pageFilter, TabulaTableReader tableReader) {
        this.pageFilter = pageFilter;
        this.tableReader = tableReader;
    }

    /**
     * Extracts an uploaded PDF.
     *
     * @param file uploaded PDF file
     * @return filtered text, tables and page warnings
     * @throws PdfFileRequiredException      when the file is null or empty
     * @throws UnsupportedPdfFormatException when the MIME type/name does not look like a PDF
     * @throws PdfProcessingException        when PDFBox cannot open the bytes
     */
    public PdfExtractionResult extractText(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new PdfFileRequiredException();
        }
        if (!looksLikePdf(file)) {
            throw new UnsupportedPdfFormatException(file.getOriginalFilename());
        }

        String fileName = resolveFileName(file);
        try {
            return extractTextInternal(file.getBytes(), fileName);
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to process the uploaded PDF file " + fileName + ".", e);
        }
    }

    /**
     * Reads a PDF from the filesystem and extracts it.
     *
     * @param pdfPath path pointing to a PDF file on disk
     * @return filtered text, tables and page warnings
     * @throws PdfPathRequiredException when {@code pdfPath} is null
     * @throws PdfNotFoundException     when the path does not exist
     * @throws PdfProcessingException   when the file cannot be opened as a PDF
     */
    public PdfExtractionResult extractText(Path pdfPath) {
        if (pdfPath == null) {
            throw new PdfPathRequiredException();
        }
        if (!Files.exists(pdfPath)) {
            throw new PdfNotFoundException(pdfPath.toAbsolutePath().toString());
        }
        String fileName = pdfPath.getFileName() != null ? pdfPath.getFileName().toString() : pdfPath.toString();
        try {
            return extractTextInternal(Files.readAllBytes(pdfPath), fileName);
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to process the PDF at " + pdfPath, e);
        }
    }

    /**
     * Shared implementation for both request sources.
     *
     * @param bytes    PDF bytes already loaded into memory
     * @param fileName logical name used in the result and in log messages
     * @return populated extraction result
     * @throws IOException when the document itself cannot be loaded
     */
    private PdfExtractionResult extractTextInternal(byte[] bytes, String fileName) throws IOException {
        try (PDDocument document = PDDocument.load(bytes)) {
            int pageCount = document.getNumberOfPages();
            PDFTextStripper stripper = new PDFTextStripper();
            configureStripper(stripper);

            List<List<String>> pages = new ArrayList<>(pageCount);
            List<ExtractedTable> tables = new ArrayList<>();
            List<PageWarning> warnings = new ArrayList<>();

            for (int pageNumber = 1; pageNumber <= pageCount; pageNumber++) {
                try {
                    List<PageTable> pageTables = tableReader.readTables(document, pageNumber);
                    String rawText = extractPageText(stripper, document, pageNumber);
                    pages.add(pageFilter.filterPage(rawText, pageTables));
                    for (int i = 0; i < pageTables.size(); i++) {
                        tables.add(new ExtractedTable(pageNumber, i + 1, pageTables.get(i).rows()));
                    }
                } catch (IOException | RuntimeException ex) {
                    log.warn("Skipping page {} of {}: {}", pageNumber, fileName, ex.getMessage());
                    warnings.add(new PageWarning(pageNumber, String.valueOf(ex.getMessage())));
                }
            }

            String text = assembleText(pages);
            log.debug("Extracted {} characters and {} tables from {} ({} pages)", text.length(), tables.size(), fileName, pageCount);
            return new PdfExtractionResult(fileName, pageCount, text, tables, warnings);
        }
    }

    /**
     * Reads the text of a single page in content-stream order.
     *
     * @param stripper shared stripper for the document
     * @param document loaded PDF document
     * @param pageNumber 1-based page number
     * @return raw page text
     * @throws IOException when PDFBox cannot read the page content
     */
    private String extractPageText(PDFTextStripper stripper, PDDocument document, int pageNumber) throws IOException {
        stripper.setStartPage(pageNumber);
        stripper.setEndPage(pageNumber);
        return stripper.getText(document);
    }

    /**
     * Joins filtered pages: lines with a single newline, pages with a blank line.
     * Pages without lines are left out entirely.
     *
     * @param pages filtered lines per page, in page order
     * @return document body text
     */
    String assembleText(List<List<String>> pages) {
        return pages.stream()
                .filter(lines -> lines != null && !lines.isEmpty())
                .map(lines -> String.join(LINE_SEPARATOR, lines))
                .collect(Collectors.joining(PAGE_SEPARATOR));
    }

    /**
     * Applies the stripper configuration: reading order follows the content stream, no positional layout.
     *
     * @param stripper stripper to configure
     */
    private void configureStripper(PDFTextStripper stripper) {
        stripper.setSortByPosition(false);
        stripper.setShouldSeparateByBeads(true);
        stripper.setSuppressDuplicateOverlappingText(true);
        stripper.setLineSeparator(LINE_SEPARATOR);
    }

    /**
     * Performs a lightweight PDF detection check based on MIME type and file name.
     *
     * @param file uploaded file
     * @return {@code true} when the content type or suffix indicates a PDF
     */
    private boolean looksLikePdf(MultipartFile file) {
        String contentType = file.getContentType();
        if (contentType != null && contentType.equalsIgnoreCase("application/pdf")) {
            return true;
        }
        String fileName = file.getOriginalFilename();
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private String resolveFileName(MultipartFile file) {
        String fileName = file.getOriginalFilename();
        if (fileName == null || fileName.isBlank()) {
            return "uploaded.pdf";
        }
        int separator = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        return fileName.substring(separator + 1);
    }
}
