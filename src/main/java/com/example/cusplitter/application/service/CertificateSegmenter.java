package com.example.cusplitter.application.service;

import com.example.cusplitter.config.CuSplitterProperties;
import com.example.cusplitter.domain.model.CertificateSegment;
import com.example.cusplitter.domain.model.PageText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Partitions the pages of a bulk document into contiguous certificate page ranges.
 * A page opens a new certificate whenever one of the configured header markers appears anywhere
 * on it; the certificate then runs until the page before the next marker or the end of the
 * document.
 */
@Service
public class CertificateSegmenter {

    private static final Logger log = LoggerFactory.getLogger(CertificateSegmenter.class);

    private final List<Pattern> headerMarkers;

    public CertificateSegmenter(CuSplitterProperties properties) {
        this.headerMarkers = properties.segmentation().headerMarkers().stream()
                .map(marker -> Pattern.compile(marker, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                .toList();
    }

    /**
     * Splits the ordered pages into certificate segments.
     *
     * @param pages pages in index order
     * @return segmentation with the segments and any warning for the operator
     */
    public Segmentation segment(List<PageText> pages) {
        if (pages == null || pages.isEmpty()) {
            return new Segmentation(List.of(), List.of("The document has no pages."));
        }

        List<Integer> starts = new ArrayList<>();
        for (PageText page : pages) {
            if (startsCertificate(page)) {
                starts.add(page.index());
            }
        }

        List<String> warnings = new ArrayList<>();
        if (starts.isEmpty()) {
            log.warn("No certificate header found in {} pages", pages.size());
            warnings.add("No certificate header found: the document may not be a supported format.");
            return new Segmentation(List.of(), warnings);
        }

        int firstStart = starts.get(0);
        if (firstStart > 0) {
            log.warn("Dropping {} page(s) before the first certificate header", firstStart);
            warnings.add(firstStart == 1
                    ? "Page 1 precedes the first certificate and was ignored."
                    : "Pages 1-" + firstStart + " precede the first certificate and were ignored.");
        }

        int lastPage = pages.get(pages.size() - 1).index();
        List<CertificateSegment> segments = new ArrayList<>(starts.size());
        for (int i = 0; i < starts.size(); i++) {
            int start = starts.get(i);
            int end = i + 1 < starts.size() ? starts.get(i + 1) - 1 : lastPage;
            segments.add(new CertificateSegment(i + 1, start, end, joinText(pages, start, end)));
        }
        log.info("Segmented {} pages into {} certificate(s)", pages.size(), segments.size());
        return new Segmentation(segments, warnings);
    }

    private boolean startsCertificate(PageText page) {
        String text = page.text();
        if (text.isBlank()) {
            return false;
        }
        for (Pattern marker : headerMarkers) {
            if (marker.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private String joinText(List<PageText> pages, int start, int end) {
        StringBuilder builder = new StringBuilder();
        for (PageText page : pages) {
            if (page.index() < start || page.index() > end) {
                continue;
            }
            if (builder.length() > 0) {
                builder.append('\n');
            }
            builder.append(page.text());
        }
        return builder.toString();
    }

    /**
     * Segments of one document plus the warnings raised while finding them.
     */
    public record Segmentation(List<CertificateSegment> segments, List<String> warnings) {

        public Segmentation {
            segments = List.copyOf(segments);
            warnings = List.copyOf(warnings);
        }
    }
}
