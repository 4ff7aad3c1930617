package com.example.cusplitter.application.service;

import com.example.cusplitter.config.CuSplitterProperties;
import com.example.cusplitter.domain.model.CertificateSegment;
import com.example.cusplitter.domain.model.PageText;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for page range segmentation.
 */
class CertificateSegmenterTest {

    private final CertificateSegmenter segmenter = new CertificateSegmenter(CuSplitterProperties.defaults());

    @Test
    void singleMarkerCoversTheWholeDocument() {
        List<PageText> pages = pages("CERTIFICAZIONE UNICA 2024\nDATI ANAGRAFICI", "Quadro 1", "Quadro 2");

        CertificateSegmenter.Segmentation result = segmenter.segment(pages);

        assertThat(result.segments()).hasSize(1);
        CertificateSegment segment = result.segments().get(0);
        assertThat(segment.sequence()).isEqualTo(1);
        assertThat(segment.startPage()).isZero();
        assertThat(segment.endPage()).isEqualTo(2);
        assertThat(segment.rawText()).contains("Quadro 1").contains("Quadro 2");
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void everyPageAfterTheFirstMarkerBelongsToExactlyOneSegment() {
        List<PageText> pages = pages(
                "Lettera di accompagnamento",
                "Certificazione   Unica 2024 - Rossi",
                "segue",
                "CERTIFICAZIONE UNICA 2024 - Verdi",
                "CERTIFICAZIONE UNICA 2024 - Bianchi",
                "",
                "ultima pagina");

        CertificateSegmenter.Segmentation result = segmenter.segment(pages);

        List<Integer> covered = new ArrayList<>();
        int expectedStart = 1;
        for (CertificateSegment segment : result.segments()) {
            assertThat(segment.startPage()).isEqualTo(expectedStart);
            for (int page = segment.startPage(); page <= segment.endPage(); page++) {
                covered.add(page);
            }
            expectedStart = segment.endPage() + 1;
        }
        assertThat(covered).containsExactly(1, 2, 3, 4, 5, 6);
        assertThat(result.segments()).extracting(CertificateSegment::sequence).containsExactly(1, 2, 3);
        assertThat(result.segments().get(2).endPage()).isEqualTo(6);
        assertThat(result.warnings()).containsExactly("Page 1 precedes the first certificate and was ignored.");
    }

    @Test
    void phraseWithoutYearOnAContinuationPageDoesNotSplit() {
        List<PageText> pages = pages(
                "CERTIFICAZIONE UNICA 2025\nDATI RELATIVI AL DIPENDENTE",
                "Note: la presente Certificazione Unica attesta i redditi corrisposti");

        CertificateSegmenter.Segmentation result = segmenter.segment(pages);

        assertThat(result.segments()).hasSize(1);
        assertThat(result.segments().get(0).endPage()).isEqualTo(1);
    }

    @Test
    void documentWithoutMarkersYieldsNoSegmentsAndAWarning() {
        CertificateSegmenter.Segmentation result = segmenter.segment(pages("Fattura", "Pagina 2"));

        assertThat(result.segments()).isEmpty();
        assertThat(result.warnings()).hasSize(1);
        assertThat(result.warnings().get(0)).contains("No certificate header found");
    }

    @Test
    void emptyDocumentYieldsNoSegments() {
        CertificateSegmenter.Segmentation result = segmenter.segment(List.of());

        assertThat(result.segments()).isEmpty();
        assertThat(result.warnings()).containsExactly("The document has no pages.");
    }

    @Test
    void configuredMarkersReplaceTheDefault() {
        CuSplitterProperties properties = new CuSplitterProperties(
                new CuSplitterProperties.Segmentation(List.of("CU\\s+\\d{4}")), null, null, null);
        CertificateSegmenter custom = new CertificateSegmenter(properties);

        CertificateSegmenter.Segmentation result = custom.segment(pages("CU 2024", "CERTIFICAZIONE UNICA", "CU 2024"));

        assertThat(result.segments()).extracting(CertificateSegment::startPage).containsExactly(0, 2);
    }

    private static List<PageText> pages(String... texts) {
        List<PageText> pages = new ArrayList<>();
        for (int i = 0; i < texts.length; i++) {
            pages.add(new PageText(i, texts[i]));
        }
        return pages;
    }
}
