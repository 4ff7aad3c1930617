package com.example.cusplitter.config;

import com.example.cusplitter.domain.model.FieldLabelSet;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Settings bound from the {@code cu.*} namespace. Every section falls back to the documented
 * defaults when it is left out of the configuration.
 */
@ConfigurationProperties(prefix = "cu")
public record CuSplitterProperties(
        Segmentation segmentation,
        Extraction extraction,
        Matching matching,
        Dispatch dispatch) {

    public CuSplitterProperties {
        segmentation = segmentation == null ? new Segmentation(null) : segmentation;
        extraction = extraction == null ? new Extraction(null, null, null, 0) : extraction;
        matching = matching == null ? new Matching(null, null, false) : matching;
        dispatch = dispatch == null ? new Dispatch(0, null, null, null) : dispatch;
    }

    public static CuSplitterProperties defaults() {
        return new CuSplitterProperties(null, null, null, null);
    }

    /**
     * @param headerMarkers regular expressions; a page matching any of them starts a certificate
     */
    public record Segmentation(List<String> headerMarkers) {

        public Segmentation {
            headerMarkers = headerMarkers == null || headerMarkers.isEmpty()
                    ? List.of("CERTIFICAZIONE\\s+UNICA\\s+\\d{4}")
                    : List.copyOf(headerMarkers);
        }
    }

    /**
     * @param labelSets        label vocabularies tried in order
     * @param subjectAnchors   headings that open the subject section of a certificate
     * @param yearAnchors      phrases followed by the certificate year
     * @param yearAnchorWindow characters after a year anchor searched for the year
     */
    public record Extraction(
            List<FieldLabelSet> labelSets,
            List<String> subjectAnchors,
            List<String> yearAnchors,
            int yearAnchorWindow) {

        public Extraction {
            labelSets = labelSets == null || labelSets.isEmpty()
                    ? List.of(FieldLabelSet.italianDefault())
                    : List.copyOf(labelSets);
            subjectAnchors = subjectAnchors == null || subjectAnchors.isEmpty()
                    ? List.of(
                    "DATI\\s+RELATIVI\\s+AL\\s+DIPENDENTE",
                    "DATI\\s+ANAGRAFICI\\s+DEL\\s+PERCIPIENTE",
                    "DATI\\s+RELATIVI\\s+AL\\s+PERCIPIENTE",
                    "DATI\\s+ANAGRAFICI")
                    : List.copyOf(subjectAnchors);
            yearAnchors = yearAnchors == null || yearAnchors.isEmpty()
                    ? List.of(
                    "CERTIFICAZIONE\\s+UNICA",
                    "PERIODO\\s+D['’]\\s*IMPOSTA",
                    "ANNO\\s+D['’]\\s*IMPOSTA")
                    : List.copyOf(yearAnchors);
            yearAnchorWindow = yearAnchorWindow <= 0 ? 80 : yearAnchorWindow;
        }
    }

    /**
     * @param threshold               minimum fuzzy score accepted
     * @param margin                  minimum lead of the best fuzzy score over the runner-up
     * @param surnameInitialPrefilter score only roster entries sharing the surname's first letter
     */
    public record Matching(Double threshold, Double margin, boolean surnameInitialPrefilter) {

        public Matching {
            threshold = threshold == null ? 0.85d : threshold;
            margin = margin == null ? 0.05d : margin;
            if (threshold < 0d || threshold > 1d) {
                throw new IllegalArgumentException("cu.matching.threshold must be within [0, 1]");
            }
            if (margin < 0d || margin > 1d) {
                throw new IllegalArgumentException("cu.matching.margin must be within [0, 1]");
            }
        }
    }

    /**
     * @param concurrency    parallel sends per batch
     * @param fromAddress    sender address of delivery emails
     * @param subject        default subject template
     * @param body           default HTML body template
     */
    public record Dispatch(int concurrency, String fromAddress, String subject, String body) {

        public Dispatch {
            concurrency = concurrency <= 0 ? 4 : concurrency;
        }
    }
}
