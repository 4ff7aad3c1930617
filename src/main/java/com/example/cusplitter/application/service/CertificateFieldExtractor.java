package com.example.cusplitter.application.service;

import com.example.cusplitter.config.CuSplitterProperties;
import com.example.cusplitter.domain.model.CertificateRecord;
import com.example.cusplitter.domain.model.CertificateSegment;
import com.example.cusplitter.domain.model.FieldLabelSet;
import com.example.cusplitter.domain.support.FiscalCodes;
import com.example.cusplitter.domain.support.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reads the subject fields (fiscal code, surname, given name, tax year) from the text of one
 * certificate. Every field is extracted independently; a field that cannot be read is left
 * {@code null} and the record is still produced.
 */
@Service
public class CertificateFieldExtractor {

    private static final Logger log = LoggerFactory.getLogger(CertificateFieldExtractor.class);
    private static final Pattern YEAR_TOKEN = Pattern.compile("(?<!\\d)(\\d{4})(?!\\d)");
    private static final Pattern FIRST_DIGIT = Pattern.compile("\\d");
    private static final Pattern FISCAL_CODE_START = Pattern.compile("(?<![A-Za-z])[A-Za-z]{6}\\d{2}[A-Za-z]");
    private static final int MIN_YEAR = 2000;
    private static final int MAX_LABEL_OCCURRENCES = 5;

    private final List<Pattern> subjectAnchors;
    private final List<Pattern> yearAnchors;
    private final int yearAnchorWindow;
    private final List<CompiledLabelSet> labelSets;
    private final Clock clock;

    public CertificateFieldExtractor(CuSplitterProperties properties, Clock clock) {
        CuSplitterProperties.Extraction extraction = properties.extraction();
        this.subjectAnchors = compileAll(extraction.subjectAnchors());
        this.yearAnchors = compileAll(extraction.yearAnchors());
        this.yearAnchorWindow = extraction.yearAnchorWindow();
        this.labelSets = extraction.labelSets().stream().map(CompiledLabelSet::new).toList();
        this.clock = clock;
    }

    /**
     * Populates a certificate record from a segment.
     *
     * @param segment page range and text produced by the segmenter
     * @return record with whichever fields could be read
     */
    public CertificateRecord extract(CertificateSegment segment) {
        String text = segment.rawText();
        String subjectSection = subjectSection(text);

        String fiscalCode = extractFiscalCode(subjectSection, text);
        SubjectName name = extractName(subjectSection, text);
        Integer taxYear = extractTaxYear(text);

        if (fiscalCode == null && name.isEmpty()) {
            log.warn("Certificate {} (pages {}-{}) has neither a readable fiscal code nor a name",
                    segment.sequence(), segment.startPage() + 1, segment.endPage() + 1);
        } else {
            log.debug("Certificate {}: name='{} {}', fiscal code {}, year {}", segment.sequence(),
                    name.surname(), name.givenName(), fiscalCode != null ? "found" : "missing", taxYear);
        }

        return new CertificateRecord(
                segment.sequence(),
                segment.startPage(),
                segment.endPage(),
                text,
                name.surname(),
                name.givenName(),
                fiscalCode,
                taxYear
        );
    }

    /**
     * Returns the text after the first subject-section heading, or the whole text when none is present.
     */
    String subjectSection(String text) {
        for (Pattern anchor : subjectAnchors) {
            Matcher matcher = anchor.matcher(text);
            if (matcher.find()) {
                return text.substring(matcher.end());
            }
        }
        return text;
    }

    /**
     * First fiscal code with a valid check letter, searching the subject section before the whole text.
     */
    String extractFiscalCode(String subjectSection, String fullText) {
        String code = firstValidFiscalCode(subjectSection);
        if (code == null && subjectSection.length() != fullText.length()) {
            code = firstValidFiscalCode(fullText);
        }
        return code;
    }

    private String firstValidFiscalCode(String text) {
        for (String candidate : FiscalCodes.findCandidates(text)) {
            if (FiscalCodes.isValid(candidate)) {
                return candidate;
            }
            log.debug("Skipping fiscal code candidate with an invalid check letter");
        }
        return null;
    }

    SubjectName extractName(String subjectSection, String fullText) {
        SubjectName name = extractNameFrom(subjectSection);
        if (name.isEmpty() && subjectSection.length() != fullText.length()) {
            name = extractNameFrom(fullText);
        }
        return name;
    }

    private SubjectName extractNameFrom(String text) {
        for (CompiledLabelSet labelSet : labelSets) {
            String surname = labelSet.findValue(text, labelSet.surnameLabels);
            String givenName = labelSet.findValue(text, labelSet.givenNameLabels);
            if (surname != null || givenName != null) {
                return new SubjectName(surname, givenName);
            }
        }
        return SubjectName.EMPTY;
    }

    /**
     * Year near a year anchor, falling back to the greatest plausible year anywhere in the text.
     */
    Integer extractTaxYear(String text) {
        int maxYear = LocalDate.now(clock).getYear() + 1;
        for (Pattern anchor : yearAnchors) {
            Matcher anchorMatcher = anchor.matcher(text);
            while (anchorMatcher.find()) {
                int windowEnd = Math.min(text.length(), anchorMatcher.end() + yearAnchorWindow);
                Matcher yearMatcher = YEAR_TOKEN.matcher(text.substring(anchorMatcher.end(), windowEnd));
                while (yearMatcher.find()) {
                    int year = Integer.parseInt(yearMatcher.group(1));
                    if (year >= MIN_YEAR && year <= maxYear) {
                        return year;
                    }
                }
            }
        }

        Integer latest = null;
        Matcher yearMatcher = YEAR_TOKEN.matcher(text);
        while (yearMatcher.find()) {
            int year = Integer.parseInt(yearMatcher.group(1));
            if (year >= MIN_YEAR && year <= maxYear && (latest == null || year > latest)) {
                latest = year;
            }
        }
        return latest;
    }

    private static List<Pattern> compileAll(List<String> expressions) {
        return expressions.stream()
                .map(expression -> Pattern.compile(expression, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                .toList();
    }

    /**
     * Builds a regex matching a label as a whole word, tolerant to any run of whitespace between its words.
     */
    private static Pattern labelPattern(String label) {
        String body = Arrays.stream(label.strip().split("\\s+"))
                .map(Pattern::quote)
                .collect(Collectors.joining("\\s+"));
        return Pattern.compile("(?<!\\p{L})" + body + "(?!\\p{L})", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    /**
     * Surname and given name read from a certificate; either may be {@code null}.
     */
    record SubjectName(String surname, String givenName) {

        static final SubjectName EMPTY = new SubjectName(null, null);

        boolean isEmpty() {
            return surname == null && givenName == null;
        }
    }

    /**
     * A {@link FieldLabelSet} with its labels turned into patterns.
     */
    private static final class CompiledLabelSet {
        private final List<Pattern> surnameLabels;
        private final List<Pattern> givenNameLabels;
        private final List<Pattern> boundaryLabels;

        CompiledLabelSet(FieldLabelSet labelSet) {
            this.surnameLabels = labelSet.surnameLabels().stream().map(CertificateFieldExtractor::labelPattern).toList();
            this.givenNameLabels = labelSet.givenNameLabels().stream().map(CertificateFieldExtractor::labelPattern).toList();
            List<Pattern> boundaries = new ArrayList<>(surnameLabels);
            boundaries.addAll(givenNameLabels);
            labelSet.stopLabels().stream().map(CertificateFieldExtractor::labelPattern).forEach(boundaries::add);
            this.boundaryLabels = boundaries;
        }

        /**
         * Tries the labels in order and returns the first normalized value found after one of them.
         */
        String findValue(String text, List<Pattern> labels) {
            for (Pattern label : labels) {
                Matcher matcher = label.matcher(text);
                int occurrences = 0;
                while (matcher.find() && occurrences++ < MAX_LABEL_OCCURRENCES) {
                    String value = valueAfter(text, matcher.end());
                    if (value != null) {
                        return value;
                    }
                }
            }
            return null;
        }

        private String valueAfter(String text, int offset) {
            int lineEnd = text.indexOf('\n', offset);
            String sameLine = lineEnd < 0 ? text.substring(offset) : text.substring(offset, lineEnd);
            String value = cleanValue(sameLine);
            if (value == null && lineEnd >= 0) {
                value = cleanValue(nextNonBlankLine(text, lineEnd + 1));
            }
            return value;
        }

        private String nextNonBlankLine(String text, int from) {
            int position = from;
            while (position < text.length()) {
                int lineEnd = text.indexOf('\n', position);
                String line = lineEnd < 0 ? text.substring(position) : text.substring(position, lineEnd);
                if (!line.isBlank()) {
                    return line;
                }
                if (lineEnd < 0) {
                    break;
                }
                position = lineEnd + 1;
            }
            return "";
        }

        private String cleanValue(String raw) {
            String value = raw.replaceFirst("^[\\s:.\\-]+", "");
            int cut = value.length();
            for (Pattern boundary : boundaryLabels) {
                Matcher matcher = boundary.matcher(value);
                if (matcher.find() && matcher.start() < cut) {
                    cut = matcher.start();
                }
            }
            cut = Math.min(cut, firstIndex(FIRST_DIGIT, value));
            cut = Math.min(cut, firstIndex(FISCAL_CODE_START, value));
            return NameNormalizer.normalize(value.substring(0, cut));
        }

        private static int firstIndex(Pattern pattern, String value) {
            Matcher matcher = pattern.matcher(value);
            return matcher.find() ? matcher.start() : value.length();
        }
    }
}
