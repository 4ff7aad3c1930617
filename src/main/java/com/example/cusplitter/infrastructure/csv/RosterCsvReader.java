package com.example.cusplitter.infrastructure.csv;

import com.example.cusplitter.domain.exception.RosterFileRequiredException;
import com.example.cusplitter.domain.model.Roster;
import com.example.cusplitter.domain.model.RosterEntry;
import com.example.cusplitter.infrastructure.exception.RosterReadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads the recipient roster from a delimited text file.
 * <p>
 * The delimiter is guessed from the header line among {@code ; , TAB |}. Column names are matched
 * loosely ({@code Cognome}, {@code Codice Fiscale}, {@code E-mail}, ...), so exports from the
 * usual payroll and HR tools load without editing.
 */
@Component
public class RosterCsvReader {

    private static final Logger log = LoggerFactory.getLogger(RosterCsvReader.class);
    private static final char[] DELIMITERS = {';', ',', '\t', '|'};
    private static final char FALLBACK_DELIMITER = ';';
    private static final char BOM = '\uFEFF';

    /**
     * @param file uploaded roster
     * @return roster in file order
     * @throws RosterFileRequiredException  when no file was uploaded
     * @throws RosterReadException          when the file cannot be read or has no usable columns
     */
    public Roster read(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new RosterFileRequiredException();
        }
        try {
            return read(file.getBytes());
        } catch (IOException e) {
            throw new RosterReadException("Unable to read the uploaded roster file.", e);
        }
    }

    /**
     * @param bytes UTF-8 text, with or without byte order mark
     * @return roster in file order
     * @throws RosterReadException when the bytes are not valid UTF-8
     */
    public Roster read(byte[] bytes) {
        String text = decode(bytes);
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
        }
        String headerLine = text.lines().filter(line -> !line.isBlank()).findFirst()
                .orElseThrow(() -> new RosterReadException("The roster file is empty.", null));
        char delimiter = detectDelimiter(headerLine);

        List<List<String>> rows = parse(text, delimiter);
        List<String> header = rows.get(0);
        ColumnMapping columns = ColumnMapping.resolve(header);
        if (!columns.isUsable()) {
            throw new RosterReadException("The roster has no surname, name or fiscal code column. Found: "
                    + String.join(", ", header), null);
        }

        List<RosterEntry> entries = new ArrayList<>();
        int skipped = 0;
        for (List<String> row : rows.subList(1, rows.size())) {
            RosterEntry entry = RosterEntry.of(
                    columns.value(row, columns.surname),
                    columns.value(row, columns.givenName),
                    columns.value(row, columns.fiscalCode),
                    columns.value(row, columns.email));
            if (entry.surname() == null && entry.givenName() == null && !entry.hasFiscalCode()) {
                skipped++;
                continue;
            }
            entries.add(entry);
        }
        log.info("Loaded {} roster entries (delimiter '{}', {} row(s) skipped)", entries.size(),
                delimiter == '\t' ? "TAB" : String.valueOf(delimiter), skipped);
        return Roster.of(entries);
    }

    /**
     * Picks the candidate delimiter occurring most often outside quotes; earlier candidates win ties.
     */
    static char detectDelimiter(String headerLine) {
        char best = FALLBACK_DELIMITER;
        int bestCount = 0;
        for (char candidate : DELIMITERS) {
            int count = 0;
            boolean quoted = false;
            for (int i = 0; i < headerLine.length(); i++) {
                char c = headerLine.charAt(i);
                if (c == '"') {
                    quoted = !quoted;
                } else if (c == candidate && !quoted) {
                    count++;
                }
            }
            if (count > bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        return best;
    }

    /**
     * Splits the text into rows of cells, honouring double-quoted cells with embedded delimiters,
     * line breaks and doubled quotes. Blank lines are dropped.
     */
    static List<List<String>> parse(String text, char delimiter) {
        List<List<String>> rows = new ArrayList<>();
        List<String> row = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quoted) {
                if (c == '"' && i + 1 < text.length() && text.charAt(i + 1) == '"') {
                    cell.append('"');
                    i++;
                } else if (c == '"') {
                    quoted = false;
                } else {
                    cell.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == delimiter) {
                row.add(cell.toString());
                cell.setLength(0);
            } else if (c == '\n' || c == '\r') {
                if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                row.add(cell.toString());
                cell.setLength(0);
                addIfNotBlank(rows, row);
                row = new ArrayList<>();
            } else {
                cell.append(c);
            }
        }
        row.add(cell.toString());
        addIfNotBlank(rows, row);
        return rows;
    }

    private static String decode(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new RosterReadException("The roster file is not valid UTF-8 text. Save it as CSV UTF-8 and upload it again.", e);
        }
    }

    private static void addIfNotBlank(List<List<String>> rows, List<String> row) {
        if (row.stream().anyMatch(value -> !value.isBlank())) {
            rows.add(row);
        }
    }

    /**
     * Positions of the known columns in the header; -1 when absent.
     */
    private static final class ColumnMapping {
        private int surname = -1;
        private int givenName = -1;
        private int fiscalCode = -1;
        private int email = -1;

        static ColumnMapping resolve(List<String> header) {
            ColumnMapping mapping = new ColumnMapping();
            for (int i = 0; i < header.size(); i++) {
                String column = normalizeHeader(header.get(i));
                if (column.contains("cognome") || column.contains("denominazione")
                        || column.equals("surname") || column.equals("last_name") || column.equals("lastname")) {
                    mapping.surname = firstSet(mapping.surname, i);
                } else if (column.contains("nome") || column.equals("name")
                        || column.equals("first_name") || column.equals("firstname") || column.equals("given_name")) {
                    mapping.givenName = firstSet(mapping.givenName, i);
                } else if (column.equals("cf") || column.contains("fiscale")
                        || column.equals("fiscal_code") || column.equals("tax_code")) {
                    mapping.fiscalCode = firstSet(mapping.fiscalCode, i);
                } else if (column.contains("mail")) {
                    mapping.email = firstSet(mapping.email, i);
                }
            }
            return mapping;
        }

        boolean isUsable() {
            return surname >= 0 || givenName >= 0 || fiscalCode >= 0;
        }

        String value(List<String> row, int index) {
            if (index < 0 || index >= row.size()) {
                return null;
            }
            String value = row.get(index).strip();
            return value.isEmpty() ? null : value;
        }

        private static int firstSet(int current, int candidate) {
            return current >= 0 ? current : candidate;
        }

        private static String normalizeHeader(String header) {
            return Normalizer.normalize(header, Normalizer.Form.NFD)
                    .replaceAll("\\p{M}+", "")
                    .toLowerCase(Locale.ROOT)
                    .replaceAll("[^a-z0-9]+", "_")
                    .replaceAll("^_+|_+$", "");
        }
    }
}
