package com.example.cusplitter.application.service;

import com.example.cusplitter.application.exception.ReportExportValidationException;
import com.example.cusplitter.domain.model.CertificateRecord;
import com.example.cusplitter.domain.model.DeliveryLog;
import com.example.cusplitter.domain.model.DeliveryOutcome;
import com.example.cusplitter.domain.model.MatchDecision;
import com.example.cusplitter.domain.model.MatchStatus;
import com.example.cusplitter.domain.model.ReconciliationResult;
import com.example.cusplitter.domain.model.RosterEntry;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Turns the match table and the delivery log into downloadable CSV content.
 */
@Service
public class ReportCsvService {

	/**
	 * @param result reconciliation cached in the workspace
	 * @return CSV with one row per decision
	 * @throws ReportExportValidationException when there is no reconciliation to export
	 */
    public String exportMatchTable(ReconciliationResult result) {
        if (result == null || result.decisions().isEmpty()) {
            throw new ReportExportValidationException("No reconciliation available for export.");
        }
        StringBuilder builder = new StringBuilder();
        builder.append("Certificate,Pages,Surname,Given name,Fiscal code,Status,Review,Score,"
                + "Roster surname,Roster given name,Roster fiscal code,Roster email,Alternatives\n");
        for (MatchDecision decision : result.decisions()) {
            CertificateRecord record = decision.record();
            RosterEntry candidate = decision.candidate();
            builder.append(record != null ? String.valueOf(record.sequence()) : "").append(',')
                    .append(record != null ? record.displayPages() : "").append(',')
                    .append(escape(record != null ? record.surname() : null)).append(',')
                    .append(escape(record != null ? record.givenName() : null)).append(',')
                    .append(escape(record != null ? record.fiscalCode() : null)).append(',')
                    .append(decision.status()).append(',')
                    .append(decision.reviewCategory()).append(',')
                    .append(decision.status() == MatchStatus.ORPHAN_ROSTER ? "" : String.format(Locale.ROOT, "%.3f", decision.score())).append(',')
                    .append(escape(candidate != null ? candidate.surname() : null)).append(',')
                    .append(escape(candidate != null ? candidate.givenName() : null)).append(',')
                    .append(escape(candidate != null ? candidate.fiscalCode() : null)).append(',')
                    .append(escape(candidate != null ? candidate.email() : null)).append(',')
                    .append(escape(decision.alternatives().stream().map(RosterEntry::fullName).collect(Collectors.joining(" | "))))
                    .append('\n');
        }
        return builder.toString();
    }

	/**
	 * @param deliveryLog log of the last dispatch batch
	 * @return CSV with one row per (certificate, recipient) pair
	 * @throws ReportExportValidationException when no batch has run yet
	 */
    public String exportDeliveryLog(DeliveryLog deliveryLog) {
        if (deliveryLog == null || deliveryLog.size() == 0) {
            throw new ReportExportValidationException("No deliveries available for export.");
        }
        StringBuilder builder = new StringBuilder();
        builder.append("Certificate,Recipient,File,Subject,Status,Reason,Timestamp\n");
        for (DeliveryOutcome outcome : deliveryLog.getOutcomes()) {
            builder.append(outcome.getCertificateSequence()).append(',')
                    .append(escape(outcome.getRecipientEmail())).append(',')
                    .append(escape(outcome.getAttachmentFilename())).append(',')
                    .append(escape(outcome.getSubject())).append(',')
                    .append(outcome.getStatus()).append(',')
                    .append(escape(outcome.getFailureReason())).append(',')
                    .append(outcome.getTimestamp() != null ? outcome.getTimestamp().toString() : "")
                    .append('\n');
        }
        return builder.toString();
    }

	/**
	 * Quotes values containing commas, quotes, or newlines.
	 */
    private String escape(String value) {
        if (value == null) {
            return "";
        }
        String sanitized = value.replace("\"", "\"\"");
        if (sanitized.contains(",") || sanitized.contains("\"") || sanitized.contains("\n")) {
            return "\"" + sanitized + "\"";
        }
        return sanitized;
    }
}
