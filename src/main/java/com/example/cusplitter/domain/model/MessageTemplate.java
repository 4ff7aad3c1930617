package com.example.cusplitter.domain.model;

import com.example.cusplitter.domain.support.NameNormalizer;

/**
 * Subject and HTML body of the delivery email with {@code {nome}}, {@code {cognome}} and
 * {@code {anno}} placeholders.
 */
public record MessageTemplate(String subject, String body) {

    public static final String DEFAULT_SUBJECT = "Certificazione Unica {anno}";
    public static final String DEFAULT_BODY = "<p>Gentile {nome} {cognome},</p>"
            + "<p>in allegato trova la Sua Certificazione Unica {anno}.</p>"
            + "<p>Cordiali saluti</p>";

    public MessageTemplate {
        subject = subject == null || subject.isBlank() ? DEFAULT_SUBJECT : subject;
        body = body == null || body.isBlank() ? DEFAULT_BODY : body;
    }

    public static MessageTemplate defaults() {
        return new MessageTemplate(DEFAULT_SUBJECT, DEFAULT_BODY);
    }

    public String renderSubject(CertificateRecord record) {
        return render(subject, record).strip();
    }

    public String renderBody(CertificateRecord record) {
        return render(body, record);
    }

    private static String render(String template, CertificateRecord record) {
        String year = record.taxYear() != null ? String.valueOf(record.taxYear()) : "";
        return template
                .replace("{nome}", NameNormalizer.toTitleCase(record.givenName()))
                .replace("{cognome}", NameNormalizer.toTitleCase(record.surname()))
                .replace("{anno}", year);
    }
}
