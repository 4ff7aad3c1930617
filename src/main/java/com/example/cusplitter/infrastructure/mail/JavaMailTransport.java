package com.example.cusplitter.infrastructure.mail;

import com.example.cusplitter.application.port.MailTransport;
import com.example.cusplitter.application.port.TransportResult;
import com.example.cusplitter.config.CuSplitterProperties;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * {@link MailTransport} over Spring's {@link JavaMailSender}.
 * The sender only exists when {@code spring.mail.host} is set; without it every send fails with a
 * readable reason and nothing is thrown.
 */
@Component
public class JavaMailTransport implements MailTransport {

    private static final Logger log = LoggerFactory.getLogger(JavaMailTransport.class);
    private static final String NOT_CONFIGURED = "SMTP is not configured: set spring.mail.host.";

    private final ObjectProvider<JavaMailSender> mailSender;
    private final String fromAddress;

    public JavaMailTransport(ObjectProvider<JavaMailSender> mailSender, CuSplitterProperties properties) {
        this.mailSender = mailSender;
        this.fromAddress = properties.dispatch().fromAddress();
    }

    @Override
    public TransportResult send(String recipientEmail,
                                String subject,
                                String htmlBody,
                                byte[] attachmentBytes,
                                String attachmentFilename) {
        JavaMailSender sender = mailSender.getIfAvailable();
        if (sender == null) {
            return TransportResult.failed(NOT_CONFIGURED);
        }
        if (fromAddress == null || fromAddress.isBlank()) {
            return TransportResult.failed("Sender address is not configured: set cu.dispatch.from-address.");
        }
        try {
            MimeMessage message = sender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, StandardCharsets.UTF_8.name());
            helper.setFrom(fromAddress);
            helper.setTo(recipientEmail);
            helper.setSubject(subject);
            helper.setText(htmlBody, true);
            helper.addAttachment(attachmentFilename, new ByteArrayResource(attachmentBytes), "application/pdf");
            sender.send(message);
            return TransportResult.sent();
        } catch (MessagingException | MailException ex) {
            log.debug("SMTP send failed", ex);
            return TransportResult.failed(reasonOf(ex));
        }
    }

    @Override
    public TransportResult checkConnection() {
        JavaMailSender sender = mailSender.getIfAvailable();
        if (sender == null) {
            return TransportResult.failed(NOT_CONFIGURED);
        }
        if (!(sender instanceof JavaMailSenderImpl impl)) {
            return TransportResult.failed("The configured mail sender does not support connection checks.");
        }
        try {
            impl.testConnection();
            log.info("SMTP connection to {}:{} succeeded", impl.getHost(), impl.getPort());
            return TransportResult.sent();
        } catch (MessagingException ex) {
            log.warn("SMTP connection to {}:{} failed: {}", impl.getHost(), impl.getPort(), ex.getMessage());
            return TransportResult.failed(reasonOf(ex));
        }
    }

    private static String reasonOf(Exception ex) {
        Throwable cause = ex;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        String message = cause.getMessage() != null ? cause.getMessage() : ex.getMessage();
        return message != null && !message.isBlank() ? message.strip() : ex.getClass().getSimpleName();
    }
}
