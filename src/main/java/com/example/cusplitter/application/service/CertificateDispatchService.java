package com.example.cusplitter.application.service;

import com.example.cusplitter.application.exception.UseCaseValidationException;
import com.example.cusplitter.application.port.CertificateDocumentExporter;
import com.example.cusplitter.application.port.MailTransport;
import com.example.cusplitter.application.port.TransportResult;
import com.example.cusplitter.config.CuSplitterProperties;
import com.example.cusplitter.domain.model.DeliveryKey;
import com.example.cusplitter.domain.model.DeliveryLog;
import com.example.cusplitter.domain.model.DeliveryOutcome;
import com.example.cusplitter.domain.model.DeliveryRequest;
import com.example.cusplitter.domain.model.DeliveryStatus;
import com.example.cusplitter.domain.model.MatchDecision;
import com.example.cusplitter.domain.model.MatchStatus;
import com.example.cusplitter.domain.model.MessageTemplate;
import com.example.cusplitter.domain.model.ReconciliationResult;
import com.example.cusplitter.domain.model.RosterEntry;
import com.example.cusplitter.domain.support.CertificateFileNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.regex.Pattern;

/**
 * Sends confirmed certificates to their recipients and keeps the per-pair audit log.
 * <p>
 * A batch re-run with the previous log never sends a pair that log already marks as sent, so an
 * interrupted or partially failed batch can simply be started again.
 */
@Service
public class CertificateDispatchService {

    private static final Logger log = LoggerFactory.getLogger(CertificateDispatchService.class);
    private static final Pattern EMAIL = Pattern.compile("[^@\\s]+@[^@\\s]+\\.[^@\\s]+");

    private final MailTransport mailTransport;
    private final CuSplitterProperties.Dispatch settings;
    private final Clock clock;

    public CertificateDispatchService(MailTransport mailTransport, CuSplitterProperties properties, Clock clock) {
        this.mailTransport = mailTransport;
        this.settings = properties.dispatch();
        this.clock = clock;
    }

    /**
     * Builds the message template of a batch: the operator's text first, then the configured
     * defaults, then the built-in Italian wording.
     *
     * @param subject subject typed by the operator, may be blank
     * @param body    HTML body typed by the operator, may be blank
     * @return template to render per certificate
     */
    public MessageTemplate templateFor(String subject, String body) {
        return new MessageTemplate(
                subject != null && !subject.isBlank() ? subject : settings.subject(),
                body != null && !body.isBlank() ? body : settings.body());
    }

    /**
     * @return whether the mail server accepts the configured connection
     */
    public TransportResult checkConnection() {
        return mailTransport.checkConnection();
    }

    /**
     * Turns a reconciliation into the pairs eligible for sending.
     * Exact and fuzzy matches qualify as they are; ambiguous ones only when the operator picked a
     * candidate, either already recorded on the decision or passed in {@code resolutions}.
     * An operator-typed address in {@code emails} fills in a matched recipient the roster has no
     * email for, or sends an unmatched certificate to a recipient the operator confirmed.
     *
     * @param result      reconciliation of the current document
     * @param resolutions certificate sequence to the chosen candidate's fiscal code or email
     * @param emails      certificate sequence to an operator-typed recipient address
     * @return requests in document order
     * @throws UseCaseValidationException when a resolution or address points to an unknown
     *                                    certificate, does not fit its decision, or is malformed
     */
    public List<DeliveryRequest> planDeliveries(ReconciliationResult result,
                                                Map<Integer, String> resolutions,
                                                Map<Integer, String> emails) {
        Map<Integer, String> choices = resolutions == null ? Map.of() : resolutions;
        Map<Integer, String> typedEmails = emails == null ? Map.of() : emails;
        validateResolutions(result, choices);
        validateEmails(result, typedEmails);

        List<DeliveryRequest> requests = new ArrayList<>();
        for (MatchDecision decision : result.decisions()) {
            if (decision.record() == null) {
                continue;
            }
            int sequence = decision.record().sequence();
            MatchDecision effective = decision;
            String choice = choices.get(sequence);
            if (choice != null) {
                effective = decision.withOperatorChoice(findAlternative(decision, choice));
            }
            String typedEmail = typedEmails.get(sequence);
            if (effective.status() == MatchStatus.UNMATCHED) {
                if (typedEmail != null) {
                    log.info("Certificate {} has no roster match; sending to the operator-confirmed address", sequence);
                    requests.add(new DeliveryRequest(effective.record(), typedEmail));
                }
                continue;
            }
            if (!effective.isDispatchable()) {
                if (typedEmail != null) {
                    throw new UseCaseValidationException("Certificate " + sequence
                            + " must be resolved to a roster entry before an email can be given for it.");
                }
                continue;
            }
            RosterEntry recipient = effective.candidate();
            if (recipient.hasEmail()) {
                if (typedEmail != null) {
                    throw new UseCaseValidationException("Certificate " + sequence
                            + " already goes to " + recipient.email() + " from the roster.");
                }
                requests.add(new DeliveryRequest(effective.record(), recipient.email()));
            } else if (typedEmail != null) {
                requests.add(new DeliveryRequest(effective.record(), typedEmail));
            } else {
                log.warn("Certificate {} matched '{}' but the roster has no email for it; skipping",
                        sequence, recipient.fullName());
            }
        }
        log.info("Planned {} delivery(ies) out of {} certificate(s)", requests.size(),
                result.decisions().stream().filter(decision -> decision.record() != null).count());
        return requests;
    }

    private void validateResolutions(ReconciliationResult result, Map<Integer, String> choices) {
        choices.forEach((sequence, choice) -> {
            MatchDecision decision = result.decisionFor(sequence)
                    .orElseThrow(() -> new UseCaseValidationException("Certificate " + sequence + " does not exist."));
            if (decision.status() != MatchStatus.AMBIGUOUS) {
                throw new UseCaseValidationException("Certificate " + sequence + " is not waiting for a manual choice.");
            }
            if (choice == null || choice.isBlank()) {
                throw new UseCaseValidationException("Certificate " + sequence + " needs a fiscal code or email to resolve it.");
            }
        });
    }

    private void validateEmails(ReconciliationResult result, Map<Integer, String> emails) {
        emails.forEach((sequence, email) -> {
            if (result.decisionFor(sequence).isEmpty()) {
                throw new UseCaseValidationException("Certificate " + sequence + " does not exist.");
            }
            if (email == null || !EMAIL.matcher(email.strip()).matches()) {
                throw new UseCaseValidationException("'" + email + "' is not a valid email address for certificate " + sequence + ".");
            }
        });
    }

    private RosterEntry findAlternative(MatchDecision decision, String choice) {
        String wanted = choice.strip();
        return decision.alternatives().stream()
                .filter(entry -> wanted.equalsIgnoreCase(entry.fiscalCode()) || wanted.equalsIgnoreCase(entry.email()))
                .findFirst()
                .orElseThrow(() -> new UseCaseValidationException(
                        "'" + wanted + "' is not a candidate for certificate " + decision.record().sequence() + "."));
    }

    /**
     * Runs one dispatch batch and waits for every worker to finish.
     *
     * @param requests     confirmed pairs
     * @param exporter     produces the attachment of each certificate
     * @param template     subject and body templates
     * @param previousLog  log of an earlier batch on the same document, may be {@code null}
     * @param cancellation stop signal; pairs not started when it fires stay {@link DeliveryStatus#PENDING}
     * @return log with exactly one outcome per distinct pair
     */
    public DeliveryLog dispatch(List<DeliveryRequest> requests,
                                CertificateDocumentExporter exporter,
                                MessageTemplate template,
                                DeliveryLog previousLog,
                                DispatchCancellation cancellation) {
        DeliveryLog previous = previousLog == null ? DeliveryLog.empty() : previousLog;
        MessageTemplate messageTemplate = template == null ? MessageTemplate.defaults() : template;
        DispatchCancellation stopSignal = cancellation == null ? new DispatchCancellation() : cancellation;

        DeliveryLog deliveryLog = DeliveryLog.empty();
        List<SendJob> jobs = new ArrayList<>();
        Set<DeliveryKey> seen = new HashSet<>();
        int alreadySent = 0;
        for (DeliveryRequest request : requests) {
            DeliveryKey key = request.key();
            if (!seen.add(key)) {
                log.warn("Ignoring duplicated delivery of certificate {} to the same recipient", request.record().sequence());
                continue;
            }
            Optional<DeliveryOutcome> earlier = previous.find(key);
            if (earlier.isPresent() && earlier.get().getStatus() == DeliveryStatus.SENT) {
                deliveryLog.record(earlier.get());
                alreadySent++;
                continue;
            }
            DeliveryOutcome outcome = DeliveryOutcome.pending(request, CertificateFileNames.fileNameFor(request.record()), Instant.now(clock));
            deliveryLog.record(outcome);
            jobs.add(new SendJob(request, outcome));
        }

        if (alreadySent > 0) {
            log.info("{} delivery(ies) were already sent by a previous batch and are skipped", alreadySent);
        }
        if (!jobs.isEmpty()) {
            runJobs(jobs, exporter, messageTemplate, stopSignal);
        }

        Map<DeliveryStatus, Long> counts = deliveryLog.getCounts();
        log.info("Dispatch finished: sent={}, failed={}, not attempted={}",
                counts.get(DeliveryStatus.SENT), counts.get(DeliveryStatus.FAILED), counts.get(DeliveryStatus.PENDING));
        return deliveryLog;
    }

    private void runJobs(List<SendJob> jobs,
                         CertificateDocumentExporter exporter,
                         MessageTemplate template,
                         DispatchCancellation cancellation) {
        ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(settings.concurrency(), jobs.size()), new CustomizableThreadFactory("cu-dispatch-"));
        try {
            CompletableFuture<?>[] futures = jobs.stream()
                    .map(job -> CompletableFuture.runAsync(() -> send(job, exporter, template, cancellation), executor))
                    .toArray(CompletableFuture[]::new);
            CompletableFuture.allOf(futures).join();
        } catch (CompletionException ex) {
            // the failing pair is already marked; the outcomes of the others are kept
            log.error("A dispatch worker stopped abnormally", ex.getCause());
        } finally {
            executor.shutdown();
        }
    }

    private void send(SendJob job, CertificateDocumentExporter exporter, MessageTemplate template, DispatchCancellation cancellation) {
        if (cancellation.isCancelled()) {
            return;
        }
        DeliveryRequest request = job.request();
        DeliveryOutcome outcome = job.outcome();
        String subject = template.renderSubject(request.record());
        try {
            byte[] attachment = exporter.export(request.record());
            TransportResult result = mailTransport.send(
                    request.recipientEmail(),
                    subject,
                    template.renderBody(request.record()),
                    attachment,
                    outcome.getAttachmentFilename());
            if (result != null && result.success()) {
                outcome.markSent(subject, Instant.now(clock));
                log.debug("Certificate {} sent", request.record().sequence());
            } else {
                String reason = result != null ? result.failureReason() : "The mail transport gave no answer";
                outcome.markFailed(subject, reason, Instant.now(clock));
                log.warn("Certificate {} was not sent: {}", request.record().sequence(), reason);
            }
        } catch (RuntimeException ex) {
            outcome.markFailed(subject, describe(ex), Instant.now(clock));
            log.warn("Certificate {} was not sent", request.record().sequence(), ex);
        } catch (Error err) {
            outcome.markFailed(subject, describe(err), Instant.now(clock));
            throw err;
        }
    }

    private static String describe(Throwable ex) {
        return ex.getMessage() != null && !ex.getMessage().isBlank() ? ex.getMessage() : ex.getClass().getSimpleName();
    }

    private record SendJob(DeliveryRequest request, DeliveryOutcome outcome) {
    }
}
