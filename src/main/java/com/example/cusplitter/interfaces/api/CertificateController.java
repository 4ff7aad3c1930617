package com.example.cusplitter.interfaces.api;

import com.example.cusplitter.application.port.CertificateDocumentExporter;
import com.example.cusplitter.application.port.TransportResult;
import com.example.cusplitter.application.service.CertificateDispatchService;
import com.example.cusplitter.application.service.CertificateExportService;
import com.example.cusplitter.application.service.CertificateReconciliationService;
import com.example.cusplitter.application.service.CertificateSplitService;
import com.example.cusplitter.application.service.DispatchCancellation;
import com.example.cusplitter.application.service.ReportCsvService;
import com.example.cusplitter.domain.model.DeliveryLog;
import com.example.cusplitter.domain.model.DeliveryRequest;
import com.example.cusplitter.domain.model.MessageTemplate;
import com.example.cusplitter.domain.model.ReconciliationResult;
import com.example.cusplitter.domain.model.Roster;
import com.example.cusplitter.domain.model.SplitResult;
import com.example.cusplitter.infrastructure.csv.RosterCsvReader;
import com.example.cusplitter.infrastructure.exception.PdfProcessingException;
import com.example.cusplitter.infrastructure.pdf.PdfBoxCertificateExporterFactory;
import jakarta.servlet.http.HttpSession;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * JSON API driving the split, reconcile and dispatch workflow of one operator session.
 */
@RestController
@RequestMapping("/api")
public class CertificateController {

    static final String SESSION_WORKSPACE_KEY = "CU_WORKSPACE";
    private static final MediaType CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final CertificateSplitService splitService;
    private final CertificateExportService exportService;
    private final CertificateReconciliationService reconciliationService;
    private final CertificateDispatchService dispatchService;
    private final ReportCsvService reportCsvService;
    private final RosterCsvReader rosterCsvReader;
    private final PdfBoxCertificateExporterFactory exporterFactory;

    public CertificateController(CertificateSplitService splitService,
                                 CertificateExportService exportService,
                                 CertificateReconciliationService reconciliationService,
                                 CertificateDispatchService dispatchService,
                                 ReportCsvService reportCsvService,
                                 RosterCsvReader rosterCsvReader,
                                 PdfBoxCertificateExporterFactory exporterFactory) {
        this.splitService = splitService;
        this.exportService = exportService;
        this.reconciliationService = reconciliationService;
        this.dispatchService = dispatchService;
        this.reportCsvService = reportCsvService;
        this.rosterCsvReader = rosterCsvReader;
        this.exporterFactory = exporterFactory;
    }

    /**
     * Splits the uploaded bulk PDF and keeps it in the session for the next steps.
     *
     * @param file    uploaded PDF
     * @param session HTTP session holding the workspace
     * @return certificates found and warnings
     */
    @PostMapping(value = "/certificates/split", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SplitResult> split(@RequestParam(value = "file", required = false) MultipartFile file,
                                             HttpSession session) {
        SplitResult result = splitService.split(file);
        workspace(session).loadDocument(readBytes(file), result);
        return ResponseEntity.ok(result);
    }

    @GetMapping(value = "/certificates", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SplitResult> certificates(HttpSession session) {
        return ResponseEntity.ok(workspace(session).requireSplit());
    }

    @GetMapping("/certificates/archive")
    public ResponseEntity<byte[]> archive(HttpSession session) {
        CertificateWorkspace workspace = workspace(session);
        CertificateExportService.ExportedFile archive = exportService.exportAll(
                workspace.requireSplit().records(), exporter(workspace));
        return download(archive.fileName(), MediaType.parseMediaType("application/zip"), archive.content());
    }

    @GetMapping("/certificates/{sequence}/pdf")
    public ResponseEntity<byte[]> certificatePdf(@PathVariable int sequence, HttpSession session) {
        CertificateWorkspace workspace = workspace(session);
        CertificateExportService.ExportedFile pdf = exportService.exportOne(
                workspace.requireSplit().records(), sequence, exporter(workspace));
        return download(pdf.fileName(), MediaType.APPLICATION_PDF, pdf.content());
    }

    /**
     * Loads the roster and reconciles it with the certificates of the current document.
     *
     * @param file    roster CSV
     * @param session HTTP session holding the workspace
     * @return match table with counts per status
     */
    @PostMapping(value = "/reconciliation", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ReconciliationResponse> reconcile(@RequestParam(value = "file", required = false) MultipartFile file,
                                                            HttpSession session) {
        CertificateWorkspace workspace = workspace(session);
        SplitResult split = workspace.requireSplit();
        Roster roster = rosterCsvReader.read(file);
        ReconciliationResult result = reconciliationService.reconcile(split.records(), roster);
        workspace.storeReconciliation(result);
        return ResponseEntity.ok(ReconciliationResponse.of(result));
    }

    @GetMapping(value = "/reconciliation", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ReconciliationResponse> reconciliation(HttpSession session) {
        return ResponseEntity.ok(ReconciliationResponse.of(workspace(session).requireReconciliation()));
    }

    @GetMapping("/reconciliation/export")
    public ResponseEntity<byte[]> exportReconciliation(HttpSession session) {
        String csv = reportCsvService.exportMatchTable(workspace(session).getReconciliation());
        return download("cu-match-table.csv", CSV, csv.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Sends every dispatchable certificate and waits for the batch to finish. Pairs already sent
     * by an earlier batch of the same document are not sent again.
     *
     * @param request optional subject, body, manual choices for ambiguous certificates and typed emails
     * @param session HTTP session holding the workspace
     * @return delivery log of the batch
     */
    @PostMapping(value = "/deliveries", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DeliveryLogResponse> dispatch(@RequestBody(required = false) DispatchCommand request,
                                                        HttpSession session) {
        DispatchCommand command = request != null ? request : new DispatchCommand(null, null, null, null);
        CertificateWorkspace workspace = workspace(session);
        ReconciliationResult reconciliation = workspace.requireReconciliation();
        List<DeliveryRequest> requests = dispatchService.planDeliveries(reconciliation, command.resolutions(), command.emails());
        MessageTemplate template = dispatchService.templateFor(command.subject(), command.body());
        CertificateDocumentExporter exporter = exporter(workspace);

        DispatchCancellation cancellation = workspace.startDispatch();
        DeliveryLog deliveryLog = null;
        try {
            deliveryLog = dispatchService.dispatch(requests, exporter, template, workspace.getDeliveryLog(), cancellation);
        } finally {
            workspace.finishDispatch(deliveryLog);
        }
        return ResponseEntity.ok(DeliveryLogResponse.of(deliveryLog));
    }

    @PostMapping(value = "/deliveries/cancel", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Boolean>> cancel(HttpSession session) {
        return ResponseEntity.ok(Map.of("cancelled", workspace(session).cancelDispatch()));
    }

    @GetMapping(value = "/deliveries", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DeliveryLogResponse> deliveries(HttpSession session) {
        DeliveryLog deliveryLog = workspace(session).getDeliveryLog();
        return ResponseEntity.ok(DeliveryLogResponse.of(deliveryLog != null ? deliveryLog : DeliveryLog.empty()));
    }

    @GetMapping("/deliveries/export")
    public ResponseEntity<byte[]> exportDeliveries(HttpSession session) {
        String csv = reportCsvService.exportDeliveryLog(workspace(session).getDeliveryLog());
        return download("cu-delivery-log.csv", CSV, csv.getBytes(StandardCharsets.UTF_8));
    }

    @GetMapping(value = "/deliveries/smtp-check", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<TransportResult> smtpCheck() {
        return ResponseEntity.ok(dispatchService.checkConnection());
    }

    private CertificateDocumentExporter exporter(CertificateWorkspace workspace) {
        return exporterFactory.exporterFor(workspace.requireSourcePdf());
    }

    private static CertificateWorkspace workspace(HttpSession session) {
        synchronized (session) {
            Object cached = session.getAttribute(SESSION_WORKSPACE_KEY);
            if (cached instanceof CertificateWorkspace workspace) {
                return workspace;
            }
            CertificateWorkspace workspace = new CertificateWorkspace();
            session.setAttribute(SESSION_WORKSPACE_KEY, workspace);
            return workspace;
        }
    }

    private static byte[] readBytes(MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to process the uploaded PDF file.", e);
        }
    }

    private static ResponseEntity<byte[]> download(String fileName, MediaType type, byte[] content) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(fileName, StandardCharsets.UTF_8).build().toString())
                .contentType(type)
                .body(content);
    }
}
