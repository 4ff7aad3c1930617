package com.example.cusplitter.interfaces.api;

import com.example.cusplitter.application.exception.ReportExportValidationException;
import com.example.cusplitter.application.port.TransportResult;
import com.example.cusplitter.application.service.CertificateDispatchService;
import com.example.cusplitter.application.service.CertificateExportService;
import com.example.cusplitter.application.service.CertificateReconciliationService;
import com.example.cusplitter.application.service.CertificateSplitService;
import com.example.cusplitter.application.service.ReportCsvService;
import com.example.cusplitter.domain.exception.DuplicateFiscalCodeException;
import com.example.cusplitter.domain.exception.PdfFileRequiredException;
import com.example.cusplitter.domain.model.CertificateRecord;
import com.example.cusplitter.domain.model.DeliveryLog;
import com.example.cusplitter.domain.model.DeliveryOutcome;
import com.example.cusplitter.domain.model.DeliveryRequest;
import com.example.cusplitter.domain.model.MatchDecision;
import com.example.cusplitter.domain.model.MessageTemplate;
import com.example.cusplitter.domain.model.ReconciliationResult;
import com.example.cusplitter.domain.model.Roster;
import com.example.cusplitter.domain.model.RosterEntry;
import com.example.cusplitter.domain.model.SplitResult;
import com.example.cusplitter.infrastructure.csv.RosterCsvReader;
import com.example.cusplitter.infrastructure.exception.PdfProcessingException;
import com.example.cusplitter.infrastructure.pdf.PdfBoxCertificateExporterFactory;
import com.example.cusplitter.interfaces.api.error.GlobalExceptionHandler;
import org.junit.jupiter.api.Test;
import org.mockito.BDDMockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.multipart.MultipartFile;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.isNull;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * WebMvc tests that validate the controller workflow and its exception-handler integration.
 */
@WebMvcTest(controllers = CertificateController.class)
@Import(GlobalExceptionHandler.class)
class CertificateControllerApiTests {

    private static final CertificateRecord ROSSI =
            new CertificateRecord(1, 0, 1, "raw page text", "ROSSI", "MARIO", "RSSMRA80A01H501U", 2024);
    private static final RosterEntry MARIO = RosterEntry.of("Rossi", "Mario", "RSSMRA80A01H501U", "mario.rossi@email.it");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CertificateSplitService splitService;

    @MockBean
    private CertificateExportService exportService;

    @MockBean
    private CertificateReconciliationService reconciliationService;

    @MockBean
    private CertificateDispatchService dispatchService;

    @MockBean
    private ReportCsvService reportCsvService;

    @MockBean
    private RosterCsvReader rosterCsvReader;

    @MockBean
    private PdfBoxCertificateExporterFactory exporterFactory;

    /**
     * Verifies that the split result is returned without the raw certificate text.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void splitReturnsCertificates() throws Exception {
        BDDMockito.given(splitService.split(any(MultipartFile.class))).willReturn(splitResult());

        mockMvc.perform(multipart("/api/certificates/split").file(pdfFile()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pageCount").value(2))
                .andExpect(jsonPath("$.records[0].surname").value("ROSSI"))
                .andExpect(jsonPath("$.records[0].fiscalCode").value("RSSMRA80A01H501U"))
                .andExpect(jsonPath("$.records[0].rawText").doesNotExist());
    }

    /**
     * Verifies that domain errors translate to HTTP 400 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void domainExceptionMappedToBadRequest() throws Exception {
        BDDMockito.given(splitService.split(any(MultipartFile.class))).willThrow(new PdfFileRequiredException());

        mockMvc.perform(multipart("/api/certificates/split").file(pdfFile()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("DOMAIN_ERROR"));
    }

    /**
     * Verifies that infrastructure errors translate to HTTP 500 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void infrastructureExceptionMappedToServerError() throws Exception {
        BDDMockito.given(splitService.split(any(MultipartFile.class)))
                .willThrow(new PdfProcessingException("Unable", new RuntimeException("boom")));

        mockMvc.perform(multipart("/api/certificates/split").file(pdfFile()))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INFRASTRUCTURE_ERROR"));
    }

    /**
     * Verifies that steps run out of order are reported as conflicts.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void missingDocumentMappedToConflict() throws Exception {
        mockMvc.perform(get("/api/certificates"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("WORKSPACE_STATE_ERROR"));
    }

    @Test
    void reconciliationReturnsCountsPerStatus() throws Exception {
        MockHttpSession session = uploadedSession();
        Roster roster = Roster.of(List.of(MARIO));
        BDDMockito.given(rosterCsvReader.read(any(MultipartFile.class))).willReturn(roster);
        BDDMockito.given(reconciliationService.reconcile(anyList(), any(Roster.class)))
                .willReturn(new ReconciliationResult(List.of(MatchDecision.exact(ROSSI, MARIO))));

        mockMvc.perform(multipart("/api/reconciliation").file(rosterFile()).session(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.counts.EXACT").value(1))
                .andExpect(jsonPath("$.counts.AMBIGUOUS").value(0))
                .andExpect(jsonPath("$.decisions[0].candidate.email").value("mario.rossi@email.it"));

        mockMvc.perform(get("/api/reconciliation").session(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.decisions[0].status").value("EXACT"));
    }

    /**
     * Verifies that a roster with repeated fiscal codes is rejected with the offending codes.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void duplicateFiscalCodesMappedTo422() throws Exception {
        MockHttpSession session = uploadedSession();
        BDDMockito.given(rosterCsvReader.read(any(MultipartFile.class)))
                .willThrow(new DuplicateFiscalCodeException(Set.of("RSSMRA80A01H501U")));

        mockMvc.perform(multipart("/api/reconciliation").file(rosterFile()).session(session))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("DUPLICATE_FISCAL_CODE"))
                .andExpect(jsonPath("$.details.fiscalCodes[0]").value("RSSMRA80A01H501U"));
    }

    /**
     * Verifies that report export validation errors translate to HTTP 422 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void reportExportValidationExceptionMappedTo422() throws Exception {
        BDDMockito.given(reportCsvService.exportMatchTable(isNull()))
                .willThrow(new ReportExportValidationException("No reconciliation available for export."));

        mockMvc.perform(get("/api/reconciliation/export"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("REPORT_EXPORT_VALIDATION_ERROR"));
    }

    @Test
    void dispatchReturnsDeliveryLog() throws Exception {
        MockHttpSession session = uploadedSession();
        BDDMockito.given(rosterCsvReader.read(any(MultipartFile.class))).willReturn(Roster.of(List.of(MARIO)));
        BDDMockito.given(reconciliationService.reconcile(anyList(), any(Roster.class)))
                .willReturn(new ReconciliationResult(List.of(MatchDecision.exact(ROSSI, MARIO))));
        mockMvc.perform(multipart("/api/reconciliation").file(rosterFile()).session(session))
                .andExpect(status().isOk());

        DeliveryRequest request = new DeliveryRequest(ROSSI, "mario.rossi@email.it");
        DeliveryLog deliveryLog = DeliveryLog.empty();
        DeliveryOutcome outcome = DeliveryOutcome.pending(request, "CU2024_Rossi_Mario_RSSMRA80A01H501U.pdf",
                Instant.parse("2025-03-01T10:00:00Z"));
        outcome.markSent("Certificazione Unica 2024", Instant.parse("2025-03-01T10:00:01Z"));
        deliveryLog.record(outcome);
        BDDMockito.given(dispatchService.planDeliveries(any(ReconciliationResult.class), anyMap(), anyMap()))
                .willReturn(List.of(request));
        BDDMockito.given(dispatchService.templateFor(any(), any())).willReturn(MessageTemplate.defaults());
        BDDMockito.given(exporterFactory.exporterFor(any())).willReturn(record -> new byte[]{1});
        BDDMockito.given(dispatchService.dispatch(anyList(), any(), any(), isNull(), any())).willReturn(deliveryLog);

        mockMvc.perform(post("/api/deliveries").session(session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"subject\":\"CU {anno}\",\"resolutions\":{},\"emails\":{\"1\":\"mario.rossi@email.it\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.counts.SENT").value(1))
                .andExpect(jsonPath("$.outcomes[0].recipientEmail").value("mario.rossi@email.it"));

        mockMvc.perform(get("/api/deliveries").session(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcomes[0].status").value("SENT"));
    }

    @Test
    void cancelWithoutRunningBatchReportsFalse() throws Exception {
        mockMvc.perform(post("/api/deliveries/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cancelled").value(false));
    }

    @Test
    void smtpCheckReturnsTransportResult() throws Exception {
        BDDMockito.given(dispatchService.checkConnection()).willReturn(TransportResult.failed("Connection refused"));

        mockMvc.perform(get("/api/deliveries/smtp-check"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.failureReason").value("Connection refused"));
    }

    @Test
    void certificatePdfIsServedAsAttachment() throws Exception {
        MockHttpSession session = uploadedSession();
        BDDMockito.given(exporterFactory.exporterFor(any())).willReturn(record -> new byte[]{1});
        BDDMockito.given(exportService.exportOne(anyList(), BDDMockito.eq(1), any()))
                .willReturn(new CertificateExportService.ExportedFile("CU2024_Rossi_Mario.pdf", new byte[]{1}));

        mockMvc.perform(get("/api/certificates/1/pdf").session(session))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Type", "application/pdf"))
                .andExpect(header().string("Content-Disposition",
                        containsString("CU2024_Rossi_Mario.pdf")));
    }

    /**
     * @return session in which a bulk PDF has already been split
     * @throws Exception when the mock request fails
     */
    private MockHttpSession uploadedSession() throws Exception {
        MockHttpSession session = new MockHttpSession();
        BDDMockito.given(splitService.split(any(MultipartFile.class))).willReturn(splitResult());
        mockMvc.perform(multipart("/api/certificates/split").file(pdfFile()).session(session))
                .andExpect(status().isOk());
        return session;
    }

    private SplitResult splitResult() {
        return new SplitResult("cu-2024.pdf", 2, List.of(ROSSI), List.of(), null);
    }

    private MockMultipartFile pdfFile() {
        return new MockMultipartFile("file", "cu-2024.pdf", "application/pdf", "%PDF-1.7".getBytes());
    }

    private MockMultipartFile rosterFile() {
        return new MockMultipartFile("file", "roster.csv", "text/csv", "Cognome;Nome".getBytes());
    }
}
