package com.example.cusplitter.interfaces.api;

import com.example.cusplitter.application.exception.DispatchInProgressException;
import com.example.cusplitter.application.exception.WorkspaceStateException;
import com.example.cusplitter.application.service.DispatchCancellation;
import com.example.cusplitter.domain.model.DeliveryLog;
import com.example.cusplitter.domain.model.ReconciliationResult;
import com.example.cusplitter.domain.model.SplitResult;

/**
 * Per-session state of the operator: the uploaded document, its certificates, the latest
 * reconciliation and the delivery log. Loading a new document discards everything derived from
 * the previous one.
 */
public class CertificateWorkspace {

    private byte[] sourcePdf;
    private SplitResult splitResult;
    private ReconciliationResult reconciliation;
    private DeliveryLog deliveryLog;
    private DispatchCancellation runningDispatch;

    public synchronized void loadDocument(byte[] pdf, SplitResult result) {
        if (runningDispatch != null) {
            throw new DispatchInProgressException();
        }
        this.sourcePdf = pdf;
        this.splitResult = result;
        this.reconciliation = null;
        this.deliveryLog = null;
    }

    public synchronized byte[] requireSourcePdf() {
        requireSplit();
        return sourcePdf;
    }

    public synchronized SplitResult requireSplit() {
        if (splitResult == null) {
            throw new WorkspaceStateException("Upload the certificates PDF first.");
        }
        return splitResult;
    }

    public synchronized void storeReconciliation(ReconciliationResult result) {
        if (runningDispatch != null) {
            throw new DispatchInProgressException();
        }
        this.reconciliation = result;
    }

    public synchronized ReconciliationResult requireReconciliation() {
        if (reconciliation == null) {
            throw new WorkspaceStateException("Upload the roster and reconcile the certificates first.");
        }
        return reconciliation;
    }

    public synchronized ReconciliationResult getReconciliation() {
        return reconciliation;
    }

    public synchronized DeliveryLog getDeliveryLog() {
        return deliveryLog;
    }

    /**
     * Marks a batch as running; only one batch per workspace may run at a time.
     *
     * @return stop signal of the new batch
     */
    public synchronized DispatchCancellation startDispatch() {
        if (runningDispatch != null) {
            throw new DispatchInProgressException();
        }
        runningDispatch = new DispatchCancellation();
        return runningDispatch;
    }

    public synchronized void finishDispatch(DeliveryLog log) {
        if (log != null) {
            this.deliveryLog = log;
        }
        this.runningDispatch = null;
    }

    /**
     * @return {@code true} when a running batch was asked to stop
     */
    public synchronized boolean cancelDispatch() {
        if (runningDispatch == null) {
            return false;
        }
        runningDispatch.cancel();
        return true;
    }
}
