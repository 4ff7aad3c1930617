package com.example.cusplitter.interfaces.api;

import com.example.cusplitter.domain.model.DeliveryLog;
import com.example.cusplitter.domain.model.DeliveryOutcome;
import com.example.cusplitter.domain.model.DeliveryStatus;

import java.util.List;
import java.util.Map;

/**
 * Delivery log of the latest batch returned to the operator.
 */
public record DeliveryLogResponse(List<DeliveryOutcome> outcomes, Map<DeliveryStatus, Long> counts) {

    static DeliveryLogResponse of(DeliveryLog deliveryLog) {
        return new DeliveryLogResponse(deliveryLog.getOutcomes(), deliveryLog.getCounts());
    }
}
