package com.purchasingpower.bookflow.flow;

import com.purchasingpower.bookflow.configuration.BookFlowProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Stands in for a payment processor: approves with a fixed probability.
 */
@Component
public class PaymentSimulator {

    private final double approvalProbability;
    private final DoubleSupplier random;

    @Autowired
    public PaymentSimulator(BookFlowProperties properties) {
        this(properties.getPayment().getApprovalProbability(), () -> ThreadLocalRandom.current().nextDouble());
    }

    public PaymentSimulator(double approvalProbability, DoubleSupplier random) {
        this.approvalProbability = approvalProbability;
        this.random = random;
    }

    public boolean approve() {
        return random.getAsDouble() < approvalProbability;
    }
}
