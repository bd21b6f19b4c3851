package com.purchasingpower.bookflow.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.Data;

@Data
public class PaymentProperties {

    /** Probability that the simulated processor approves a payment. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double approvalProbability = 0.85;
}
