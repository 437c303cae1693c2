package com.fabtrack.api.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;

public record NewJob(
    LocalDate dateEntry,
    String jobNo,
    String customerName,
    BigDecimal salesAmount,
    BigDecimal sellPrice,
    BigDecimal cost,
    BigDecimal margin,
    String approvalStatus,
    String remarks,
    byte[] signature
) {
}
