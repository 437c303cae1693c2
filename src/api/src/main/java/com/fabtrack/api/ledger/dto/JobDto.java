package com.fabtrack.api.ledger.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record JobDto(
    long recordId,
    LocalDate dateEntry,
    String jobNo,
    String customerName,
    BigDecimal salesAmount,
    BigDecimal sellPrice,
    BigDecimal cost,
    BigDecimal margin,
    String approvalStatus,
    String remarks,
    String signatureData
) {
}
