package com.fabtrack.api.ledger.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.time.LocalDate;

/** Accepts camelCase and the column-style names ({@code Job_No}, {@code Sales_Amount}, ...). */
public record CreateJobRequest(
    @NotNull(message = "dateEntry is required") @JsonAlias("Date_Entry") LocalDate dateEntry,
    @NotBlank(message = "jobNo is required") @JsonAlias("Job_No") String jobNo,
    @JsonAlias("Customer_Name") String customerName,
    @NotNull(message = "salesAmount is required") @JsonAlias("Sales_Amount") BigDecimal salesAmount,
    @NotNull(message = "sellPrice is required") @JsonAlias("Sell_Price") BigDecimal sellPrice,
    @NotNull(message = "cost is required") @JsonAlias("Cost") BigDecimal cost,
    @JsonAlias("Margin") BigDecimal margin,
    @JsonAlias("Approval_Status") String approvalStatus,
    @JsonAlias("Remarks") String remarks,
    @JsonAlias("Signature_Data") String signatureData
) {

  public String approvalStatusOrDefault() {
    return approvalStatus == null || approvalStatus.isBlank() ? "Pending" : approvalStatus;
  }
}
