package com.fabtrack.api.ledger.dto;

import com.fabtrack.api.ledger.SignatureCodec;
import com.fasterxml.jackson.annotation.JsonAlias;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

public record UpdateJobRequest(
    @JsonAlias("Date_Entry") LocalDate dateEntry,
    @JsonAlias("Customer_Name") String customerName,
    @JsonAlias("Sales_Amount") BigDecimal salesAmount,
    @JsonAlias("Sell_Price") BigDecimal sellPrice,
    @JsonAlias("Cost") BigDecimal cost,
    @JsonAlias("Margin") BigDecimal margin,
    @JsonAlias("Approval_Status") String approvalStatus,
    @JsonAlias("Remarks") String remarks,
    @JsonAlias("Signature_Data") String signatureData
) {

  /** Blank customer name, remarks or signature clear the stored value. */
  public Map<String, Object> changedColumns() {
    Map<String, Object> m = new LinkedHashMap<>();
    if (dateEntry != null) m.put("date_entry", dateEntry);
    if (customerName != null) m.put("customer_name", customerName.isBlank() ? null : customerName);
    if (salesAmount != null) m.put("sales_amount", salesAmount);
    if (sellPrice != null) m.put("sell_price", sellPrice);
    if (cost != null) m.put("cost", cost);
    if (margin != null) m.put("margin", margin);
    if (approvalStatus != null) m.put("approval_status", approvalStatus);
    if (remarks != null) m.put("remarks", remarks.isBlank() ? null : remarks);
    if (signatureData != null) m.put("signature_data", SignatureCodec.decode(signatureData));
    return m;
  }
}
