package com.fabtrack.api.project.dto;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

public record UpdateProjectRequest(
    LocalDate drawingDate,
    String projectNo,
    String customer,
    String poPayment,
    LocalDate requestedDelivery,
    String remark,
    String projectName,
    String salesman
) {
  public Map<String, Object> changedColumns() {
    Map<String, Object> m = new LinkedHashMap<>();
    if (drawingDate != null) m.put("drawing_date", drawingDate);
    if (projectNo != null) m.put("project_no", projectNo);
    if (customer != null) m.put("customer", customer);
    if (poPayment != null) m.put("po_payment", poPayment);
    if (requestedDelivery != null) m.put("requested_delivery", requestedDelivery);
    if (remark != null) m.put("remark", remark);
    if (projectName != null) m.put("project_name", projectName);
    if (salesman != null) m.put("salesman", salesman);
    return m;
  }
}
