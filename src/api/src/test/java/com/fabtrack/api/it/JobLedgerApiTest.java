package com.fabtrack.api.it;

import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

import java.util.Base64;
import java.util.UUID;

import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class JobLedgerApiTest extends IntegrationTestBase {

  private static final String SIGNATURE =
      "data:image/png;base64," + Base64.getEncoder().encodeToString(new byte[] {(byte) 0x89, 'P', 'N', 'G', 1, 2, 3});

  @Test
  void jobLifecycle() throws Exception {
    String jobNo = "JOB-" + UUID.randomUUID().toString().substring(0, 8);

    mvc.perform(post("/api/admin/projects")
            .contentType(MediaType.APPLICATION_JSON)
            .content("""
                {"Date_Entry":"2025-03-01","Job_No":"%s","Customer_Name":"Polar Foods",
                 "Sales_Amount":5000,"Sell_Price":4800,"Cost":3100,"Margin":1700,
                 "Signature_Data":"%s"}
                """.formatted(jobNo, SIGNATURE)))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.jobNo").value(jobNo))
        .andExpect(jsonPath("$.approvalStatus").value("Pending"))
        .andExpect(jsonPath("$.signatureData").value(SIGNATURE));

    mvc.perform(post("/api/admin/projects")
            .contentType(MediaType.APPLICATION_JSON)
            .content("""
                {"dateEntry":"2025-03-01","jobNo":"%s","salesAmount":1,"sellPrice":1,"cost":1}
                """.formatted(jobNo)))
        .andExpect(status().isConflict());

    mvc.perform(put("/api/admin/projects/" + jobNo)
            .contentType(MediaType.APPLICATION_JSON)
            .content("""
                {"approvalStatus":"Approved","remarks":"checked","signatureData":""}
                """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.approvalStatus").value("Approved"))
        .andExpect(jsonPath("$.remarks").value("checked"))
        .andExpect(jsonPath("$.signatureData").value(nullValue()));

    mvc.perform(get("/api/admin/projects/" + jobNo))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.customerName").value("Polar Foods"));

    mvc.perform(delete("/api/admin/projects/" + jobNo))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message").value("Job " + jobNo + " deleted successfully"));
    mvc.perform(get("/api/admin/projects/" + jobNo)).andExpect(status().isNotFound());
    mvc.perform(delete("/api/admin/projects/" + jobNo)).andExpect(status().isNotFound());
  }

  @Test
  void badSignatureAndEmptyUpdateAre422() throws Exception {
    String jobNo = "JOB-" + UUID.randomUUID().toString().substring(0, 8);
    mvc.perform(post("/api/admin/projects")
            .contentType(MediaType.APPLICATION_JSON)
            .content("""
                {"dateEntry":"2025-03-01","jobNo":"%s","salesAmount":1,"sellPrice":1,"cost":1,
                 "signatureData":"not-a-data-url"}
                """.formatted(jobNo)))
        .andExpect(status().isUnprocessableEntity());

    mvc.perform(post("/api/admin/projects")
            .contentType(MediaType.APPLICATION_JSON)
            .content("""
                {"dateEntry":"2025-03-01","jobNo":"%s","salesAmount":1,"sellPrice":1,"cost":1}
                """.formatted(jobNo)))
        .andExpect(status().isCreated());

    mvc.perform(put("/api/admin/projects/" + jobNo)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{}"))
        .andExpect(status().isUnprocessableEntity());
    mvc.perform(put("/api/admin/projects/NOPE-" + jobNo)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"remarks\":\"x\"}"))
        .andExpect(status().isNotFound());
  }
}
