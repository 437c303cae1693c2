package com.fabtrack.api.ledger;

import com.fabtrack.api.activity.ActivityLogService;
import com.fabtrack.api.activity.ActivityType;
import com.fabtrack.api.activity.ResourceType;
import com.fabtrack.api.infra.tx.TransactionalExecutor;
import com.fabtrack.api.ledger.dto.CreateJobRequest;
import com.fabtrack.api.ledger.dto.JobDto;
import com.fabtrack.api.ledger.dto.UpdateJobRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class JobLedgerService {

  private final JobLedgerRepository repo;
  private final ActivityLogService activityLog;
  private final TransactionalExecutor tx;

  public List<JobDto> list() {
    return repo.list();
  }

  public JobDto get(String jobNo) {
    return repo.findByJobNo(jobNo).orElseThrow(() -> new JobNotFoundException(jobNo));
  }

  public JobDto create(CreateJobRequest req) {
    String jobNo = req.jobNo().trim();
    NewJob job = new NewJob(
        req.dateEntry(),
        jobNo,
        blankToNull(req.customerName()),
        req.salesAmount(),
        req.sellPrice(),
        req.cost(),
        req.margin(),
        req.approvalStatusOrDefault(),
        blankToNull(req.remarks()),
        SignatureCodec.decode(req.signatureData())
    );
    return tx.execute(() -> {
      if (repo.exists(jobNo)) {
        throw new JobValidationException("Job with Job No " + jobNo + " already exists.", 409);
      }
      repo.insert(job);
      activityLog.record(ActivityType.CREATE, ResourceType.JOB, jobNo, "Created job " + jobNo,
          Map.of("jobNo", jobNo));
      log.info("Job created: jobNo={}", jobNo);
      return get(jobNo);
    });
  }

  public JobDto update(String jobNo, UpdateJobRequest req) {
    Map<String, Object> changes = req == null ? Map.of() : req.changedColumns();
    if (changes.isEmpty()) {
      throw new JobValidationException("No valid fields provided for update.", 422);
    }
    return tx.execute(() -> {
      if (repo.update(jobNo, changes) == 0) {
        throw new JobNotFoundException(jobNo);
      }
      activityLog.record(ActivityType.UPDATE, ResourceType.JOB, jobNo, "Updated job " + jobNo,
          Map.of("fieldsUpdated", List.copyOf(changes.keySet())));
      return get(jobNo);
    });
  }

  public void delete(String jobNo) {
    tx.run(() -> {
      if (repo.delete(jobNo) == 0) {
        throw new JobNotFoundException(jobNo);
      }
      activityLog.record(ActivityType.DELETE, ResourceType.JOB, jobNo, "Deleted job " + jobNo, Map.of());
      log.info("Job deleted: jobNo={}", jobNo);
    });
  }

  private static String blankToNull(String s) {
    return s == null || s.isBlank() ? null : s;
  }
}
