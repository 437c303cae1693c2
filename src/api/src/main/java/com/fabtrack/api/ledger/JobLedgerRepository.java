package com.fabtrack.api.ledger;

import com.fabtrack.api.ledger.dto.JobDto;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JobLedgerRepository {

  private static final RowMapper<JobDto> ROW = (rs, rowNum) -> new JobDto(
      rs.getLong("record_id"),
      rs.getDate("date_entry").toLocalDate(),
      rs.getString("job_no"),
      rs.getString("customer_name"),
      rs.getBigDecimal("sales_amount"),
      rs.getBigDecimal("sell_price"),
      rs.getBigDecimal("cost"),
      rs.getBigDecimal("margin"),
      rs.getString("approval_status"),
      rs.getString("remarks"),
      SignatureCodec.encode(rs.getBytes("signature_data"))
  );

  private final JdbcTemplate jdbc;

  public List<JobDto> list() {
    return jdbc.query("select * from job_ledger order by date_entry desc, record_id desc", ROW);
  }

  public Optional<JobDto> findByJobNo(String jobNo) {
    List<JobDto> rows = jdbc.query("select * from job_ledger where job_no = ?", ROW, jobNo);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  public boolean exists(String jobNo) {
    Integer n = jdbc.queryForObject("select count(*) from job_ledger where job_no = ?", Integer.class, jobNo);
    return n != null && n > 0;
  }

  public void insert(NewJob job) {
    jdbc.update(
        """
        insert into job_ledger(
          date_entry, job_no, customer_name, sales_amount, sell_price, cost,
          margin, approval_status, remarks, signature_data
        )
        values (?,?,?,?,?,?, ?,?,?,?)
        """,
        Date.valueOf(job.dateEntry()),
        job.jobNo(),
        job.customerName(),
        job.salesAmount(),
        job.sellPrice(),
        job.cost(),
        job.margin(),
        job.approvalStatus(),
        job.remarks(),
        job.signature()
    );
  }

  public int update(String jobNo, Map<String, Object> columns) {
    List<String> sets = new ArrayList<>();
    List<Object> args = new ArrayList<>();
    for (Map.Entry<String, Object> e : columns.entrySet()) {
      sets.add(e.getKey() + " = ?");
      Object v = e.getValue();
      args.add(v instanceof LocalDate d ? Date.valueOf(d) : v);
    }
    if (sets.isEmpty()) return 0;
    args.add(jobNo);
    return jdbc.update("update job_ledger set " + String.join(", ", sets) + " where job_no = ?", args.toArray());
  }

  public int delete(String jobNo) {
    return jdbc.update("delete from job_ledger where job_no = ?", jobNo);
  }
}
