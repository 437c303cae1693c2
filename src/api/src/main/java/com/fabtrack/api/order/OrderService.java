package com.fabtrack.api.order;

import com.fabtrack.api.activity.ActivityLogService;
import com.fabtrack.api.activity.ActivityType;
import com.fabtrack.api.activity.ResourceType;
import com.fabtrack.api.order.dto.CreateOrderRequest;
import com.fabtrack.api.order.dto.OrderDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class OrderService {

  private final OrderRepository repo;
  private final ActivityLogService activityLog;

  public OrderDto create(CreateOrderRequest req) {
    long id = repo.insert(req.taskId(), req.projectNo().trim(), req.taskTitle().trim(), req.items(),
        req.statusOrDefault(), req.categoryOrDefault());

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("taskId", req.taskId());
    details.put("projectNo", req.projectNo().trim());
    details.put("items", req.items().size());
    activityLog.record(ActivityType.CREATE, ResourceType.ORDER, id,
        "Created order for task: " + req.taskTitle().trim(), details);
    log.info("Order created: id={} taskId={} items={}", id, req.taskId(), req.items().size());
    return repo.findById(id).orElseThrow(OrderNotFoundException::new);
  }

  public List<OrderDto> listAll() {
    return repo.listAll();
  }

  public List<OrderDto> listByTask(long taskId) {
    return repo.listByTask(taskId);
  }

  public OrderDto updateStatus(long id, String status) {
    if (repo.updateStatus(id, status.trim()) == 0) {
      throw new OrderNotFoundException();
    }
    activityLog.record(ActivityType.UPDATE, ResourceType.ORDER, id,
        "Order " + id + " status updated to " + status.trim(), Map.of("status", status.trim()));
    return repo.findById(id).orElseThrow(OrderNotFoundException::new);
  }

  public void delete(long id) {
    if (repo.delete(id) == 0) {
      throw new OrderNotFoundException();
    }
    activityLog.record(ActivityType.DELETE, ResourceType.ORDER, id, "Deleted order " + id, Map.of());
  }
}
