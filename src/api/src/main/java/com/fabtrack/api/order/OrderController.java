package com.fabtrack.api.order;

import com.fabtrack.api.order.dto.CreateOrderRequest;
import com.fabtrack.api.order.dto.OrderDto;
import com.fabtrack.api.order.dto.UpdateOrderStatusRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/orders")
public class OrderController {

  private final OrderService service;

  @PostMapping
  public ResponseEntity<OrderDto> create(@Valid @RequestBody CreateOrderRequest req) {
    return ResponseEntity.status(HttpStatus.CREATED).body(service.create(req));
  }

  @GetMapping
  public ResponseEntity<List<OrderDto>> list() {
    return ResponseEntity.ok(service.listAll());
  }

  @GetMapping("/task/{taskId}")
  public ResponseEntity<List<OrderDto>> listByTask(@PathVariable long taskId) {
    return ResponseEntity.ok(service.listByTask(taskId));
  }

  @PutMapping("/{id}")
  public ResponseEntity<OrderDto> updateStatus(@PathVariable long id,
                                               @Valid @RequestBody UpdateOrderStatusRequest req) {
    return ResponseEntity.ok(service.updateStatus(id, req.status()));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable long id) {
    service.delete(id);
    return ResponseEntity.noContent().build();
  }
}
