package com.fabtrack.api.order;

public class OrderNotFoundException extends RuntimeException {

  public OrderNotFoundException() {
    super("Order not found");
  }
}
