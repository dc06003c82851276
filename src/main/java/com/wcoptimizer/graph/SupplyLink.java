package com.wcoptimizer.graph;

public record SupplyLink(String supplierId, String productId) {
}
