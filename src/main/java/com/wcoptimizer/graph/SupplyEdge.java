package com.wcoptimizer.graph;

public record SupplyEdge(String supplierId, String supplierName, Double leadTime, String productId) {
}
