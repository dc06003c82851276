package com.wcoptimizer.graph;

/** A product reached by exactly one supplier. */
public record SingleSource(String productId, String supplierId, String supplierName) {
}
