package com.wcoptimizer.graph;

/** A supplier as held in the graph; metric fields are null when not uploaded. */
public record SupplierNode(String supplierId, String supplierName, Double leadTime, Double rating,
                           Double otdRate, String country) {
}
