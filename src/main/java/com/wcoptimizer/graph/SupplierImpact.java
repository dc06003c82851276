package com.wcoptimizer.graph;

import java.util.List;

/** The products directly supplied by one supplier. */
public record SupplierImpact(String supplierId, String supplierName, List<String> productIds) {
}
