package com.wcoptimizer.graph;

public record GraphStats(long suppliers, long products, long relationships) {
}
