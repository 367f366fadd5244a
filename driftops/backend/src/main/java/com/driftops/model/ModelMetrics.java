package com.driftops.model;

public record ModelMetrics(double accuracy, double precision, double recall, double f1) {
}
