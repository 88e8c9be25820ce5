package com.hcltech.multiway.layout;

/** Layout coordinate: x grows to the right, y grows upwards. */
public record Point(double x, double y) {}
