package com.ospicorp.growthcurves.growth.model;

public record CurvePoint(double time, double predictedDensity) {}
