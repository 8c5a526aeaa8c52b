package com.signalwatch.controller.rest;

import jakarta.validation.constraints.NotBlank;

public record ErrorReportBody(@NotBlank String sourceId, String sourceName, String errorType, String message) {}
