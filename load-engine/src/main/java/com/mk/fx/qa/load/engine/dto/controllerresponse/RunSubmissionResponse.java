package com.mk.fx.qa.load.engine.dto.controllerresponse;

import java.util.UUID;

public record RunSubmissionResponse(UUID runId, String status, String message) {}
