package com.mk.fx.qa.load.engine.dto.controllerresponse;

import java.util.UUID;

public record StopTestResponse(UUID runId, boolean stopped, String message) {}
