package com.mk.fx.qa.load.engine.cfg;

/**
 * Error body returned by the HTTP resource.
 *
 * @param error short error title
 * @param details human readable description
 */
public record ErrorResponse(String error, String details) {}
