package com.waypoint.core.model;

import java.io.Serializable;

/**
 * Promela source generated from a task plan, together with the symbols it declares.
 */
public record VerificationModel(String source, SymbolCatalog catalog) implements Serializable {}
