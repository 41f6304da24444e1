package com.panorama.converter.model.diagnostics;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Errors, warnings and notes accumulated during one conversion or split run.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ToolDiagnostics {
  private final List<String> errors = new ArrayList<>();
  private final List<String> warnings = new ArrayList<>();
  private final List<String> infos = new ArrayList<>();

  public void error(String message) {
	  errors.add(message);
  }

  public void warn(String message) {
	  warnings.add(message);
  }

  public void info(String message) {
	  infos.add(message);
  }

  public boolean hasErrors() {
	  return !errors.isEmpty();
  }

  public boolean hasWarnings() {
	  return !warnings.isEmpty();
  }
}
