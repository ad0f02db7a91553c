package com.verlumen.filtertune.params;

/** Numeric type of a filter parameter. */
public enum ParamType {
  INTEGER,
  DOUBLE
}
