package com.ospicorp.surfacearea.isotherm.model;

// IUPAC physisorption isotherm classes
public enum IsothermType {
  I, II, III, IV, V, VI, UNDETERMINED
}
